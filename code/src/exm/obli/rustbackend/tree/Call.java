/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.obli.rustbackend.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Rust function call, e.g., ct_add(a, b)
 * */
public class Call extends Expression
{
  private final Token function;
  private final List<Expression> args;

  public Call(Token function, List<? extends Expression> args)
  {
    this.function = function;
    this.args = new ArrayList<Expression>(args);
  }

  public static Call fnCall(String fnName, Expression... args) {
    return fnCall(new Token(fnName), Arrays.asList(args));
  }

  public static Call fnCall(Token fn, List<? extends Expression> args) {
    return new Call(fn, args);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    function.appendTo(sb);
    sb.append('(');
    Iterator<Expression> it = args.iterator();
    while (it.hasNext())
    {
      appendChild(sb, it.next());
      if (it.hasNext())
        sb.append(", ");
    }
    sb.append(')');
  }

  @Override
  public boolean isMultiLine()
  {
    for (Expression arg: args) {
      if (arg.isMultiLine())
        return true;
    }
    return false;
  }
}
