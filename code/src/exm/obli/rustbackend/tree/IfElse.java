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

/**
 * If-else expression: if c { a } else { b }
 *
 * Only one branch is evaluated at run time.  Branches that span several
 * lines are moved onto their own lines.
 * */
public class IfElse extends Expression
{
  private final Expression condition;
  private final Expression thenValue;
  private final Expression elseValue;

  public IfElse(Expression condition, Expression thenValue,
                Expression elseValue)
  {
    this.condition = condition;
    this.thenValue = thenValue;
    this.elseValue = elseValue;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append("if ");
    appendChild(sb, condition);
    if (thenValue.isMultiLine() || elseValue.isMultiLine()) {
      sb.append(" {\n");
      appendBranch(sb, thenValue);
      sb.append("} else {\n");
      appendBranch(sb, elseValue);
      sb.append("}");
    } else {
      sb.append(" { ");
      appendChild(sb, thenValue);
      sb.append(" } else { ");
      appendChild(sb, elseValue);
      sb.append(" }");
    }
  }

  private void appendBranch(StringBuilder sb, Expression branch)
  {
    increaseIndent();
    indent(sb);
    appendChild(sb, branch);
    sb.append('\n');
    decreaseIndent();
    indent(sb);
  }

  @Override
  public boolean isMultiLine()
  {
    return condition.isMultiLine() || thenValue.isMultiLine() ||
           elseValue.isMultiLine();
  }
}
