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
 * Block expression binding one name:
 * <pre>
 * {
 *     let x = v;
 *     body
 * }
 * </pre>
 */
public class LetBlock extends Expression
{
  private final Binding binding;
  private final Expression body;

  public LetBlock(String name, Expression value, Expression body)
  {
    this.binding = new Binding(name, value);
    this.body = body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append("{\n");
    increaseIndent();
    binding.setIndentation(indentation);
    binding.appendTo(sb);
    indent(sb);
    appendChild(sb, body);
    sb.append('\n');
    decreaseIndent();
    indent(sb);
    sb.append('}');
  }

  @Override
  public boolean isMultiLine()
  {
    return true;
  }
}
