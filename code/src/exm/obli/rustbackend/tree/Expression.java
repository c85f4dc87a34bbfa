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
 * A Rust expression.  Expressions are written inline, starting at the
 * current position in the output with no trailing newline.  Any lines
 * they open are indented relative to their own indentation.
 */
public abstract class Expression extends RustTree
{
  /**
   * Append a sub-expression at the same indentation as this one
   * @param sb
   * @param child
   */
  protected void appendChild(StringBuilder sb, Expression child)
  {
    child.setIndentation(indentation);
    child.appendTo(sb);
  }

  /**
   * @return true if the rendered text may span several lines
   */
  public abstract boolean isMultiLine();
}
