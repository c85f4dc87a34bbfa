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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.obli.common.exceptions.ObliRuntimeError;

/**
 * Rust function definition
 */
public class FnDef extends RustTree
{
  String name;
  List<String> params;
  Sequence body;

  public FnDef(String name, List<String> params, Sequence body)
  {
    checkRustFunctionName(name);
    this.name = name;
    this.params = params;
    this.body = body;
  }

  /**
   * Check that there are no invalid characters
   */
  private static void checkRustFunctionName(String name) {
    if (name.length() == 0) {
      throw new ObliRuntimeError("Empty rust function name");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetter(c) || c == '_' ||
          (i > 0 && Character.isDigit(c))) {
        // Whitelist of characters
      } else {
        throw new ObliRuntimeError("Bad character '" + c +
                                  "' in rust function name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("fn ");
    sb.append(name);
    sb.append("(");
    sb.append(StringUtils.join(params, ", "));
    sb.append(") {\n");
    body.setIndentation(indentation + indentWidth);
    body.appendTo(sb);
    indent(sb);
    sb.append("}\n");
  }
}
