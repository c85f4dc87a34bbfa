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

package exm.obli.common.exceptions;

/**
 * Parser found a token that cannot continue the current construct
 */
public class UnexpectedTokenException extends InvalidSyntaxException {

  private static final long serialVersionUID = 1L;

  private final String token;
  private final int position;
  private final String expected;

  /**
   * @param token text of the offending token
   * @param position character offset of the token
   * @param expected description of what the parser was looking for
   */
  public UnexpectedTokenException(String token, int position,
                                  String expected) {
    super("unexpected token: '" + token + "' at position " + position +
          ", expected " + expected);
    this.token = token;
    this.position = position;
    this.expected = expected;
  }

  public String getToken() {
    return token;
  }

  public int getPosition() {
    return position;
  }

  public String getExpected() {
    return expected;
  }
}
