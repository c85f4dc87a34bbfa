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
package exm.obli.frontend;

import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonToken;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.MismatchedTokenException;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;

import exm.obli.ast.Expr;
import exm.obli.ast.antlr.MiniObliLexer;
import exm.obli.ast.antlr.MiniObliLexer.LexerFailure;
import exm.obli.ast.antlr.MiniObliParser;
import exm.obli.common.exceptions.InvalidNumberException;
import exm.obli.common.exceptions.UnexpectedCharException;
import exm.obli.common.exceptions.UnexpectedEofException;
import exm.obli.common.exceptions.UnexpectedTokenException;
import exm.obli.common.exceptions.UserException;

/**
 * Turns MiniObli source text into an expression tree.
 *
 * The whole input is tokenized before parsing starts, so a lexical error
 * anywhere in the input is reported ahead of any syntax error.
 * Positions in error messages are character offsets from the start of
 * the input, counting from 0.
 */
public class SourceParser {

  /**
   * Parse a complete program: exactly one expression followed by the
   * end of input.
   * @param source program text
   * @return the expression tree
   * @throws UserException on the first lexical or syntax error
   */
  public static Expr parse(String source) throws UserException {
    CommonTokenStream tokens = tokenize(source);
    MiniObliParser parser = new MiniObliParser(tokens);

    Expr program;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      throw syntaxError(e);
    }
    if (LogHelper.isDebugEnabled()) {
      LogHelper.debug(0, "parsed: " + program);
    }
    return program;
  }

  /**
   * Run the lexer over all input and check integer literals
   */
  private static CommonTokenStream tokenize(String source)
      throws UserException {
    MiniObliLexer lexer = new MiniObliLexer(new ANTLRStringStream(source));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    try {
      tokens.fill();
    } catch (LexerFailure e) {
      throw new UnexpectedCharException(e.character, e.position);
    }

    List<? extends Token> all = tokens.getTokens();
    for (Token t: all) {
      if (t.getType() == MiniObliLexer.INT) {
        checkIntLiteral(t);
      }
    }
    LogHelper.trace(0, "tokens: " + all.size());
    return tokens;
  }

  private static void checkIntLiteral(Token t)
      throws InvalidNumberException {
    try {
      Long.parseLong(t.getText());
    } catch (NumberFormatException e) {
      throw new InvalidNumberException(startIndex(t));
    }
  }

  private static UserException syntaxError(RecognitionException e) {
    Token tok = e.token;
    if (tok == null || tok.getType() == Token.EOF) {
      return new UnexpectedEofException();
    }
    String expected;
    if (e instanceof MismatchedTokenException) {
      expected = describeToken(((MismatchedTokenException)e).expecting);
    } else {
      expected = "expression";
    }
    return new UnexpectedTokenException(tok.getText(), startIndex(tok),
                                        expected);
  }

  private static int startIndex(Token t) {
    if (t instanceof CommonToken) {
      return ((CommonToken)t).getStartIndex();
    }
    return t.getCharPositionInLine();
  }

  /**
   * @param type token type from the generated lexer
   * @return how the token is described to the user
   */
  static String describeToken(int type) {
    switch (type) {
      case Token.EOF:
        return "end of input";
      case MiniObliParser.ID:
        return "identifier";
      case MiniObliParser.INT:
        return "integer";
      case MiniObliParser.ASSIGN:
        return "'='";
      case MiniObliParser.LPAREN:
        return "'('";
      case MiniObliParser.RPAREN:
        return "')'";
      case MiniObliParser.THEN:
        return "'then'";
      case MiniObliParser.ELSE:
        return "'else'";
      default:
        if (type > 0 && type < MiniObliParser.tokenNames.length) {
          return MiniObliParser.tokenNames[type];
        }
        return "token " + type;
    }
  }
}
