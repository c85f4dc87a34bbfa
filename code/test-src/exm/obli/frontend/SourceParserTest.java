package exm.obli.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.obli.ast.Expr;
import exm.obli.common.Logging;
import exm.obli.common.exceptions.InvalidNumberException;
import exm.obli.common.exceptions.UnexpectedCharException;
import exm.obli.common.exceptions.UnexpectedEofException;
import exm.obli.common.exceptions.UnexpectedTokenException;
import exm.obli.common.exceptions.UserException;

public class SourceParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SourceParserTest.obli.log", true);
  }

  private static String parse(String source) throws UserException {
    return SourceParser.parse(source).toString();
  }

  @Test
  public void testLiterals() throws UserException {
    assertEquals(Expr.createInt(42), SourceParser.parse("42"));
    assertEquals(Expr.createBool(true), SourceParser.parse("true"));
    assertEquals(Expr.createVar("x_1"), SourceParser.parse("x_1"));
    assertEquals(Expr.createInt(Long.MAX_VALUE),
                 SourceParser.parse("9223372036854775807"));
  }

  @Test
  public void testPrecedence() throws UserException {
    assertEquals("(1 + (2 * 3))", parse("1 + 2 * 3"));
    assertEquals("((1 + 2) * 3)", parse("(1 + 2) * 3"));
    assertEquals("(a or (b and c))", parse("a or b and c"));
    assertEquals("((a and b) or c)", parse("a && b || c"));
    assertEquals("((x + 1) < (y % 2))", parse("x + 1 < y % 2"));
    assertEquals("((not a) == b)", parse("!a == b"));
    assertEquals("((-x) * 2)", parse("-x * 2"));
    assertEquals("(not (not a))", parse("not not a"));
  }

  @Test
  public void testLeftAssociative() throws UserException {
    assertEquals("((1 - 2) - 3)", parse("1 - 2 - 3"));
    assertEquals("((8 / 4) / 2)", parse("8 / 4 / 2"));
  }

  @Test
  public void testLetAndIf() throws UserException {
    assertEquals("(let x = 1 (x + 1))", parse("let x = 1 x + 1"));
    assertEquals("(if a then 1 else 2)", parse("if a then 1 else 2"));
    assertEquals("(let x = secret(1) (if (x > 0) then 1 else 0))",
                 parse("let x = secret(1) if x > 0 then 1 else 0"));
    assertEquals("(let x = 1 (let y = 2 (x * y)))",
                 parse("let x = 1 let y = 2 x * y"));
  }

  @Test
  public void testMinusContinuesLetValue() throws UserException {
    assertEquals("(let x = (5 - 1) x)", parse("let x = 5 - 1 x"));
    assertEquals("(let x = (5 - 1) x)", parse("let x = 5 -1 x"));
    assertEquals("(let x = y (x - 1))", parse("let x = y x - 1"));
  }

  @Test
  public void testCommentsAndWhitespace() throws UserException {
    assertEquals("secret(42)", parse("# a comment\n  secret( 42 ) # more"));
    assertEquals("(a <= b)", parse("a\t<=\r\nb"));
  }

  @Test
  public void testKeywordPrefixIsIdentifier() throws UserException {
    assertEquals("(letter + nothing)", parse("letter + nothing"));
  }

  @Test
  public void testUnexpectedCharacter() throws UserException {
    exception.expect(UnexpectedCharException.class);
    exception.expectMessage("unexpected character: '$' at position 4");
    SourceParser.parse("1 + $");
  }

  @Test
  public void testLoneAmpersand() throws UserException {
    try {
      SourceParser.parse("a & b");
      fail("expected lexical error");
    } catch (UnexpectedCharException e) {
      assertEquals('&', e.getCharacter());
      assertEquals(2, e.getPosition());
    }
  }

  @Test
  public void testLexicalErrorReportedFirst() throws UserException {
    // "1 2" alone would be a syntax error
    exception.expect(UnexpectedCharException.class);
    SourceParser.parse("1 2 @");
  }

  @Test
  public void testNumberOutOfRange() throws UserException {
    exception.expect(InvalidNumberException.class);
    exception.expectMessage("invalid number at position 4");
    SourceParser.parse("1 + 99999999999999999999");
  }

  @Test
  public void testTrailingToken() throws UserException {
    exception.expect(UnexpectedTokenException.class);
    exception.expectMessage(
        "unexpected token: '2' at position 2, expected end of input");
    SourceParser.parse("1 2");
  }

  @Test
  public void testComparisonDoesNotChain() throws UserException {
    try {
      SourceParser.parse("1 < 2 < 3");
      fail("expected syntax error");
    } catch (UnexpectedTokenException e) {
      assertEquals("<", e.getToken());
      assertEquals(6, e.getPosition());
    }
  }

  @Test
  public void testMissingElse() throws UserException {
    try {
      SourceParser.parse("if a then 1 2");
      fail("expected syntax error");
    } catch (UnexpectedTokenException e) {
      assertEquals("2", e.getToken());
      assertEquals(12, e.getPosition());
      assertEquals("'else'", e.getExpected());
    }
  }

  @Test
  public void testLetWithoutName() throws UserException {
    exception.expect(UnexpectedTokenException.class);
    exception.expectMessage("expected identifier");
    SourceParser.parse("let = 1 2");
  }

  @Test
  public void testSecretNeedsParens() throws UserException {
    exception.expect(UnexpectedTokenException.class);
    exception.expectMessage("expected '('");
    SourceParser.parse("secret 1");
  }

  @Test
  public void testUnexpectedEnd() throws UserException {
    exception.expect(UnexpectedEofException.class);
    exception.expectMessage("unexpected end of input");
    SourceParser.parse("1 +");
  }

  @Test
  public void testUnclosedParen() throws UserException {
    exception.expect(UnexpectedEofException.class);
    SourceParser.parse("(1 + 2");
  }

  @Test
  public void testEmptyInput() throws UserException {
    exception.expect(UnexpectedEofException.class);
    SourceParser.parse("  # nothing here");
  }
}
