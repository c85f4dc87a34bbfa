package exm.obli.rustbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.obli.common.Logging;
import exm.obli.common.exceptions.UserException;
import exm.obli.frontend.ObliviousWalker;
import exm.obli.frontend.SourceParser;
import exm.obli.ic.tree.ObliExpr;

public class RustGeneratorTest {

  private static String render(String source) throws UserException {
    return RustGenerator.renderExpression(
        ObliviousWalker.toOblivious(SourceParser.parse(source)));
  }

  @Test
  public void testLiterals() throws UserException {
    assertEquals("42", render("42"));
    assertEquals("false", render("false"));
    assertEquals("Secret::new(42)", render("secret(42)"));
    assertEquals("Secret::new(true)", render("secret(true)"));
  }

  @Test
  public void testOperatorsAreCalls() throws UserException {
    assertEquals("ct_add(1, 2)", render("1 + 2"));
    assertEquals("ct_or(ct_and(a, b), ct_not(ct_neg(x)))",
                 render("a and b or not -x"));
  }

  @Test
  public void testSelectEvaluatesAllArguments() throws UserException {
    assertEquals("ct_select(Secret::new(true), ct_mul(a, 2), 0)",
                 render("if secret(true) then a * 2 else 0"));
  }

  @Test
  public void testPublicIf() throws UserException {
    assertEquals("if true { 1 } else { 2 }",
                 render("if true then 1 else 2"));
  }

  @Test
  public void testLetBlock() throws UserException {
    assertEquals("{\n" +
                 "    let x = Secret::new(1);\n" +
                 "    ct_select(ct_gt(x, 0), 1, 0)\n" +
                 "}",
                 render("let x = secret(1) if x > 0 then 1 else 0"));
  }

  @Test
  public void testNestedLetIndentation() throws UserException {
    assertEquals("{\n" +
                 "    let x = 1;\n" +
                 "    {\n" +
                 "        let y = 2;\n" +
                 "        ct_mul(x, y)\n" +
                 "    }\n" +
                 "}",
                 render("let x = 1 let y = 2 x * y"));
  }

  @Test
  public void testMultiLineBranches() throws UserException {
    assertEquals("if c {\n" +
                 "    {\n" +
                 "        let y = 1;\n" +
                 "        y\n" +
                 "    }\n" +
                 "} else {\n" +
                 "    2\n" +
                 "}",
                 render("if c then let y = 1 y else 2"));
  }

  @Test
  public void testKeywordNames() throws UserException {
    assertEquals("{\n    let r#type = 1;\n    r#type\n}",
                 render("let type = 1 type"));
    assertEquals("ct_add(self_, r#match)", render("self + match"));
    assertEquals("value", RustNamer.rustName("value"));
  }

  @Test
  public void testProgram() throws UserException {
    RustGenerator gen = new RustGenerator(Logging.getObliLogger(),
                                          "now", false);
    gen.header();
    gen.mainFunction(ObliviousWalker.toOblivious(
                          SourceParser.parse("let x = 1 x")));
    assertEquals("use obli_runtime::*;\n" +
                 "\n" +
                 "fn main() {\n" +
                 "    let result = {\n" +
                 "        let x = 1;\n" +
                 "        x\n" +
                 "    };\n" +
                 "    println!(\"{:?}\", result);\n" +
                 "}\n",
                 gen.code());
  }

  @Test
  public void testHeader() {
    RustGenerator gen = new RustGenerator(Logging.getObliLogger(),
                                          "2024-01-01T00:00:00", true);
    gen.header();
    gen.mainFunction(ObliExpr.createSecretInt(5));
    String code = gen.code();
    assertTrue(code, code.startsWith("// Generated by obli "));
    assertTrue(code, code.contains("// date: 2024-01-01T00:00:00\n"));
    assertTrue(code, code.contains("// secrecy: scoped, forcing: total\n"));
    assertTrue(code, code.contains("\nuse obli_runtime::*;\n"));
    assertTrue(code, code.contains("    let result = Secret::new(5);\n"));
  }
}
