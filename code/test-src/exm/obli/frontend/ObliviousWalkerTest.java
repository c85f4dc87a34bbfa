package exm.obli.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.obli.ast.Expr;
import exm.obli.common.Logging;
import exm.obli.common.exceptions.UserException;
import exm.obli.common.lang.Operators.BinaryOp;
import exm.obli.ic.tree.ObliExpr;
import exm.obli.ic.tree.ObliExpr.ObliKind;

public class ObliviousWalkerTest {

  private static final ObliviousWalker SCOPED_TOTAL =
                                  new ObliviousWalker(true, true);
  private static final ObliviousWalker SCOPED_PARTIAL =
                                  new ObliviousWalker(true, false);
  private static final ObliviousWalker FLAT_TOTAL =
                                  new ObliviousWalker(false, true);

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ObliviousWalkerTest.obli.log", true);
  }

  private static ObliExpr walk(ObliviousWalker walker, String source)
      throws UserException {
    return walker.walk(SourceParser.parse(source));
  }

  private static ObliExpr walk(String source) throws UserException {
    return walk(SCOPED_TOTAL, source);
  }

  private static void assertAllPublic(ObliExpr expr) {
    assertFalse(expr.toString(), expr.isSecret());
    for (ObliExpr child: expr.getChildren()) {
      assertAllPublic(child);
    }
  }

  /**
   * No node of the result may be a public conditional on a secret
   * condition
   */
  private static void assertNoSecretBranching(ObliExpr expr) {
    if (expr.kind == ObliKind.PUB_IF) {
      assertFalse(expr.toString(), expr.getCondition().isSecret());
    }
    for (ObliExpr child: expr.getChildren()) {
      assertNoSecretBranching(child);
    }
  }

  @Test
  public void testPublicArithmetic() throws UserException {
    ObliExpr result = walk("1 + 2");
    assertEquals(ObliKind.BINARY_OP, result.kind);
    assertEquals("(ct_add 1 2)", result.toString());
    assertFalse(result.isSecret());
  }

  @Test
  public void testSecretLiteral() throws UserException {
    assertEquals(ObliExpr.createSecretInt(42), walk("secret(42)"));
    assertEquals(ObliExpr.createSecretBool(false), walk("secret(false)"));
  }

  @Test
  public void testNoSecretGivesAllPublic() throws UserException {
    ObliExpr result = walk(
        "let a = 3 let b = -a if a < b and not false " +
        "then (if b == 0 then a * b else a % 2) else a / b");
    assertAllPublic(result);
  }

  @Test
  public void testSecretPropagatesThroughOperators() throws UserException {
    ObliExpr result = walk("1 + secret(2) * 3");
    assertEquals("(ct_add! 1 (ct_mul! secret(2) 3))", result.toString());

    ObliExpr neg = walk("not secret(true)");
    assertEquals("(ct_not! secret(true))", neg.toString());
    assertTrue(neg.isSecret());
  }

  @Test
  public void testSecretConditionBecomesSelect() throws UserException {
    ObliExpr result =
          walk("let x = secret(1) if x > 0 then 1 else 0");
    assertEquals(ObliKind.LET, result.kind);
    assertTrue(result.isSecret());
    ObliExpr body = result.getBody();
    assertEquals(ObliKind.CT_SELECT, body.kind);
    assertTrue(body.isSecret());
    assertEquals("(let! x secret(1) (ct_select (ct_gt! x! 0) 1 0))",
                 result.toString());
  }

  @Test
  public void testPublicConditionKept() throws UserException {
    ObliExpr result = walk("let x = 1 if x > 0 then 1 else 0");
    assertEquals(ObliKind.PUB_IF, result.getBody().kind);
    assertEquals("(let x 1 (if (ct_gt x 0) 1 0))", result.toString());
  }

  @Test
  public void testPublicConditionFlagIsOrOfBranches() throws UserException {
    ObliExpr thenSecret = walk("if true then secret(1) else 2");
    assertEquals(ObliKind.PUB_IF, thenSecret.kind);
    assertTrue(thenSecret.isSecret());

    ObliExpr elseSecret = walk("if c then 1 else secret(2)");
    assertTrue(elseSecret.isSecret());

    assertFalse(walk("if c then 1 else 2").isSecret());
  }

  @Test
  public void testNestedSecretConditions() throws UserException {
    ObliExpr result = walk(
        "let s = secret(5) " +
        "if s > 1 then (if true then s else 0) else (if s < 0 then 1 else 2)");
    assertEquals(ObliKind.CT_SELECT, result.getBody().kind);
    assertNoSecretBranching(result);
    // Public inner condition stays a branch, but carries the secret value
    ObliExpr thenVal = result.getBody().getThen();
    assertEquals(ObliKind.PUB_IF, thenVal.kind);
    assertTrue(thenVal.isSecret());
    assertEquals(ObliKind.CT_SELECT, result.getBody().getElse().kind);
  }

  @Test
  public void testSecretExpressionAroundVariable() throws UserException {
    ObliExpr result = walk("let x = 1 secret(x + 1)");
    assertEquals("(let x 1 (ct_add! x 1))", result.toString());
    // The binding itself is public: its value was
    assertFalse(result.isSecret());
  }

  @Test
  public void testTotalForcingOfConditional() throws UserException {
    ObliExpr result = walk(SCOPED_TOTAL, "secret(if true then 1 else 2)");
    assertEquals(ObliKind.PUB_IF, result.kind);
    assertTrue(result.isSecret());
    assertEquals(ObliExpr.createSecretInt(1), result.getThen());
    assertEquals(ObliExpr.createSecretInt(2), result.getElse());
    assertFalse("condition is not forced", result.getCondition().isSecret());
  }

  @Test
  public void testPartialForcingLeavesConditional() throws UserException {
    ObliExpr result = walk(SCOPED_PARTIAL, "secret(if true then 1 else 2)");
    assertEquals("(if true 1 2)", result.toString());
    assertFalse(result.isSecret());
  }

  @Test
  public void testForcingNestedNodes() throws UserException {
    assertEquals("(if! true (if! false secret(1) secret(2)) secret(3))",
        walk("secret(if true then (if false then 1 else 2) else 3)")
            .toString());
    assertEquals("(let! x 1 x!)", walk("secret(let x = 1 x)").toString());
    assertEquals("(let x 1 x)",
                 walk(SCOPED_PARTIAL, "secret(let x = 1 x)").toString());
  }

  @Test
  public void testForcingSelectUnchanged() throws UserException {
    assertEquals("(ct_select secret(true) 1 2)",
                 walk("secret(if secret(true) then 1 else 2)").toString());
  }

  @Test
  public void testForcingIsIdempotent() throws UserException {
    ObliExpr once = walk("secret(if true then 1 else 2)");
    assertEquals(once, SCOPED_TOTAL.forceSecret(once));
  }

  @Test
  public void testScopedMarkDoesNotLeak() throws UserException {
    String source = "(if c then let s = secret(1) s else 0) + s";
    ObliExpr scoped = walk(SCOPED_TOTAL, source);
    assertEquals(ObliKind.BINARY_OP, scoped.kind);
    assertFalse("s is unbound here", scoped.getRight().isSecret());

    ObliExpr flat = walk(FLAT_TOTAL, source);
    assertTrue("flat marks survive the let", flat.getRight().isSecret());
  }

  @Test
  public void testScopedMarkNotSeenBySibling() throws UserException {
    String source = "if c then (let s = secret(1) s) else s";
    assertFalse(walk(SCOPED_TOTAL, source).getElse().isSecret());
    assertTrue(walk(FLAT_TOTAL, source).getElse().isSecret());
  }

  @Test
  public void testPublicRebindingStaysSecret() throws UserException {
    // Marks are never removed, so shadowing cannot hide a secret
    ObliExpr result = walk("let x = secret(1) let x = 2 x");
    ObliExpr inner = result.getBody();
    assertFalse(inner.isSecret());
    assertTrue(inner.getBody().isSecret());
  }

  @Test
  public void testDeterministic() throws UserException {
    Expr tree = SourceParser.parse(
        "let k = secret(7) let m = k * 3 if m == 21 then k else -k");
    ObliviousWalker walker = new ObliviousWalker();
    ObliExpr first = walker.walk(tree);
    ObliExpr second = walker.walk(tree);
    assertEquals(first, second);
    assertEquals(first, ObliviousWalker.toOblivious(tree));
  }

  @Test
  public void testWalkBuiltTree() {
    Expr tree = Expr.createBinaryOp(BinaryOp.AND,
                    Expr.createSecret(Expr.createBool(true)),
                    Expr.createVar("flag"));
    ObliExpr result = ObliviousWalker.toOblivious(tree);
    assertEquals("(ct_and! secret(true) flag)", result.toString());
    assertNotEquals(result, ObliviousWalker.toOblivious(
        Expr.createBinaryOp(BinaryOp.AND, Expr.createBool(true),
                            Expr.createVar("flag"))));
  }

  @Test
  public void testDefaultsFromSettings() throws Exception {
    ObliviousWalker walker = ObliviousWalker.fromSettings();
    assertTrue(walker.isScopedSecrecy());
    assertTrue(walker.isTotalForcing());
    assertSame(ObliKind.PUB_INT, walker.walk(Expr.createInt(1)).kind);
  }
}
