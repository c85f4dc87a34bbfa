package exm.obli.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.obli.common.exceptions.ObliRuntimeError;
import exm.obli.common.lang.Operators.BinaryOp;
import exm.obli.common.lang.Operators.UnaryOp;

public class ExprTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testContainsSecret() {
    Expr plain = Expr.createBinaryOp(BinaryOp.ADD, Expr.createInt(1),
                                     Expr.createVar("x"));
    assertFalse(plain.containsSecret());

    Expr nested = Expr.createLet("x", Expr.createInt(1),
        Expr.createIf(Expr.createVar("c"),
                      Expr.createSecret(Expr.createInt(2)),
                      Expr.createInt(3)));
    assertTrue("secret inside if branch inside let body",
               nested.containsSecret());
  }

  @Test
  public void testToString() {
    Expr e = Expr.createLet("x", Expr.createSecret(Expr.createInt(42)),
        Expr.createIf(
            Expr.createUnaryOp(UnaryOp.NOT, Expr.createVar("x")),
            Expr.createUnaryOp(UnaryOp.NEGATE, Expr.createInt(1)),
            Expr.createBool(false)));
    assertEquals("(let x = secret(42) (if (not x) then (-1) else false))",
                 e.toString());
  }

  @Test
  public void testEquality() {
    Expr a = Expr.createBinaryOp(BinaryOp.MUL, Expr.createVar("a"),
                                 Expr.createInt(2));
    Expr b = Expr.createBinaryOp(BinaryOp.MUL, Expr.createVar("a"),
                                 Expr.createInt(2));
    Expr c = Expr.createBinaryOp(BinaryOp.DIV, Expr.createVar("a"),
                                 Expr.createInt(2));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  public void testChildrenInSourceOrder() {
    Expr cond = Expr.createVar("c");
    Expr t = Expr.createInt(1);
    Expr f = Expr.createInt(2);
    Expr e = Expr.createIf(cond, t, f);
    assertEquals(3, e.getChildren().size());
    assertEquals(cond, e.getChildren().get(0));
    assertEquals(f, e.getChildren().get(2));
    assertTrue(Expr.createInt(0).getChildren().isEmpty());
  }

  @Test
  public void testWrongKindAccessor() {
    exception.expect(ObliRuntimeError.class);
    Expr.createInt(1).getCondition();
  }
}
