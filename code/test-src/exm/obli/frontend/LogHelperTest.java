package exm.obli.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import exm.obli.common.Logging;
import exm.obli.common.exceptions.UserException;
import exm.obli.ic.tree.ObliExpr;
import exm.obli.ic.tree.ObliExpr.ObliKind;

public class LogHelperTest {

  private final Logger logger = Logging.getObliLogger();

  private Level savedLevel;

  @Before
  public void saveLevel() {
    savedLevel = logger.getLevel();
  }

  @After
  public void restoreLevel() {
    logger.setLevel(savedLevel);
  }

  @Test
  public void testLevelChecks() {
    logger.setLevel(Level.WARN);
    assertFalse(LogHelper.isDebugEnabled());
    assertFalse(LogHelper.isTraceEnabled());

    logger.setLevel(Level.DEBUG);
    assertTrue(LogHelper.isDebugEnabled());
    assertFalse(LogHelper.isTraceEnabled());

    logger.setLevel(Level.TRACE);
    assertTrue(LogHelper.isDebugEnabled());
    assertTrue(LogHelper.isTraceEnabled());
  }

  /**
   * Nested conditionals translate the same way with logging off
   */
  @Test
  public void testNestedConditionalsQuiet() throws UserException {
    logger.setLevel(Level.WARN);
    int depth = 50;
    StringBuilder src = new StringBuilder("let s = secret(1) ");
    for (int i = 0; i < depth; i++) {
      src.append("if s == ").append(i).append(" then ").append(i)
         .append(" else ");
    }
    src.append("0");

    ObliExpr result = ObliviousWalker.toOblivious(
                              SourceParser.parse(src.toString()));
    ObliExpr sel = result.getBody();
    for (int i = 0; i < depth; i++) {
      assertEquals(ObliKind.CT_SELECT, sel.kind);
      sel = sel.getElse();
    }
    assertEquals(ObliKind.PUB_INT, sel.kind);
  }
}
