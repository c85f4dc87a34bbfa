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

import exm.obli.ast.Expr;
import exm.obli.common.Logging;
import exm.obli.common.Settings;
import exm.obli.common.exceptions.InvalidOptionException;
import exm.obli.common.exceptions.ObliRuntimeError;
import exm.obli.common.lang.Operators;
import exm.obli.ic.tree.ObliExpr;

/**
 * Walks a MiniObli expression tree and builds the equivalent oblivious
 * intermediate code.
 *
 * Secrecy flows bottom-up: a node is secret if anything it is computed
 * from is secret, and a let-bound name is secret if its value is.
 * Conditionals on a secret condition are rewritten into ct_select, with
 * both branches translated and therefore always evaluated.  Conditionals
 * on a public condition keep ordinary control flow.
 *
 * The walker is total: any tree the parser can build is translated.
 */
public class ObliviousWalker {

  /** Open a new secrecy scope for let bodies and if branches */
  private final boolean scopedSecrecy;

  /** secret(...) forces secrecy onto every node shape */
  private final boolean totalForcing;

  public ObliviousWalker(boolean scopedSecrecy, boolean totalForcing) {
    this.scopedSecrecy = scopedSecrecy;
    this.totalForcing = totalForcing;
  }

  /**
   * Walker with scoped secrecy and total forcing
   */
  public ObliviousWalker() {
    this(true, true);
  }

  /**
   * @return walker configured from {@link Settings}
   * @throws InvalidOptionException
   */
  public static ObliviousWalker fromSettings() throws InvalidOptionException {
    return new ObliviousWalker(Settings.getBoolean(Settings.SECRECY_SCOPED),
                       Settings.getBoolean(Settings.SECRECY_TOTAL_FORCING));
  }

  /**
   * Translate with default options
   */
  public static ObliExpr toOblivious(Expr tree) {
    return new ObliviousWalker().walk(tree);
  }

  /**
   * Translate one source tree.  Each call gets a fresh secrecy context,
   * so repeated calls on the same tree give equal results.
   */
  public ObliExpr walk(Expr tree) {
    SecrecyContext context = SecrecyContext.create(scopedSecrecy);
    ObliExpr result = walkExpr(context, tree, 0);
    if (LogHelper.isDebugEnabled()) {
      LogHelper.debug(0, "oblivious: " + result);
    }
    return result;
  }

  private ObliExpr walkExpr(SecrecyContext context, Expr tree, int depth) {
    LogHelper.trace(depth, "walk " + tree.kind);
    switch (tree.kind) {
      case INT:
        return ObliExpr.createPubInt(tree.getIntLit());
      case BOOL:
        return ObliExpr.createPubBool(tree.getBoolLit());
      case VAR:
        return ObliExpr.createVar(tree.getName(),
                                  context.isSecret(tree.getName()));
      case SECRET:
        return secretExpr(context, tree, depth);
      case BINARY_OP:
        return binaryOp(context, tree, depth);
      case UNARY_OP:
        return unaryOp(context, tree, depth);
      case IF:
        return conditional(context, tree, depth);
      case LET:
        return let(context, tree, depth);
      default:
        throw new ObliRuntimeError("Unexpected expression kind: "
                                   + tree.kind);
    }
  }

  private ObliExpr secretExpr(SecrecyContext context, Expr tree,
                              int depth) {
    Expr inner = tree.getInner();
    // Literals fold straight into secret literals
    switch (inner.kind) {
      case INT:
        return ObliExpr.createSecretInt(inner.getIntLit());
      case BOOL:
        return ObliExpr.createSecretBool(inner.getBoolLit());
      default:
        return forceSecret(walkExpr(context, inner, depth + 1));
    }
  }

  private ObliExpr binaryOp(SecrecyContext context, Expr tree, int depth) {
    ObliExpr left = walkExpr(context, tree.getLeft(), depth + 1);
    ObliExpr right = walkExpr(context, tree.getRight(), depth + 1);
    return ObliExpr.createBinaryOp(
            Operators.toConstantTime(tree.getBinaryOp()), left, right,
            left.isSecret() || right.isSecret());
  }

  private ObliExpr unaryOp(SecrecyContext context, Expr tree, int depth) {
    ObliExpr operand = walkExpr(context, tree.getOperand(), depth + 1);
    return ObliExpr.createUnaryOp(
            Operators.toConstantTime(tree.getUnaryOp()), operand,
            operand.isSecret());
  }

  private ObliExpr conditional(SecrecyContext context, Expr tree,
                               int depth) {
    ObliExpr cond = walkExpr(context, tree.getCondition(), depth + 1);
    ObliExpr thenVal = walkExpr(context.enterScope(), tree.getThenBranch(),
                                depth + 1);
    ObliExpr elseVal = walkExpr(context.enterScope(), tree.getElseBranch(),
                                depth + 1);

    if (cond.isSecret()) {
      if (LogHelper.isDebugEnabled()) {
        LogHelper.debug(depth, "secret condition " + cond +
                               ": rewriting if to ct_select");
      }
      return ObliExpr.createCtSelect(cond, thenVal, elseVal);
    } else {
      if (LogHelper.isTraceEnabled()) {
        LogHelper.trace(depth, "public condition " + cond + ": keeping if");
      }
      return ObliExpr.createPubIf(cond, thenVal, elseVal);
    }
  }

  private ObliExpr let(SecrecyContext context, Expr tree, int depth) {
    ObliExpr value = walkExpr(context, tree.getValue(), depth + 1);
    boolean secret = value.isSecret();

    SecrecyContext bodyContext = context.enterScope();
    if (secret) {
      bodyContext.markSecret(tree.getName());
    }
    ObliExpr body = walkExpr(bodyContext, tree.getBody(), depth + 1);

    return ObliExpr.createLet(tree.getName(), value, body, secret);
  }

  /**
   * Rebuild an already-translated node so that it reads as secret.
   * In partial mode conditionals, lets and selections come back as they
   * were, so secret(...) around them has no effect.
   */
  ObliExpr forceSecret(ObliExpr expr) {
    switch (expr.kind) {
      case PUB_INT:
        return ObliExpr.createSecretInt(expr.getIntLit());
      case PUB_BOOL:
        return ObliExpr.createSecretBool(expr.getBoolLit());
      case SECRET_INT:
      case SECRET_BOOL:
        return expr;
      case VAR:
        return ObliExpr.createVar(expr.getName(), true);
      case BINARY_OP:
        return ObliExpr.createBinaryOp(expr.getBinaryOp(), expr.getLeft(),
                                       expr.getRight(), true);
      case UNARY_OP:
        return ObliExpr.createUnaryOp(expr.getUnaryOp(), expr.getOperand(),
                                      true);
      case CT_SELECT:
        // Already secret
        return expr;
      case PUB_IF:
        if (!totalForcing) {
          return partialForcingGap(expr);
        }
        return ObliExpr.createPubIf(expr.getCondition(),
                forceSecret(expr.getThen()), forceSecret(expr.getElse()),
                true);
      case LET:
        if (!totalForcing) {
          return partialForcingGap(expr);
        }
        return ObliExpr.createLet(expr.getName(), expr.getValue(),
                                  forceSecret(expr.getBody()), true);
      default:
        throw new ObliRuntimeError("Unexpected node kind: " + expr.kind);
    }
  }

  private ObliExpr partialForcingGap(ObliExpr expr) {
    if (!expr.isSecret()) {
      Logging.uniqueWarn("secret(...) has no effect on " +
            expr.kind.toString().toLowerCase() + " expression " + expr +
            " (obli.secrecy.total-forcing is off)");
    }
    return expr;
  }

  public boolean isScopedSecrecy() {
    return scopedSecrecy;
  }

  public boolean isTotalForcing() {
    return totalForcing;
  }
}
