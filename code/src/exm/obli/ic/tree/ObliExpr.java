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
package exm.obli.ic.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.obli.common.exceptions.ObliRuntimeError;
import exm.obli.common.lang.Operators.CtBinaryOp;
import exm.obli.common.lang.Operators.CtUnaryOp;

/**
 * Oblivious intermediate code: an expression tree in which every
 * operation is constant-time and no branch depends on a secret.
 *
 * Each node records at construction whether its value depends on secret
 * data.  That flag is never recomputed from the children afterwards:
 * {@link #isSecret()} is the definitive answer.  A CT_SELECT node is
 * always secret.
 */
public class ObliExpr {

  public static enum ObliKind {
    /** Public literals */
    PUB_INT, PUB_BOOL,
    /** Literals known at compile time but flagged secret */
    SECRET_INT, SECRET_BOOL,
    VAR,
    BINARY_OP, UNARY_OP,
    /** Constant-time selection: both values always evaluated */
    CT_SELECT,
    /** Ordinary branch, condition proven public */
    PUB_IF,
    LET;
  }

  public final ObliKind kind;

  private final long intLit;
  private final boolean boolLit;
  private final String name;
  private final CtBinaryOp binaryOp;
  private final CtUnaryOp unaryOp;
  private final ImmutableList<ObliExpr> children;
  private final boolean secret;

  private ObliExpr(ObliKind kind, long intLit, boolean boolLit, String name,
                   CtBinaryOp binaryOp, CtUnaryOp unaryOp, boolean secret,
                   ObliExpr... children) {
    this.kind = kind;
    this.intLit = intLit;
    this.boolLit = boolLit;
    this.name = name;
    this.binaryOp = binaryOp;
    this.unaryOp = unaryOp;
    this.secret = secret;
    this.children = ImmutableList.copyOf(children);
  }

  public static ObliExpr createPubInt(long v) {
    return new ObliExpr(ObliKind.PUB_INT, v, false, null, null, null, false);
  }

  public static ObliExpr createPubBool(boolean v) {
    return new ObliExpr(ObliKind.PUB_BOOL, 0, v, null, null, null, false);
  }

  public static ObliExpr createSecretInt(long v) {
    return new ObliExpr(ObliKind.SECRET_INT, v, false, null, null, null,
                        true);
  }

  public static ObliExpr createSecretBool(boolean v) {
    return new ObliExpr(ObliKind.SECRET_BOOL, 0, v, null, null, null, true);
  }

  public static ObliExpr createVar(String name, boolean secret) {
    assert(name != null);
    return new ObliExpr(ObliKind.VAR, 0, false, name, null, null, secret);
  }

  public static ObliExpr createBinaryOp(CtBinaryOp op, ObliExpr left,
                                        ObliExpr right, boolean secret) {
    assert(op != null);
    return new ObliExpr(ObliKind.BINARY_OP, 0, false, null, op, null, secret,
                        left, right);
  }

  public static ObliExpr createUnaryOp(CtUnaryOp op, ObliExpr operand,
                                       boolean secret) {
    assert(op != null);
    return new ObliExpr(ObliKind.UNARY_OP, 0, false, null, null, op, secret,
                        operand);
  }

  public static ObliExpr createCtSelect(ObliExpr cond, ObliExpr thenVal,
                                        ObliExpr elseVal) {
    return new ObliExpr(ObliKind.CT_SELECT, 0, false, null, null, null, true,
                        cond, thenVal, elseVal);
  }

  /**
   * Public conditional whose secrecy is that of its branches
   */
  public static ObliExpr createPubIf(ObliExpr cond, ObliExpr thenBranch,
                                     ObliExpr elseBranch) {
    return createPubIf(cond, thenBranch, elseBranch,
                       thenBranch.isSecret() || elseBranch.isSecret());
  }

  public static ObliExpr createPubIf(ObliExpr cond, ObliExpr thenBranch,
                                     ObliExpr elseBranch, boolean secret) {
    if (cond.isSecret()) {
      throw new ObliRuntimeError("Public conditional on secret condition: "
                                 + cond);
    }
    return new ObliExpr(ObliKind.PUB_IF, 0, false, null, null, null, secret,
                        cond, thenBranch, elseBranch);
  }

  /**
   * @param secret whether the bound value is secret
   */
  public static ObliExpr createLet(String name, ObliExpr value,
                                   ObliExpr body, boolean secret) {
    assert(name != null);
    return new ObliExpr(ObliKind.LET, 0, false, name, null, null, secret,
                        value, body);
  }

  public ObliKind getKind() {
    return kind;
  }

  /**
   * @return true if this value depends on secret data
   */
  public boolean isSecret() {
    return secret;
  }

  public boolean isLiteral() {
    switch (kind) {
      case PUB_INT:
      case PUB_BOOL:
      case SECRET_INT:
      case SECRET_BOOL:
        return true;
      default:
        return false;
    }
  }

  public long getIntLit() {
    if (kind != ObliKind.PUB_INT && kind != ObliKind.SECRET_INT) {
      throw new ObliRuntimeError("getIntLit for non-int node " + kind);
    }
    return intLit;
  }

  public boolean getBoolLit() {
    if (kind != ObliKind.PUB_BOOL && kind != ObliKind.SECRET_BOOL) {
      throw new ObliRuntimeError("getBoolLit for non-bool node " + kind);
    }
    return boolLit;
  }

  public String getName() {
    if (kind != ObliKind.VAR && kind != ObliKind.LET) {
      throw new ObliRuntimeError("getName for " + kind + " node");
    }
    return name;
  }

  public CtBinaryOp getBinaryOp() {
    checkKind(ObliKind.BINARY_OP, "getBinaryOp");
    return binaryOp;
  }

  public CtUnaryOp getUnaryOp() {
    checkKind(ObliKind.UNARY_OP, "getUnaryOp");
    return unaryOp;
  }

  public ObliExpr getLeft() {
    checkKind(ObliKind.BINARY_OP, "getLeft");
    return children.get(0);
  }

  public ObliExpr getRight() {
    checkKind(ObliKind.BINARY_OP, "getRight");
    return children.get(1);
  }

  public ObliExpr getOperand() {
    checkKind(ObliKind.UNARY_OP, "getOperand");
    return children.get(0);
  }

  /** Condition of a CT_SELECT or PUB_IF */
  public ObliExpr getCondition() {
    checkConditional("getCondition");
    return children.get(0);
  }

  /** then-value of a CT_SELECT, or then-branch of a PUB_IF */
  public ObliExpr getThen() {
    checkConditional("getThen");
    return children.get(1);
  }

  public ObliExpr getElse() {
    checkConditional("getElse");
    return children.get(2);
  }

  public ObliExpr getValue() {
    checkKind(ObliKind.LET, "getValue");
    return children.get(0);
  }

  public ObliExpr getBody() {
    checkKind(ObliKind.LET, "getBody");
    return children.get(1);
  }

  public List<ObliExpr> getChildren() {
    return children;
  }

  private void checkKind(ObliKind expected, String method) {
    if (kind != expected) {
      throw new ObliRuntimeError(method + " for " + kind + " node, " +
                                 "expected " + expected);
    }
  }

  private void checkConditional(String method) {
    if (kind != ObliKind.CT_SELECT && kind != ObliKind.PUB_IF) {
      throw new ObliRuntimeError(method + " for non-conditional node " +
                                 kind);
    }
  }

  /**
   * Compact S-expression form with secrecy marks, for logs and tests
   */
  @Override
  public String toString() {
    String mark = secret ? "!" : "";
    switch (kind) {
      case PUB_INT:
        return Long.toString(intLit);
      case PUB_BOOL:
        return Boolean.toString(boolLit);
      case SECRET_INT:
        return "secret(" + intLit + ")";
      case SECRET_BOOL:
        return "secret(" + boolLit + ")";
      case VAR:
        return name + mark;
      case BINARY_OP:
        return "(" + binaryOp.primitiveName() + mark + " " + getLeft() +
               " " + getRight() + ")";
      case UNARY_OP:
        return "(" + unaryOp.primitiveName() + mark + " " + getOperand() +
               ")";
      case CT_SELECT:
        return "(ct_select " + getCondition() + " " + getThen() + " " +
               getElse() + ")";
      case PUB_IF:
        return "(if" + mark + " " + getCondition() + " " + getThen() + " " +
               getElse() + ")";
      case LET:
        return "(let" + mark + " " + name + " " + getValue() + " " +
               getBody() + ")";
      default:
        throw new ObliRuntimeError("Unknown node kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + (int) (intLit ^ (intLit >>> 32));
    result = prime * result + (boolLit ? 1231 : 1237);
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + ((binaryOp == null) ? 0 : binaryOp.hashCode());
    result = prime * result + ((unaryOp == null) ? 0 : unaryOp.hashCode());
    result = prime * result + (secret ? 1231 : 1237);
    result = prime * result + children.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    ObliExpr other = (ObliExpr) obj;
    if (kind != other.kind || intLit != other.intLit ||
        boolLit != other.boolLit || secret != other.secret ||
        binaryOp != other.binaryOp || unaryOp != other.unaryOp) {
      return false;
    }
    if (name == null) {
      if (other.name != null)
        return false;
    } else if (!name.equals(other.name)) {
      return false;
    }
    return children.equals(other.children);
  }
}
