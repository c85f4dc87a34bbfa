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
package exm.obli.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.obli.common.exceptions.ObliRuntimeError;
import exm.obli.common.lang.Operators.BinaryOp;
import exm.obli.common.lang.Operators.UnaryOp;

/**
 * A node of a parsed MiniObli expression.
 *
 * Nodes are immutable and each node is owned by exactly one parent.
 * Build them with the static create* methods below; read them with
 * the accessors, which throw ObliRuntimeError if called on the
 * wrong kind of node.
 */
public class Expr {

  public static enum ExprKind {
    INT, BOOL, VAR, SECRET, BINARY_OP, UNARY_OP, IF, LET;
  }

  public final ExprKind kind;

  /** Storage for node, dependent on kind */
  private final long intLit;
  private final boolean boolLit;
  /** Variable name for VAR, bound name for LET */
  private final String name;
  private final BinaryOp binaryOp;
  private final UnaryOp unaryOp;
  private final ImmutableList<Expr> children;

  private Expr(ExprKind kind, long intLit, boolean boolLit, String name,
               BinaryOp binaryOp, UnaryOp unaryOp, Expr... children) {
    this.kind = kind;
    this.intLit = intLit;
    this.boolLit = boolLit;
    this.name = name;
    this.binaryOp = binaryOp;
    this.unaryOp = unaryOp;
    this.children = ImmutableList.copyOf(children);
  }

  public static Expr createInt(long v) {
    return new Expr(ExprKind.INT, v, false, null, null, null);
  }

  public static Expr createBool(boolean v) {
    return new Expr(ExprKind.BOOL, 0, v, null, null, null);
  }

  public static Expr createVar(String name) {
    assert(name != null);
    return new Expr(ExprKind.VAR, 0, false, name, null, null);
  }

  public static Expr createSecret(Expr inner) {
    return new Expr(ExprKind.SECRET, 0, false, null, null, null, inner);
  }

  public static Expr createBinaryOp(BinaryOp op, Expr left, Expr right) {
    assert(op != null);
    return new Expr(ExprKind.BINARY_OP, 0, false, null, op, null,
                    left, right);
  }

  public static Expr createUnaryOp(UnaryOp op, Expr operand) {
    assert(op != null);
    return new Expr(ExprKind.UNARY_OP, 0, false, null, null, op, operand);
  }

  public static Expr createIf(Expr cond, Expr thenBranch, Expr elseBranch) {
    return new Expr(ExprKind.IF, 0, false, null, null, null,
                    cond, thenBranch, elseBranch);
  }

  public static Expr createLet(String name, Expr value, Expr body) {
    assert(name != null);
    return new Expr(ExprKind.LET, 0, false, name, null, null, value, body);
  }

  public ExprKind getKind() {
    return kind;
  }

  public long getIntLit() {
    checkKind(ExprKind.INT, "getIntLit");
    return intLit;
  }

  public boolean getBoolLit() {
    checkKind(ExprKind.BOOL, "getBoolLit");
    return boolLit;
  }

  /**
   * @return name of referenced variable (VAR) or bound variable (LET)
   */
  public String getName() {
    if (kind != ExprKind.VAR && kind != ExprKind.LET) {
      throw new ObliRuntimeError("getName for " + kind + " node");
    }
    return name;
  }

  public BinaryOp getBinaryOp() {
    checkKind(ExprKind.BINARY_OP, "getBinaryOp");
    return binaryOp;
  }

  public UnaryOp getUnaryOp() {
    checkKind(ExprKind.UNARY_OP, "getUnaryOp");
    return unaryOp;
  }

  /** Wrapped expression of a SECRET node */
  public Expr getInner() {
    checkKind(ExprKind.SECRET, "getInner");
    return children.get(0);
  }

  public Expr getLeft() {
    checkKind(ExprKind.BINARY_OP, "getLeft");
    return children.get(0);
  }

  public Expr getRight() {
    checkKind(ExprKind.BINARY_OP, "getRight");
    return children.get(1);
  }

  public Expr getOperand() {
    checkKind(ExprKind.UNARY_OP, "getOperand");
    return children.get(0);
  }

  public Expr getCondition() {
    checkKind(ExprKind.IF, "getCondition");
    return children.get(0);
  }

  public Expr getThenBranch() {
    checkKind(ExprKind.IF, "getThenBranch");
    return children.get(1);
  }

  public Expr getElseBranch() {
    checkKind(ExprKind.IF, "getElseBranch");
    return children.get(2);
  }

  /** Bound value of a LET node */
  public Expr getValue() {
    checkKind(ExprKind.LET, "getValue");
    return children.get(0);
  }

  public Expr getBody() {
    checkKind(ExprKind.LET, "getBody");
    return children.get(1);
  }

  /**
   * @return direct sub-expressions, in source order
   */
  public List<Expr> getChildren() {
    return children;
  }

  public boolean isLiteral() {
    return kind == ExprKind.INT || kind == ExprKind.BOOL;
  }

  /**
   * @return true if this expression or any sub-expression is wrapped
   *         in secret(...)
   */
  public boolean containsSecret() {
    if (kind == ExprKind.SECRET) {
      return true;
    }
    for (Expr child: children) {
      if (child.containsSecret()) {
        return true;
      }
    }
    return false;
  }

  private void checkKind(ExprKind expected, String method) {
    if (kind != expected) {
      throw new ObliRuntimeError(method + " for non-" +
                                 expected.toString().toLowerCase() +
                                 " node " + kind);
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case INT:
        return Long.toString(intLit);
      case BOOL:
        return Boolean.toString(boolLit);
      case VAR:
        return name;
      case SECRET:
        return "secret(" + getInner() + ")";
      case BINARY_OP:
        return "(" + getLeft() + " " + binaryOp.symbol() + " " +
               getRight() + ")";
      case UNARY_OP:
        return "(" + unaryOp.symbol() +
                (unaryOp == UnaryOp.NOT ? " " : "") + getOperand() + ")";
      case IF:
        return "(if " + getCondition() + " then " + getThenBranch() +
               " else " + getElseBranch() + ")";
      case LET:
        return "(let " + name + " = " + getValue() + " " + getBody() + ")";
      default:
        throw new ObliRuntimeError("Unknown expression kind " + kind);
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
    result = prime * result + children.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Expr other = (Expr) obj;
    if (kind != other.kind || intLit != other.intLit ||
        boolLit != other.boolLit || binaryOp != other.binaryOp ||
        unaryOp != other.unaryOp) {
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
