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
package exm.obli.common.lang;

import java.util.EnumMap;
import java.util.Map;

import exm.obli.common.exceptions.ObliRuntimeError;

/**
 * This class serves to define the operators of MiniObli and their
 * constant-time counterparts in the oblivious intermediate code
 */
public class Operators {

  /**
   * Binary operators as written in source
   */
  public static enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
    EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
    AND("and"), OR("or");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public static enum UnaryOp {
    NEGATE("-"), NOT("not");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /**
   * Constant-time binary operations.  The primitive name is the function
   * provided by the target runtime.
   * NOTE: CT_DIV and CT_MOD are labels only: nothing here guarantees
   * that the runtime division is branchless.
   */
  public static enum CtBinaryOp {
    CT_ADD("ct_add"), CT_SUB("ct_sub"), CT_MUL("ct_mul"),
    CT_DIV("ct_div"), CT_MOD("ct_mod"),
    CT_EQ("ct_eq"), CT_NE("ct_ne"), CT_LT("ct_lt"), CT_LE("ct_le"),
    CT_GT("ct_gt"), CT_GE("ct_ge"),
    CT_AND("ct_and"), CT_OR("ct_or");

    private final String primitive;

    private CtBinaryOp(String primitive) {
      this.primitive = primitive;
    }

    public String primitiveName() {
      return primitive;
    }
  }

  public static enum CtUnaryOp {
    CT_NEG("ct_neg"), CT_NOT("ct_not");

    private final String primitive;

    private CtUnaryOp(String primitive) {
      this.primitive = primitive;
    }

    public String primitiveName() {
      return primitive;
    }
  }

  /** Map of source operator -> constant-time operator */
  private static final Map<BinaryOp, CtBinaryOp> binaryOps =
                  new EnumMap<BinaryOp, CtBinaryOp>(BinaryOp.class);

  private static final Map<UnaryOp, CtUnaryOp> unaryOps =
                  new EnumMap<UnaryOp, CtUnaryOp>(UnaryOp.class);

  static {
    fillOps();
  }

  private static void fillOps() {
    binaryOps.put(BinaryOp.ADD, CtBinaryOp.CT_ADD);
    binaryOps.put(BinaryOp.SUB, CtBinaryOp.CT_SUB);
    binaryOps.put(BinaryOp.MUL, CtBinaryOp.CT_MUL);
    binaryOps.put(BinaryOp.DIV, CtBinaryOp.CT_DIV);
    binaryOps.put(BinaryOp.MOD, CtBinaryOp.CT_MOD);
    binaryOps.put(BinaryOp.EQ, CtBinaryOp.CT_EQ);
    binaryOps.put(BinaryOp.NE, CtBinaryOp.CT_NE);
    binaryOps.put(BinaryOp.LT, CtBinaryOp.CT_LT);
    binaryOps.put(BinaryOp.LE, CtBinaryOp.CT_LE);
    binaryOps.put(BinaryOp.GT, CtBinaryOp.CT_GT);
    binaryOps.put(BinaryOp.GE, CtBinaryOp.CT_GE);
    binaryOps.put(BinaryOp.AND, CtBinaryOp.CT_AND);
    binaryOps.put(BinaryOp.OR, CtBinaryOp.CT_OR);

    unaryOps.put(UnaryOp.NEGATE, CtUnaryOp.CT_NEG);
    unaryOps.put(UnaryOp.NOT, CtUnaryOp.CT_NOT);
  }

  public static CtBinaryOp toConstantTime(BinaryOp op) {
    CtBinaryOp ctOp = binaryOps.get(op);
    if (ctOp == null) {
      throw new ObliRuntimeError("No constant-time operator for " + op);
    }
    return ctOp;
  }

  public static CtUnaryOp toConstantTime(UnaryOp op) {
    CtUnaryOp ctOp = unaryOps.get(op);
    if (ctOp == null) {
      throw new ObliRuntimeError("No constant-time operator for " + op);
    }
    return ctOp;
  }
}
