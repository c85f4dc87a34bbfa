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
package exm.obli.rustbackend;

import java.util.ArrayList;

import org.apache.log4j.Logger;

import exm.obli.common.Settings;
import exm.obli.common.exceptions.ObliRuntimeError;
import exm.obli.ic.tree.ObliExpr;
import exm.obli.rustbackend.tree.Binding;
import exm.obli.rustbackend.tree.Call;
import exm.obli.rustbackend.tree.Comment;
import exm.obli.rustbackend.tree.Expression;
import exm.obli.rustbackend.tree.FnDef;
import exm.obli.rustbackend.tree.IfElse;
import exm.obli.rustbackend.tree.LetBlock;
import exm.obli.rustbackend.tree.LiteralBool;
import exm.obli.rustbackend.tree.LiteralInt;
import exm.obli.rustbackend.tree.Sequence;
import exm.obli.rustbackend.tree.Text;
import exm.obli.rustbackend.tree.Token;

/**
 * Prints oblivious intermediate code as a Rust program that runs
 * against the obli_runtime crate.
 *
 * Usage: header(), then mainFunction(), then code().
 */
public class RustGenerator
{
  public static final String RUNTIME_CRATE = "obli_runtime";
  public static final String MAIN_FUNCTION_NAME = "main";
  public static final String RESULT_VAR = "result";

  static final String SECRET_CONSTRUCTOR = "Secret::new";
  static final String CT_SELECT = "ct_select";

  final Logger logger;
  final String timestamp;

  /** Emit comment block describing how the code was generated */
  final boolean emitHeader;

  /**
     Our output Rust
   */
  Sequence tree = new Sequence();

  public RustGenerator(Logger logger, String timestamp, boolean emitHeader)
  {
    this.logger = logger;
    this.timestamp = timestamp;
    this.emitHeader = emitHeader;
  }

  public void header()
  {
    if (emitHeader) {
      tree.add(new Comment("Generated by obli " +
                           Settings.get(Settings.OBLI_VERSION)));
      tree.add(new Comment("date: " + timestamp));
      String input = Settings.get(Settings.INPUT_FILENAME);
      if (input != null && input.length() > 0) {
        tree.add(new Comment("File: " + input));
      }
      tree.add(new Comment("secrecy: " +
            (isOn(Settings.SECRECY_SCOPED) ? "scoped" : "flat") +
            ", forcing: " +
            (isOn(Settings.SECRECY_TOTAL_FORCING) ? "total" : "partial")));
      for (String key: Settings.getMetadataKeys()) {
        for (String val: Settings.getMetadata(key)) {
          tree.add(new Comment(key + ": " + val));
        }
      }
      tree.add(new Text(""));
    }

    tree.add(new Text("use " + RUNTIME_CRATE + "::*;"));
    tree.add(new Text(""));
  }

  /**
   * Settings were validated at start-up, so only the literal value
   * "true" counts here
   */
  private static boolean isOn(String key) {
    return "true".equalsIgnoreCase(Settings.get(key));
  }

  /**
   * Add a main function that evaluates the program and prints the result
   * @param program
   */
  public void mainFunction(ObliExpr program)
  {
    Sequence body = new Sequence();
    body.add(new Binding(RESULT_VAR, toRust(program)));
    body.add(new Text("println!(\"{:?}\", " + RESULT_VAR + ");"));
    tree.add(new FnDef(MAIN_FUNCTION_NAME, new ArrayList<String>(), body));
    logger.debug("generated main function, result secret: " +
                 program.isSecret());
  }

  /**
   * @return the generated program text
   */
  public String code()
  {
    StringBuilder sb = new StringBuilder(4096);
    tree.appendTo(sb);
    return sb.toString();
  }

  /**
   * Render a single expression with no surrounding program
   */
  public static String renderExpression(ObliExpr expr)
  {
    return toRust(expr).toString();
  }

  /**
   * Build the Rust expression for a node.  Every argument to ct_select
   * is an expression of its own, so both branches are evaluated before
   * the selection is made.
   */
  static Expression toRust(ObliExpr expr)
  {
    switch (expr.kind) {
      case PUB_INT:
        return new LiteralInt(expr.getIntLit());
      case PUB_BOOL:
        return LiteralBool.boolValue(expr.getBoolLit());
      case SECRET_INT:
        return Call.fnCall(SECRET_CONSTRUCTOR,
                           new LiteralInt(expr.getIntLit()));
      case SECRET_BOOL:
        return Call.fnCall(SECRET_CONSTRUCTOR,
                           LiteralBool.boolValue(expr.getBoolLit()));
      case VAR:
        return new Token(RustNamer.rustName(expr.getName()));
      case BINARY_OP:
        return Call.fnCall(expr.getBinaryOp().primitiveName(),
                           toRust(expr.getLeft()), toRust(expr.getRight()));
      case UNARY_OP:
        return Call.fnCall(expr.getUnaryOp().primitiveName(),
                           toRust(expr.getOperand()));
      case CT_SELECT:
        return Call.fnCall(CT_SELECT, toRust(expr.getCondition()),
                           toRust(expr.getThen()), toRust(expr.getElse()));
      case PUB_IF:
        return new IfElse(toRust(expr.getCondition()),
                          toRust(expr.getThen()), toRust(expr.getElse()));
      case LET:
        return new LetBlock(RustNamer.rustName(expr.getName()),
                            toRust(expr.getValue()), toRust(expr.getBody()));
      default:
        throw new ObliRuntimeError("Unexpected node kind: " + expr.kind);
    }
  }
}
