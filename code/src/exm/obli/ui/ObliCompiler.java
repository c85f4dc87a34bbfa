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

package exm.obli.ui;

import java.util.Date;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.commons.lang3.time.DateFormatUtils;
import org.apache.log4j.Logger;

import exm.obli.ast.Expr;
import exm.obli.common.Settings;
import exm.obli.common.exceptions.InvalidOptionException;
import exm.obli.common.exceptions.ObliFatal;
import exm.obli.common.exceptions.UserException;
import exm.obli.frontend.ObliviousWalker;
import exm.obli.frontend.SourceParser;
import exm.obli.ic.tree.ObliExpr;
import exm.obli.rustbackend.RustGenerator;

/**
 * This is the main entry point to the transpiler
 */
public class ObliCompiler {

  private final Logger logger;
  private final ObliviousWalker walker;
  private final boolean emitHeader;

  public ObliCompiler(Logger logger, ObliviousWalker walker,
                      boolean emitHeader) {
    this.logger = logger;
    this.walker = walker;
    this.emitHeader = emitHeader;
  }

  /**
   * @return compiler configured from {@link Settings}
   * @throws InvalidOptionException
   */
  public static ObliCompiler fromSettings(Logger logger)
      throws InvalidOptionException {
    return new ObliCompiler(logger, ObliviousWalker.fromSettings(),
                            Settings.getBoolean(Settings.EMIT_HEADER));
  }

  /**
   * Transpile MiniObli source to a Rust program.  Stages run in order
   * (parse, transform, print) and the first failure stops the pipeline.
   * @param source
   * @return Rust source text
   * @throws UserException lexical or syntax error in source
   */
  public String transpile(String source) throws UserException {
    ObliExpr program = check(source);

    RustGenerator codeGen = new RustGenerator(logger, timestamp(),
                                              emitHeader);
    codeGen.header();
    codeGen.mainFunction(program);
    return codeGen.code();
  }

  /**
   * Parse and transform without generating code
   * @param source
   * @return the oblivious form of the program
   * @throws UserException lexical or syntax error in source
   */
  public ObliExpr check(String source) throws UserException {
    Expr tree = SourceParser.parse(source);
    return walker.walk(tree);
  }

  /**
   * Transpile for the command line: errors are reported on stderr and
   * converted to a fatal exit.
   * @param source
   * @return Rust source text
   */
  public String compile(String source) {
    try {
      logger.info("obli starting: " + timestamp());
      String code = transpile(source);
      logger.debug("obli done: " + timestamp());
      return code;
    }
    catch (ObliFatal e) {
      // Rethrow
      throw e;
    }
    catch (UserException e) {
      System.err.println("obli error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new ObliFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new ObliFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static String timestamp() {
    return DateFormatUtils.ISO_8601_EXTENDED_DATETIME_FORMAT.format(
                                                            new Date());
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("OBLI INTERNAL ERROR");
    System.err.println("Please report this");
    System.err.println(ExceptionUtils.getStackTrace(e));
  }
}
