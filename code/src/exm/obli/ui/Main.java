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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.obli.common.Logging;
import exm.obli.common.Settings;
import exm.obli.common.exceptions.InvalidOptionException;
import exm.obli.common.exceptions.ObliFatal;
import exm.obli.common.exceptions.UserException;

/**
 * Command line interface to the obli transpiler.  Transformation options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 *
 * <pre>
 * obli transpile -i FILE [-o FILE]
 * obli run -e EXPR
 * obli check -i FILE
 * </pre>
 */
public class Main {
  static final String TRANSPILE_COMMAND = "transpile";
  static final String RUN_COMMAND = "run";
  static final String CHECK_COMMAND = "check";

  private static final String INPUT_FLAG = "i";
  private static final String OUTPUT_FLAG = "o";
  private static final String EXPR_FLAG = "e";

  public static void main(String[] args) {
    try {
      Settings.initObliProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      runCommand(logger, args, System.out);
    } catch (ObliFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  /**
   * Dispatch on the subcommand in args[0]
   * @param logger
   * @param args full command line
   * @param out where generated code and reports are written
   * @throws ObliFatal with the exit code on any failure
   */
  static void runCommand(Logger logger, String[] args, PrintStream out) {
    if (args.length == 0) {
      System.err.println("Expected a command");
      usage();
      throw new ObliFatal(ExitCode.ERROR_COMMAND.code());
    }
    String command = args[0];
    String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

    Options opts = initOptions(command);
    if (opts == null) {
      System.err.println("Unknown command: " + command);
      usage();
      throw new ObliFatal(ExitCode.ERROR_COMMAND.code());
    }
    CommandLine cmd = processArgs(command, opts, commandArgs);
    ObliCompiler compiler = setupCompiler(logger);

    if (command.equals(TRANSPILE_COMMAND)) {
      transpile(logger, compiler, cmd.getOptionValue(INPUT_FLAG),
                cmd.getOptionValue(OUTPUT_FLAG), out);
    } else if (command.equals(RUN_COMMAND)) {
      String code = compiler.compile(cmd.getOptionValue(EXPR_FLAG));
      out.println("// Generated Rust code:");
      out.print(code);
    } else {
      check(compiler, cmd.getOptionValue(INPUT_FLAG), out);
    }
  }

  /**
   * @return options for command, or null if command is unknown
   */
  static Options initOptions(String command) {
    Options opts = new Options();
    if (command.equals(TRANSPILE_COMMAND)) {
      opts.addOption(requiredOption(INPUT_FLAG, "input",
                                    "Input .mobli file"));
      opts.addOption(new Option(OUTPUT_FLAG, "output", true,
                                "Output .rs file (defaults to stdout)"));
    } else if (command.equals(RUN_COMMAND)) {
      opts.addOption(requiredOption(EXPR_FLAG, "expr",
                                    "Expression to transpile"));
    } else if (command.equals(CHECK_COMMAND)) {
      opts.addOption(requiredOption(INPUT_FLAG, "input",
                                    "Input .mobli file"));
    } else {
      return null;
    }
    return opts;
  }

  private static Option requiredOption(String flag, String longName,
                                       String description) {
    Option opt = new Option(flag, longName, true, description);
    opt.setRequired(true);
    return opt;
  }

  @SuppressWarnings("deprecation")
  private static CommandLine processArgs(String command, Options opts,
                                         String[] args) {
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(command, opts);
      throw new ObliFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length > 0) {
      System.err.println("Unexpected arguments: " +
                         Arrays.toString(remainingArgs));
      usage(command, opts);
      throw new ObliFatal(ExitCode.ERROR_COMMAND.code());
    }
    recordArgValues(command, cmd);
    return cmd;
  }

  /**
   * Store in properties for the generated code header
   */
  private static void recordArgValues(String command, CommandLine cmd) {
    Settings.addMetadata("Command", command);
    if (cmd.hasOption(INPUT_FLAG)) {
      Settings.set(Settings.INPUT_FILENAME, cmd.getOptionValue(INPUT_FLAG));
    }
    if (cmd.hasOption(OUTPUT_FLAG)) {
      Settings.set(Settings.OUTPUT_FILENAME,
                   cmd.getOptionValue(OUTPUT_FLAG));
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static ObliCompiler setupCompiler(Logger logger) {
    try {
      return ObliCompiler.fromSettings(logger);
    } catch (InvalidOptionException e) {
      System.err.println("Error in settings: " + e.getMessage());
      throw new ObliFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  private static void usage() {
    System.err.println("usage: obli <command> [options]");
    System.err.println("commands:");
    System.err.println("  " + TRANSPILE_COMMAND +
                       "  Transpile a MiniObli file to Rust");
    System.err.println("  " + RUN_COMMAND +
                       "        Transpile a MiniObli expression");
    System.err.println("  " + CHECK_COMMAND +
                       "      Check a MiniObli file for errors");
  }

  private static void usage(String command, Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("obli " + command, opts, true);
  }

  private static void transpile(Logger logger, ObliCompiler compiler,
                  String inputFilename, String outputFilename,
                  PrintStream out) {
    String source = readInput(inputFilename);
    String code = compiler.compile(source);
    if (outputFilename == null) {
      out.print(code);
    } else {
      File output = new File(outputFilename);
      writeOutput(code, output);
      logger.info("Wrote " + output);
      System.err.println("Wrote " + output);
    }
  }

  private static void check(ObliCompiler compiler, String inputFilename,
                            PrintStream out) {
    String source = readInput(inputFilename);
    try {
      compiler.check(source);
    } catch (UserException e) {
      System.err.println(inputFilename + ": Error: " + e.getMessage());
      throw new ObliFatal(ExitCode.ERROR_USER.code());
    }
    out.println(inputFilename + ": OK");
  }

  private static String readInput(String inputFilename) {
    File input = new File(inputFilename);
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error reading " + input + ": " + e.getMessage());
      throw new ObliFatal(ExitCode.ERROR_IO.code());
    }
  }

  /**
   * Write to a temporary file first, then copy, so that an I/O failure
   * part way through does not leave truncated output behind
   * @param code
   * @param output
   */
  private static void writeOutput(String code, File output) {
    File tmpOutput = null;
    try {
      tmpOutput = File.createTempFile("obli-out", ".rs");
      FileUtils.writeStringToFile(tmpOutput, code, StandardCharsets.UTF_8);
      FileUtils.copyFile(tmpOutput, output);
    } catch (IOException e) {
      System.err.println("Error writing " + output + ": " + e.getMessage());
      FileUtils.deleteQuietly(output);
      throw new ObliFatal(ExitCode.ERROR_IO.code());
    } finally {
      FileUtils.deleteQuietly(tmpOutput);
    }
  }
}
