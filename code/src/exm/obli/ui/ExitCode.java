package exm.obli.ui;

/**
 * Unix exit codes
 * */
public enum ExitCode
{
  /** Successful exit */
  SUCCESS(0),
  /** Do not use this- reserved for JVM errors */
  ERROR_JAVA(1),
  /** I/O error */
  ERROR_IO(2),
  /** Lexical or syntax error in the MiniObli input */
  ERROR_USER(4),
  /** Bad command line argument or setting */
  ERROR_COMMAND(5),
  /** Internal error in obli */
  ERROR_INTERNAL(90);

  final int code;

  ExitCode(int code)
  {
    this.code = code;
  }

  public int code()
  {
    return code;
  }
}
