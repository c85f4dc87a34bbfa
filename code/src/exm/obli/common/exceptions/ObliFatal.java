package exm.obli.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class ObliFatal extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public final int exitCode;

  public ObliFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

}
