
package exm.obli.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or missing feature).
 * */
public class ObliRuntimeError extends RuntimeException
{
  public ObliRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
