package exm.obli.common.exceptions;

/**
 * Integer literal that does not fit in a signed 64-bit value
 */
public class InvalidNumberException extends LexicalException {

  private static final long serialVersionUID = 1L;

  public InvalidNumberException(int position) {
    super(position, "invalid number");
  }
}
