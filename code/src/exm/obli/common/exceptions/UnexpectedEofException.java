package exm.obli.common.exceptions;

public class UnexpectedEofException extends InvalidSyntaxException {

  private static final long serialVersionUID = 1L;

  public UnexpectedEofException() {
    super("unexpected end of input");
  }
}
