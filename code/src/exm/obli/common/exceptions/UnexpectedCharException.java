package exm.obli.common.exceptions;

public class UnexpectedCharException extends LexicalException {

  private static final long serialVersionUID = 1L;

  private final char character;

  public UnexpectedCharException(char character, int position) {
    super(position, "unexpected character: '" + character + "'");
    this.character = character;
  }

  public char getCharacter() {
    return character;
  }
}
