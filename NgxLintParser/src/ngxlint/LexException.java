package ngxlint;

import java.util.OptionalInt;

/** A tokenization failure. Always fatal for the file being read. */
public class LexException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UNEXPECTED_CHAR,
    UNTERMINATED_STRING;
  }

  private final Kind kind;
  private final Lexer.Position position;
  private final OptionalInt character;

  private LexException(Kind kind, Lexer.Position position, OptionalInt character, String msg) {
    super(String.format("%s at line %d, column %d", msg, position.line(), position.column()));
    this.kind = kind;
    this.position = position;
    this.character = character;
  }

  public static LexException unexpectedChar(int ch, Lexer.Position position) {
    return new LexException(
        Kind.UNEXPECTED_CHAR,
        position,
        OptionalInt.of(ch),
        "Unexpected character '" + new String(Character.toChars(ch)) + "'");
  }

  public static LexException unterminatedString(Lexer.Position position) {
    return new LexException(
        Kind.UNTERMINATED_STRING, position, OptionalInt.empty(), "Unterminated string starting");
  }

  public Kind kind() {
    return kind;
  }

  public Lexer.Position position() {
    return position;
  }

  /** The offending code point, for {@link Kind#UNEXPECTED_CHAR}. */
  public OptionalInt character() {
    return character;
  }
}
