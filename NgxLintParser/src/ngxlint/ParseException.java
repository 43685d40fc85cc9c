package ngxlint;

import java.util.Optional;

/**
 * A failure to build a syntax tree. Parsing is all-or-nothing per file, so callers get either a
 * complete tree or one of these.
 */
public class ParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    LEX,
    UNMATCHED_CLOSE_BRACE,
    UNCLOSED_BLOCK,
    EXPECTED_DIRECTIVE_NAME,
    UNEXPECTED_EOF,
    MISSING_SEMICOLON,
    UNEXPECTED_TOKEN;
  }

  private final Kind kind;
  private final Lexer.Position position;
  private final Optional<String> expected;
  private final Optional<String> found;

  private ParseException(
      Kind kind,
      Lexer.Position position,
      Optional<String> expected,
      Optional<String> found,
      String msg,
      Throwable cause) {
    super(msg, cause);
    this.kind = kind;
    this.position = position;
    this.expected = expected;
    this.found = found;
  }

  private static ParseException create(Kind kind, Lexer.Position position, String description) {
    return new ParseException(
        kind, position, Optional.empty(), Optional.empty(), at(description, position), null);
  }

  private static String at(String description, Lexer.Position position) {
    return String.format(
        "%s at line %d, column %d", description, position.line(), position.column());
  }

  public static ParseException lex(LexException cause) {
    return new ParseException(
        Kind.LEX, cause.position(), Optional.empty(), Optional.empty(), cause.getMessage(), cause);
  }

  public static ParseException unmatchedCloseBrace(Lexer.Position position) {
    return create(Kind.UNMATCHED_CLOSE_BRACE, position, "Unmatched closing brace");
  }

  public static ParseException unclosedBlock(Lexer.Position position) {
    return create(Kind.UNCLOSED_BLOCK, position, "Unclosed block starting");
  }

  public static ParseException expectedDirectiveName(Lexer.Position position) {
    return create(Kind.EXPECTED_DIRECTIVE_NAME, position, "Expected directive name");
  }

  public static ParseException unexpectedEof(Lexer.Position position) {
    return create(Kind.UNEXPECTED_EOF, position, "Unexpected end of file");
  }

  public static ParseException missingSemicolon(Lexer.Position position) {
    return create(Kind.MISSING_SEMICOLON, position, "Missing semicolon");
  }

  public static ParseException unexpectedToken(
      String expected, String found, Lexer.Position position) {
    return new ParseException(
        Kind.UNEXPECTED_TOKEN,
        position,
        Optional.of(expected),
        Optional.of(found),
        at(String.format("Expected %s but found %s", expected, found), position),
        null);
  }

  public Kind kind() {
    return kind;
  }

  public Lexer.Position position() {
    return position;
  }

  public Optional<String> expected() {
    return expected;
  }

  public Optional<String> found() {
    return found;
  }
}
