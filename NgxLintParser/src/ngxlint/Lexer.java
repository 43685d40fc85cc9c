package ngxlint;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of nginx-style configuration text. */
public class Lexer {

  /**
   * A location in the source. Lines and columns are 1-based, columns count code points, and the
   * offset is a 0-based UTF-8 byte offset.
   */
  @AutoValue
  @JsonSerialize(as = Position.class)
  public abstract static class Position implements Comparable<Position> {
    private static final Position NONE = new AutoValue_Lexer_Position(0, 0, 0);

    /** The position of synthetic nodes that were never read from a source. */
    public static Position none() {
      return NONE;
    }

    @JsonProperty("line")
    public abstract int line();

    @JsonProperty("column")
    public abstract int column();

    @JsonProperty("offset")
    public abstract int offset();

    @JsonCreator
    public static Position create(
        @JsonProperty("line") int line,
        @JsonProperty("column") int column,
        @JsonProperty("offset") int offset) {
      return new AutoValue_Lexer_Position(line, column, offset);
    }

    public boolean isSynthetic() {
      return line() == 0;
    }

    @Override
    public int compareTo(Position other) {
      return Integer.compare(offset(), other.offset());
    }

    @Override
    public String toString() {
      return line() + ":" + column();
    }
  }

  /** A half-open source range. */
  @AutoValue
  @JsonSerialize(as = Span.class)
  public abstract static class Span {
    private static final Span NONE = new AutoValue_Lexer_Span(Position.none(), Position.none());

    public static Span none() {
      return NONE;
    }

    @JsonProperty("start")
    public abstract Position start();

    @JsonProperty("end")
    public abstract Position end();

    @JsonCreator
    public static Span create(
        @JsonProperty("start") Position start, @JsonProperty("end") Position end) {
      Preconditions.checkArgument(
          start.offset() <= end.offset(), "span ends before it starts: %s..%s", start, end);
      return new AutoValue_Lexer_Span(start, end);
    }

    public boolean isSynthetic() {
      return start().isSynthetic();
    }
  }

  public enum TokenKind {
    IDENT("identifier"),
    ARGUMENT("argument"),
    DOUBLE_QUOTED_STRING("string"),
    SINGLE_QUOTED_STRING("string"),
    VARIABLE("variable"),
    SEMICOLON("';'"),
    OPEN_BRACE("'{'"),
    CLOSE_BRACE("'}'"),
    COMMENT("comment"),
    NEWLINE("newline"),
    EOF("end of file");

    private final String displayName;

    TokenKind(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }
  }

  // Payload-free tokens carry an empty value.
  @AutoValue
  public abstract static class Token {
    public abstract TokenKind kind();

    /** Decoded payload: unquoted string content, variable name without '$', comment text. */
    public abstract String value();

    public abstract Span span();

    /** The untouched source text of the token. */
    public abstract String raw();

    /** Horizontal whitespace between the previous token and this one, on the same line. */
    public abstract String leadingWhitespace();

    public boolean is(TokenKind kind) {
      return kind() == kind;
    }

    public static Token create(
        TokenKind kind, String value, Span span, String raw, String leadingWhitespace) {
      return new AutoValue_Lexer_Token(kind, value, span, raw, leadingWhitespace);
    }
  }

  private final String source;
  private int index = 0; // UTF-16 index into source
  private int line = 1;
  private int column = 1;
  private int offset = 0;

  public Lexer(String source) {
    this.source = Preconditions.checkNotNull(source);
  }

  /** Tokenizes the whole input; the last token is always {@link TokenKind#EOF}. */
  public ImmutableList<Token> tokenize() throws LexException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      Token token = nextToken();
      tokens.add(token);
      if (token.is(TokenKind.EOF)) {
        return tokens.build();
      }
    }
  }

  public Token nextToken() throws LexException {
    String leadingWhitespace = skipHorizontalWhitespace();
    Position start = position();
    int startIndex = index;

    if (atEnd()) {
      return Token.create(TokenKind.EOF, "", Span.create(start, start), "", leadingWhitespace);
    }

    int ch = advance();
    TokenKind kind;
    String value = "";
    switch (ch) {
      case '\n':
        kind = TokenKind.NEWLINE;
        break;
      case ';':
        kind = TokenKind.SEMICOLON;
        break;
      case '{':
        kind = TokenKind.OPEN_BRACE;
        break;
      case '}':
        kind = TokenKind.CLOSE_BRACE;
        break;
      case '"':
        kind = TokenKind.DOUBLE_QUOTED_STRING;
        value = readDoubleQuoted(start);
        break;
      case '\'':
        kind = TokenKind.SINGLE_QUOTED_STRING;
        value = readSingleQuoted(start);
        break;
      case '$':
        kind = TokenKind.VARIABLE;
        value = readVariableName();
        break;
      case '#':
        if (!leadingWhitespace.isEmpty() || start.column() == 1) {
          kind = TokenKind.COMMENT;
          readCommentBody();
          value = source.substring(startIndex, index);
        } else {
          // '#' glued to preceding text, as in regexes like (?:#.*#|\.bak)
          kind = TokenKind.ARGUMENT;
          value = readArgumentContinuation(ch);
        }
        break;
      default:
        if (isIdentStart(ch)) {
          kind = TokenKind.IDENT;
          value = readIdentifier(ch);
        } else if (isArgumentChar(ch)) {
          kind = TokenKind.ARGUMENT;
          value = readArgumentContinuation(ch);
        } else {
          throw LexException.unexpectedChar(ch, start);
        }
    }

    return Token.create(
        kind,
        value,
        Span.create(start, position()),
        source.substring(startIndex, index),
        leadingWhitespace);
  }

  private Position position() {
    return Position.create(line, column, offset);
  }

  private boolean atEnd() {
    return index >= source.length();
  }

  private int peek() {
    return atEnd() ? -1 : source.codePointAt(index);
  }

  // Looks ahead by code points without consuming.
  private int peek(int ahead) {
    int i = index;
    for (int n = 0; n < ahead; n++) {
      if (i >= source.length()) return -1;
      i += Character.charCount(source.codePointAt(i));
    }
    return i >= source.length() ? -1 : source.codePointAt(i);
  }

  private int advance() {
    int cp = source.codePointAt(index);
    index += Character.charCount(cp);
    offset += utf8Length(cp);
    if (cp == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return cp;
  }

  public static int utf8Length(int cp) {
    if (cp < 0x80) return 1;
    if (cp < 0x800) return 2;
    if (cp < 0x10000) return 3;
    return 4;
  }

  private String skipHorizontalWhitespace() {
    int startIndex = index;
    while (isHorizontalWhitespace(peek())) {
      advance();
    }
    return source.substring(startIndex, index);
  }

  // Stops before trailing whitespace so that it is reported as the next token's leading
  // whitespace.
  private void readCommentBody() {
    int lineEnd = source.indexOf('\n', index);
    if (lineEnd < 0) lineEnd = source.length();
    int textEnd = lineEnd;
    while (textEnd > index && isHorizontalWhitespace(source.charAt(textEnd - 1))) {
      textEnd--;
    }
    while (index < textEnd) {
      advance();
    }
  }

  private String readDoubleQuoted(Position start) throws LexException {
    StringBuilder value = new StringBuilder();
    while (true) {
      if (atEnd()) throw LexException.unterminatedString(start);
      int ch = advance();
      if (ch == '"') {
        return value.toString();
      } else if (ch != '\\') {
        value.appendCodePoint(ch);
        continue;
      }

      if (atEnd()) throw LexException.unterminatedString(start);
      int escaped = advance();
      switch (escaped) {
        case 'n':
          value.append('\n');
          break;
        case 't':
          value.append('\t');
          break;
        case 'r':
          value.append('\r');
          break;
        case '\\':
        case '"':
        case '$':
          value.appendCodePoint(escaped);
          break;
        default:
          value.append('\\').appendCodePoint(escaped);
      }
    }
  }

  private String readSingleQuoted(Position start) throws LexException {
    StringBuilder value = new StringBuilder();
    while (true) {
      if (atEnd()) throw LexException.unterminatedString(start);
      int ch = advance();
      if (ch == '\'') {
        return value.toString();
      } else if (ch != '\\') {
        value.appendCodePoint(ch);
        continue;
      }

      if (atEnd()) throw LexException.unterminatedString(start);
      int escaped = advance();
      if (escaped == '\\' || escaped == '\'') {
        value.appendCodePoint(escaped);
      } else {
        value.append('\\').appendCodePoint(escaped);
      }
    }
  }

  private String readVariableName() {
    StringBuilder name = new StringBuilder();
    if (peek() == '{') {
      advance();
      while (!atEnd()) {
        int ch = advance();
        if (ch == '}') break;
        name.appendCodePoint(ch);
      }
      return name.toString();
    }

    while (!atEnd() && isVariableNameChar(peek())) {
      name.appendCodePoint(advance());
    }
    return name.toString();
  }

  private String readIdentifier(int first) {
    StringBuilder value = new StringBuilder().appendCodePoint(first);
    while (!atEnd() && isIdentContinue(peek())) {
      value.appendCodePoint(advance());
    }
    // Identifiers run on into argument characters: text/plain, TLSv1.2.
    continueArgument(value);
    return value.toString();
  }

  private String readArgumentContinuation(int first) {
    StringBuilder value = new StringBuilder().appendCodePoint(first);
    continueArgument(value);
    return value.toString();
  }

  private void continueArgument(StringBuilder value) {
    while (!atEnd()) {
      int ch = peek();
      if (isArgumentChar(ch) || isIdentContinue(ch)) {
        if (ch == '\\' && (peek(1) == '{' || peek(1) == '}')) {
          value.appendCodePoint(advance());
        }
        value.appendCodePoint(advance());
      } else if (ch == '{') {
        Optional<String> quantifier = peekRegexQuantifier();
        if (!quantifier.isPresent()) break;
        for (int i = 0; i < quantifier.get().length(); i++) {
          advance();
        }
        value.append(quantifier.get());
      } else if (ch == '$' && isRegexEndAnchor()) {
        value.appendCodePoint(advance());
      } else {
        break;
      }
    }
  }

  // A '$' ends a regex unless a variable name or ${...} follows it.
  private boolean isRegexEndAnchor() {
    int next = peek(1);
    if (next == -1 || isWhitespace(next)) return true;
    return next != '{' && !isVariableNameChar(next);
  }

  // Matches {n}, {n,} and {n,m} at the cursor.
  private Optional<String> peekRegexQuantifier() {
    int i = index + 1;
    int digitsStart = i;
    while (i < source.length() && isAsciiDigit(source.charAt(i))) i++;
    if (i == digitsStart || i >= source.length()) return Optional.empty();

    if (source.charAt(i) == ',') {
      i++;
      while (i < source.length() && isAsciiDigit(source.charAt(i))) i++;
    }
    if (i < source.length() && source.charAt(i) == '}') {
      return Optional.of(source.substring(index, i + 1));
    }
    return Optional.empty();
  }

  private static boolean isAsciiDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  static boolean isHorizontalWhitespace(int ch) {
    return ch == ' ' || ch == '\t' || ch == '\r';
  }

  // The Unicode White_Space property.
  private static boolean isWhitespace(int ch) {
    switch (ch) {
      case '\t':
      case '\n':
      case 0x0B:
      case '\f':
      case '\r':
      case ' ':
      case 0x85:
      case 0xA0:
      case 0x1680:
      case 0x2028:
      case 0x2029:
      case 0x202F:
      case 0x205F:
      case 0x3000:
        return true;
      default:
        return ch >= 0x2000 && ch <= 0x200A;
    }
  }

  private static boolean isNumeric(int ch) {
    switch (Character.getType(ch)) {
      case Character.DECIMAL_DIGIT_NUMBER:
      case Character.LETTER_NUMBER:
      case Character.OTHER_NUMBER:
        return true;
      default:
        return false;
    }
  }

  private static boolean isIdentStart(int ch) {
    return Character.isAlphabetic(ch) || ch == '_';
  }

  private static boolean isIdentContinue(int ch) {
    return Character.isAlphabetic(ch) || isNumeric(ch) || ch == '_' || ch == '-';
  }

  private static boolean isVariableNameChar(int ch) {
    return Character.isAlphabetic(ch) || isNumeric(ch) || ch == '_';
  }

  private static boolean isArgumentChar(int ch) {
    if (isWhitespace(ch)) return false;
    switch (ch) {
      case ';':
      case '{':
      case '}':
      case '"':
      case '\'':
      case '$':
        return false;
      default:
        return true;
    }
  }
}
