package ngxlint.lint.rules;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import ngxlint.Lexer;
import ngxlint.Parser;

/**
 * A line-by-line view of config text for checks that must run on input the parser rejects.
 *
 * <p>Follows the lexer's rules: quotes open a string anywhere outside one, a backslash escapes
 * the next character inside one, and {@code #} starts a comment only at the start of a line or
 * after whitespace. Escaped braces and braces the lexer reads as part of an argument are not
 * counted. Raw block bodies are scanned the same way but flagged so checks can skip them.
 */
final class SourceLines {

  private static final CharMatcher HORIZONTAL_WHITESPACE = CharMatcher.anyOf(" \t");

  private static final Pattern QUANTIFIER = Pattern.compile("\\{[0-9]+(,[0-9]*)?}");

  private static final Pattern VARIABLE_BRACES = Pattern.compile("\\{[A-Za-z0-9_]+}");

  private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  @AutoValue
  abstract static class Brace {
    abstract boolean isOpen();

    abstract int line();

    abstract int column();

    abstract int offset();

    static Brace create(boolean isOpen, int line, int column, int offset) {
      return new AutoValue_SourceLines_Brace(isOpen, line, column, offset);
    }
  }

  @AutoValue
  abstract static class Quote {
    abstract char quote();

    abstract int line();

    abstract int column();

    /** Index of the quote in its line's text. */
    abstract int index();

    static Quote create(char quote, int line, int column, int index) {
      return new AutoValue_SourceLines_Quote(quote, line, column, index);
    }
  }

  @AutoValue
  abstract static class Line {
    abstract int number();

    /** Byte offset of the line's first character. */
    abstract int startOffset();

    /** The line without its {@code \n}. */
    abstract String text();

    /** The text before any comment, without trailing whitespace. */
    abstract String code();

    abstract boolean startsInString();

    abstract boolean endsInString();

    /** Whether the line starts inside the body of a raw block. */
    abstract boolean inRawBody();

    abstract ImmutableList<Brace> braces();

    /**
     * A quote opened on this line and still open at a line that ends in {@code ;}. Scanning
     * continues as if it had been closed at the end of the line.
     */
    abstract Optional<Quote> abandonedQuote();

    boolean hasCode() {
      return !code().isEmpty();
    }

    String indent() {
      String rest = HORIZONTAL_WHITESPACE.trimLeadingFrom(text());
      return text().substring(0, text().length() - rest.length());
    }

    String trimmedCode() {
      return HORIZONTAL_WHITESPACE.trimLeadingFrom(code());
    }

    int codeEndOffset() {
      return startOffset() + Utf8.encodedLength(code());
    }

    /** The 1-based column just past the code. */
    int codeEndColumn() {
      return code().codePointCount(0, code().length()) + 1;
    }

    Optional<String> firstWord() {
      return Optional.ofNullable(Iterables.getFirst(WORDS.split(code()), null));
    }
  }

  private final ImmutableList<Line> lines;
  private final Optional<Quote> unclosedQuote;

  private SourceLines(ImmutableList<Line> lines, Optional<Quote> unclosedQuote) {
    this.lines = lines;
    this.unclosedQuote = unclosedQuote;
  }

  ImmutableList<Line> lines() {
    return lines;
  }

  /** A quote still open at the end of the text. */
  Optional<Quote> unclosedQuote() {
    return unclosedQuote;
  }

  /** The first line after {@code index} that has code, skipping blank and comment-only lines. */
  Optional<Line> nextWithCode(int index) {
    for (int i = index + 1; i < lines.size(); i++) {
      if (lines.get(i).hasCode()) {
        return Optional.of(lines.get(i));
      }
    }
    return Optional.empty();
  }

  static SourceLines scan(String source) {
    return new Scanner(source).scan();
  }

  private static class Scanner {
    private final String source;

    private final ImmutableList.Builder<Line> lines = ImmutableList.builder();
    private int quote = 0;
    private Quote quoteStart = null;
    private boolean escaped = false;
    private int depth = 0;
    private int rawDepth = 0;
    private final StringBuilder statement = new StringBuilder();

    Scanner(String source) {
      this.source = source;
    }

    SourceLines scan() {
      int start = 0;
      int offset = 0;
      int number = 1;
      while (start < source.length()) {
        int end = source.indexOf('\n', start);
        if (end == -1) {
          end = source.length();
        }
        String text = source.substring(start, end);
        lines.add(scanLine(number++, offset, text));
        offset += Utf8.encodedLength(text) + 1;
        start = end + 1;
      }
      return new SourceLines(lines.build(), Optional.ofNullable(quoteStart));
    }

    private Line scanLine(int number, int startOffset, String text) {
      boolean startsInString = quote != 0;
      boolean inRawBody = rawDepth != 0;
      ImmutableList.Builder<Brace> braces = ImmutableList.builder();
      int commentStart = -1;

      int column = 1;
      int offset = startOffset;
      int prev = '\n';
      for (int i = 0; i < text.length(); ) {
        int c = text.codePointAt(i);
        int glued = quote == 0 ? gluedBraces(text, i, prev) : 0;
        if (glued > 0) {
          statement.append(text, i, i + glued);
          prev = text.charAt(i + glued - 1);
          column += glued;
          offset += glued;
          i += glued;
          continue;
        }

        if (quote != 0) {
          if (escaped) {
            escaped = false;
          } else if (c == '\\') {
            escaped = true;
          } else if (c == quote) {
            quote = 0;
            quoteStart = null;
          }
        } else if (c == '#' && (prev == '\n' || CharMatcher.whitespace().matches((char) prev))) {
          commentStart = i;
          break;
        } else if (c == '"' || c == '\'') {
          quote = c;
          quoteStart = Quote.create((char) c, number, column, i);
          escaped = false;
        } else if (c == '{') {
          braces.add(Brace.create(true, number, column, offset));
          openBlock();
        } else if (c == '}') {
          braces.add(Brace.create(false, number, column, offset));
          closeBlock();
        } else if (c == ';') {
          statement.setLength(0);
        } else {
          statement.appendCodePoint(c);
        }

        prev = c;
        column++;
        offset += Lexer.utf8Length(c);
        i += Character.charCount(c);
      }
      statement.append(' ');

      String code =
          CharMatcher.whitespace()
              .trimTrailingFrom(commentStart == -1 ? text : text.substring(0, commentStart));
      Optional<Quote> abandoned = Optional.empty();
      if (quote != 0 && quoteStart.line() == number && code.endsWith(";")) {
        abandoned = Optional.of(quoteStart);
        quote = 0;
        quoteStart = null;
        escaped = false;
      }

      return new AutoValue_SourceLines_Line(
          number,
          startOffset,
          text,
          code,
          startsInString,
          quote != 0,
          inRawBody,
          braces.build(),
          abandoned);
    }

    /** The length of an ASCII run at {@code i} whose braces are argument text, or 0. */
    private static int gluedBraces(String text, int i, int prev) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        char next = text.charAt(i + 1);
        return next == '{' || next == '}' ? 2 : 0;
      }
      if (c != '{' || prev == '\n' || CharMatcher.whitespace().matches((char) prev)) {
        return 0;
      }
      Matcher matcher = (prev == '$' ? VARIABLE_BRACES : QUANTIFIER).matcher(text);
      matcher.region(i, text.length());
      return matcher.lookingAt() ? matcher.end() - i : 0;
    }

    private void openBlock() {
      depth++;
      if (rawDepth == 0) {
        String name = Iterables.getFirst(WORDS.split(statement), "");
        if (Parser.isRawBlockDirective(name)) {
          rawDepth = depth;
        }
      }
      statement.setLength(0);
    }

    private void closeBlock() {
      if (rawDepth != 0 && depth == rawDepth) {
        rawDepth = 0;
      }
      depth = Math.max(0, depth - 1);
      statement.setLength(0);
    }
  }
}
