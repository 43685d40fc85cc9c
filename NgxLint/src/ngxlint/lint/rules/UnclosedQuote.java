package ngxlint.lint.rules;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;

import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.SourceCheck;

/**
 * Reports quotes that are never closed. A quote still open at the end of a line ending in
 * {@code ;} is taken to be a mistake rather than a multi-line string.
 */
public class UnclosedQuote implements SourceCheck {

  public static final String NAME = "unclosed-quote";

  /** Words that end a directive and so belong after the closing quote. */
  private static final ImmutableList<String> TRAILING_FLAGS =
      ImmutableList.of(
          "permanent",
          "redirect",
          "last",
          "break",
          "default",
          "backup",
          "down",
          "weight",
          "max_fails",
          "always");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String category() {
    return "syntax";
  }

  @Override
  public List<LintError> check(String source) {
    SourceLines scan = SourceLines.scan(source);
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    for (SourceLines.Line line : scan.lines()) {
      if (line.abandonedQuote().isPresent()) {
        errors.add(report(scan, line.abandonedQuote().get()));
      }
    }
    if (scan.unclosedQuote().isPresent()) {
      errors.add(report(scan, scan.unclosedQuote().get()));
    }
    return errors.build();
  }

  private LintError report(SourceLines scan, SourceLines.Quote quote) {
    String kind = quote.quote() == '"' ? "double quote" : "single quote";
    String message = String.format("Unclosed %s - missing closing %s", kind, quote.quote());
    LintError error = LintError.error(NAME, category(), message).at(quote.line(), quote.column());
    Optional<Fix> fix = closingFix(scan.lines().get(quote.line() - 1), quote);
    return fix.isPresent() ? error.withFix(fix.get()) : error;
  }

  /** Inserts the closing quote before the {@code ;}, or before a trailing flag word. */
  private static Optional<Fix> closingFix(SourceLines.Line line, SourceLines.Quote quote) {
    String code = line.code();
    if (!code.endsWith(";") || quote.index() >= code.length() - 1) {
      return Optional.empty();
    }
    String beforeSemicolon = code.substring(0, code.length() - 1);
    String quoted = beforeSemicolon.substring(quote.index() + 1);

    int insertAt = beforeSemicolon.length();
    for (String flag : TRAILING_FLAGS) {
      if (quoted.endsWith(" " + flag)) {
        insertAt = beforeSemicolon.length() - flag.length() - 1;
        break;
      }
    }
    int offset = line.startOffset() + Utf8.encodedLength(code.substring(0, insertAt));
    return Optional.of(Fix.insertAt(offset, String.valueOf(quote.quote())));
  }
}
