package ngxlint.lint.rules;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.SourceCheck;

/**
 * Reports braces that do not pair up: a {@code }} with nothing open, a {@code {} never closed,
 * and a known block directive whose line has no {@code {}.
 */
public class UnmatchedBraces implements SourceCheck {

  public static final String NAME = "unmatched-braces";

  static final ImmutableSet<String> BLOCK_DIRECTIVES =
      ImmutableSet.of(
          "http",
          "server",
          "location",
          "upstream",
          "events",
          "stream",
          "mail",
          "types",
          "if",
          "map",
          "geo",
          "split_clients",
          "limit_except");

  private static class Opener {
    final int line;
    final int column;
    final String indent;

    Opener(int line, int column, String indent) {
      this.line = line;
      this.column = column;
      this.indent = indent;
    }
  }

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
    ImmutableList<SourceLines.Line> lines = scan.lines();
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    Deque<Opener> open = new ArrayDeque<>();

    for (int i = 0; i < lines.size(); i++) {
      SourceLines.Line line = lines.get(i);
      for (SourceLines.Brace brace : line.braces()) {
        if (brace.isOpen()) {
          open.push(new Opener(brace.line(), brace.column(), line.indent()));
        } else if (open.isEmpty()) {
          LintError error =
              LintError.error(
                      NAME,
                      category(),
                      "Unexpected closing brace '}' without matching opening brace")
                  .at(brace.line(), brace.column());
          if (CharMatcher.whitespace().trimFrom(line.text()).equals("}")) {
            error = error.withFix(Fix.delete(line.number()));
          }
          errors.add(error);
        } else {
          open.pop();
        }
      }

      Optional<String> missing = missingOpeningBrace(scan, i);
      if (missing.isPresent()) {
        errors.add(
            LintError.error(
                    NAME,
                    category(),
                    String.format(
                        "Block directive '%s' is missing opening brace '{'", missing.get()))
                .at(line.number(), line.codeEndColumn())
                .withFix(Fix.insertAt(line.codeEndOffset(), " {")));
        // Treat the brace as present so its closing brace still matches.
        open.push(new Opener(line.number(), line.codeEndColumn(), line.indent()));
      }
    }

    while (!open.isEmpty()) {
      Opener opener = open.pop();
      errors.add(
          LintError.error(NAME, category(), "Unclosed brace '{' - missing closing brace '}'")
              .at(opener.line, opener.column)
              .withFix(Fix.insertAfter(lines.size(), opener.indent + "}")));
    }
    return errors.build();
  }

  /** The block directive named by line {@code i} if it needs a brace it does not have. */
  private static Optional<String> missingOpeningBrace(SourceLines scan, int i) {
    SourceLines.Line line = scan.lines().get(i);
    if (line.inRawBody() || line.startsInString() || line.endsInString() || !line.hasCode()) {
      return Optional.empty();
    }
    String code = line.code();
    if (code.endsWith("{") || code.endsWith(";") || code.endsWith("}")) {
      return Optional.empty();
    }
    Optional<String> name = line.firstWord().filter(BLOCK_DIRECTIVES::contains);
    if (!name.isPresent()) {
      return Optional.empty();
    }
    // Allow the brace on the following line.
    Optional<SourceLines.Line> next = scan.nextWithCode(i);
    if (next.isPresent() && next.get().trimmedCode().startsWith("{")) {
      return Optional.empty();
    }
    return name;
  }
}
