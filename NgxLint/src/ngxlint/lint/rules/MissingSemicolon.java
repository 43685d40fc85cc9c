package ngxlint.lint.rules;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.SourceCheck;

/**
 * Reports directives whose statement ends without a {@code ;}. A statement continues onto the
 * next line only when that line is indented deeper than the statement's first line.
 */
public class MissingSemicolon implements SourceCheck {

  public static final String NAME = "missing-semicolon";

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

    boolean inStatement = false;
    int statementIndent = 0;
    boolean isDirective = false;
    for (int i = 0; i < lines.size(); i++) {
      SourceLines.Line line = lines.get(i);
      if (!line.hasCode() || line.inRawBody()) {
        continue;
      }
      if (!inStatement) {
        inStatement = true;
        statementIndent = line.indent().length();
        isDirective = startsLikeDirective(line.trimmedCode());
      }

      if (endsStatement(line.code())) {
        inStatement = false;
        continue;
      }
      Optional<SourceLines.Line> next = scan.nextWithCode(i);
      if (next.isPresent() && next.get().inRawBody()) {
        // The line opened a raw block and its body follows.
        inStatement = false;
        continue;
      }
      if (line.endsInString() || continues(next, statementIndent)) {
        continue;
      }

      inStatement = false;
      if (isDirective) {
        errors.add(
            LintError.error(NAME, category(), "Missing semicolon at end of directive")
                .at(line.number(), line.codeEndColumn())
                .withFix(Fix.insertAt(line.codeEndOffset(), ";")));
      }
    }
    return errors.build();
  }

  private static boolean endsStatement(String code) {
    return code.endsWith(";") || code.endsWith("{") || code.endsWith("}");
  }

  private static boolean startsLikeDirective(String code) {
    char first = code.charAt(0);
    return Character.isLetter(first) || first == '_';
  }

  private static boolean continues(Optional<SourceLines.Line> next, int statementIndent) {
    if (!next.isPresent()) {
      return false;
    }
    String code = next.get().trimmedCode();
    if (code.startsWith("{")) {
      return true;
    }
    return next.get().indent().length() > statementIndent
        && !code.startsWith("}")
        && !code.endsWith("{");
  }
}
