package ngxlint.lint.rules;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

/** Spaces or tabs at the end of a line. Lines ending inside a quoted string are left alone. */
public class TrailingWhitespace implements LintRule {

  public static final String NAME = "trailing-whitespace";

  private static final CharMatcher HORIZONTAL_WHITESPACE = CharMatcher.anyOf(" \t");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String category() {
    return "style";
  }

  @Override
  public String description() {
    return "Detects trailing whitespace at the end of lines";
  }

  @Override
  public List<LintError> check(AST.Config config, String source) {
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    for (SourceLines.Line line : SourceLines.scan(source).lines()) {
      if (line.endsInString()) {
        continue;
      }
      String text = line.text();
      String body = text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
      String trimmed = HORIZONTAL_WHITESPACE.trimTrailingFrom(body);
      if (trimmed.length() == body.length()) {
        continue;
      }

      int start = line.startOffset() + Utf8.encodedLength(trimmed);
      int end = start + (body.length() - trimmed.length());
      errors.add(
          LintError.warning(NAME, category(), "trailing whitespace at end of line")
              .at(line.number(), trimmed.codePointCount(0, trimmed.length()) + 1)
              .withFix(Fix.deleteRange(start, end)));
    }
    return errors.build();
  }
}
