package ngxlint.lint.rules;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.Lexer;
import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

/** Spaces or tabs between a directive's last token and its {@code ;} on the same line. */
public class SpaceBeforeSemicolon implements LintRule {

  public static final String NAME = "space-before-semicolon";

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
    return "Check for spaces or tabs before semicolons";
  }

  @Override
  public List<LintError> check(AST.Config config, String source) {
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    for (AST.Directive directive : config.allDirectives()) {
      String gap = directive.spaceBeforeTerminator();
      if (directive.hasBlock()
          || directive.span().isSynthetic()
          || gap.isEmpty()
          || !HORIZONTAL_WHITESPACE.matchesAllOf(gap)) {
        continue;
      }

      // The span ends just past the semicolon; the gap is ASCII so lengths are byte counts.
      Lexer.Position end = directive.span().end();
      int semicolon = end.offset() - 1;
      errors.add(
          LintError.warning(NAME, category(), "space before semicolon")
              .at(end.line(), end.column() - 1 - gap.length())
              .withFix(Fix.deleteRange(semicolon - gap.length(), semicolon)));
    }
    return errors.build();
  }
}
