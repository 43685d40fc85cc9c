package ngxlint.lint.rules;

import java.util.List;

import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

/** Flags an on/off directive set to {@code on}, with a fix that turns it off. */
abstract class SwitchedOnRule implements LintRule {

  private final String directiveName;

  SwitchedOnRule(String directiveName) {
    this.directiveName = directiveName;
  }

  @Override
  public String category() {
    return "security";
  }

  abstract String message();

  @Override
  public List<LintError> check(AST.Config config, String source) {
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    for (AST.Directive directive : config.allDirectives()) {
      if (!directive.is(directiveName) || !directive.firstArgIs("on")) {
        continue;
      }

      LintError error = LintError.warning(name(), category(), message());
      AST.Argument arg = directive.args().get(0);
      if (!directive.span().isSynthetic()) {
        error = error.at(directive.span().start());
      }
      if (!arg.span().isSynthetic()) {
        error =
            error.withFix(
                Fix.replaceRange(arg.span().start().offset(), arg.span().end().offset(), "off"));
      }
      errors.add(error);
    }
    return errors.build();
  }
}
