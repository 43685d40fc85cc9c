package ngxlint.lint.rules;

import com.google.common.collect.ImmutableList;

import ngxlint.lint.LintConfig;
import ngxlint.lint.LintRule;
import ngxlint.lint.SourceCheck;

/** The rules and pre-parse checks that ship with the linter, in reporting order. */
public final class BuiltinRules {

  public static ImmutableList<LintRule> rules(LintConfig config) {
    return ImmutableList.of(
        new DuplicateDirective(),
        new ServerTokensEnabled(),
        new AutoindexEnabled(),
        new Indent(config.indentSize()),
        new TrailingWhitespace(),
        new SpaceBeforeSemicolon());
  }

  public static ImmutableList<SourceCheck> sourceChecks() {
    return ImmutableList.of(new UnmatchedBraces(), new UnclosedQuote(), new MissingSemicolon());
  }

  private BuiltinRules() {}
}
