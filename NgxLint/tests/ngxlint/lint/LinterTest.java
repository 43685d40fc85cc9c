package ngxlint.lint;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.truth.Correspondence;

import ngxlint.AST;
import ngxlint.ParseException;
import ngxlint.Parser;

public class LinterTest {

  private static final Correspondence<LintError, String> FROM_RULE =
      Correspondence.transforming(LintError::rule, "from rule");

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private static class FixedRule implements LintRule {
    private final String name;
    private final int count;

    FixedRule(String name, int count) {
      this.name = name;
      this.count = count;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String category() {
      return "style";
    }

    @Override
    public String description() {
      return "reports " + count + " problems";
    }

    @Override
    public List<LintError> check(AST.Config config, String source) {
      ImmutableList.Builder<LintError> errors = ImmutableList.builder();
      for (int i = 1; i <= count; i++) {
        errors.add(LintError.warning(name, category(), "problem").at(i, 1));
      }
      return errors.build();
    }
  }

  private static class BrokenRule extends FixedRule {
    BrokenRule() {
      super("broken", 0);
    }

    @Override
    public List<LintError> check(AST.Config config, String source) {
      throw new IllegalStateException("boom");
    }
  }

  private List<LintError> lint(Linter linter) throws ParseException {
    String source = file.toString();
    return linter.lint(Parser.parseString(source), source);
  }

  @Test
  public void resultsFollowRegistrationOrder() throws ParseException {
    println("listen 80;");
    ImmutableList.Builder<LintRule> rules = ImmutableList.builder();
    for (int i = 0; i < 16; i++) {
      rules.add(new FixedRule("rule" + i, 2));
    }

    List<LintError> errors = lint(new Linter(rules.build(), LintConfig.defaults()));

    assertThat(errors).hasSize(32);
    for (int i = 0; i < 16; i++) {
      assertThat(errors.get(2 * i).rule()).isEqualTo("rule" + i);
      assertThat(errors.get(2 * i + 1).rule()).isEqualTo("rule" + i);
      assertThat(errors.get(2 * i + 1).line()).hasValue(2);
    }
  }

  @Test
  public void abortedRuleBecomesAnError() throws ParseException {
    println("listen 80;");

    List<LintError> errors =
        lint(
            new Linter(
                ImmutableList.of(new FixedRule("a", 1), new BrokenRule(), new FixedRule("b", 1)),
                LintConfig.defaults()));

    assertThat(errors).comparingElementsUsing(FROM_RULE).containsExactly("a", "broken", "b");
    LintError aborted = errors.get(1);
    assertThat(aborted.severity()).isEqualTo(Severity.ERROR);
    assertThat(aborted.message()).isEqualTo("rule aborted: boom");
    assertThat(aborted.line()).isEmpty();
  }

  @Test
  public void disabledRulesAreSkipped() throws ParseException {
    println("listen 80;");
    LintConfig config =
        LintConfig.create(
            ImmutableMap.of(
                "a", LintConfig.RuleConfig.create(Optional.of(false), OptionalInt.empty())));

    Linter linter =
        new Linter(ImmutableList.of(new FixedRule("a", 1), new FixedRule("b", 1)), config);

    assertThat(linter.rules()).hasSize(1);
    assertThat(lint(linter)).comparingElementsUsing(FROM_RULE).containsExactly("b");
  }

  @Test
  public void builtinRules() throws ParseException {
    println("server_tokens on;  ");
    println("http {");
    println("  autoindex on ;");
    println("}");

    List<LintError> errors = lint(Linter.create(LintConfig.defaults()));

    assertThat(errors)
        .comparingElementsUsing(FROM_RULE)
        .containsExactly(
            "server-tokens-enabled",
            "autoindex-enabled",
            "indent",
            "trailing-whitespace",
            "space-before-semicolon")
        .inOrder();
  }
}
