package ngxlint.lint;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.lint.rules.BuiltinRules;

/**
 * Runs an ordered set of rules over one parsed config. Rules run concurrently against the shared
 * tree; diagnostics come back grouped by rule in registration order.
 */
public class Linter {
  private static final Logger logger = LoggerFactory.getLogger(Linter.class);

  private final ImmutableList<LintRule> rules;

  /** Keeps the rules {@code config} leaves enabled, in the given order. */
  public Linter(Iterable<? extends LintRule> rules, LintConfig config) {
    ImmutableList.Builder<LintRule> enabled = ImmutableList.builder();
    for (LintRule rule : rules) {
      if (config.isEnabled(rule.name())) {
        enabled.add(rule);
      } else {
        logger.debug("Rule {} disabled by config", rule.name());
      }
    }
    this.rules = enabled.build();
  }

  public static Linter create(LintConfig config) {
    return new Linter(BuiltinRules.rules(config), config);
  }

  public ImmutableList<LintRule> rules() {
    return rules;
  }

  public ImmutableList<LintError> lint(AST.Config config, String source) {
    return rules
        .parallelStream()
        .map(rule -> runRule(rule, config, source))
        .flatMap(List::stream)
        .collect(ImmutableList.toImmutableList());
  }

  private static List<LintError> runRule(LintRule rule, AST.Config config, String source) {
    try {
      List<LintError> errors = rule.check(config, source);
      logger.debug("Rule {} reported {} problem(s)", rule.name(), errors.size());
      return errors;
    } catch (RuntimeException ex) {
      logger.warn("Rule {} aborted", rule.name(), ex);
      return ImmutableList.of(
          LintError.error(rule.name(), rule.category(), "rule aborted: " + ex.getMessage()));
    }
  }
}
