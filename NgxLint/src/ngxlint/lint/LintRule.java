package ngxlint.lint;

import java.util.List;

import ngxlint.AST;

/**
 * A check over a parsed config. Rules run concurrently against one shared tree, so
 * implementations must not keep per-run state in fields.
 */
public interface LintRule {
  String name();

  /** One of {@code style}, {@code syntax}, {@code security}. */
  String category();

  String description();

  /**
   * Returns the problems found. {@code source} is the exact text {@code config} was parsed from,
   * for rules that need byte offsets of things the tree does not hold.
   */
  List<LintError> check(AST.Config config, String source);
}
