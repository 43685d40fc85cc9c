package ngxlint.lint.rules;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;

import ngxlint.AST;
import ngxlint.fix.Fix;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

/** A directive that may appear only once per block, appearing again in the same block. */
public class DuplicateDirective implements LintRule {

  public static final String NAME = "duplicate-directive";

  static final ImmutableSet<String> NON_REPEATABLE =
      ImmutableSet.of(
          "worker_processes",
          "pid",
          "server_tokens",
          "autoindex",
          "root",
          "client_max_body_size",
          "sendfile",
          "gzip");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String category() {
    return "syntax";
  }

  @Override
  public String description() {
    return "Detects duplicate directives that should only appear once in a context";
  }

  private static class Scope {
    final String context;
    final ImmutableList<AST.Directive> directives;

    Scope(String context, ImmutableList<AST.Directive> directives) {
      this.context = context;
      this.directives = directives;
    }
  }

  @Override
  public List<LintError> check(AST.Config config, String source) {
    Multiset<Integer> directivesPerLine = HashMultiset.create();
    for (AST.Directive directive : config.allDirectives()) {
      directivesPerLine.add(directive.span().start().line());
      if (directive.span().end().line() != directive.span().start().line()) {
        directivesPerLine.add(directive.span().end().line());
      }
    }

    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    Deque<Scope> scopes = new ArrayDeque<>();
    scopes.push(new Scope(config.immediateParentContext().orElse("main"), config.directives()));
    while (!scopes.isEmpty()) {
      Scope scope = scopes.pop();
      Set<String> seen = new HashSet<>();
      for (AST.Directive directive : scope.directives) {
        if (NON_REPEATABLE.contains(directive.name()) && !seen.add(directive.name())) {
          errors.add(report(directive, scope.context, directivesPerLine));
        }
      }
      // Pushed in reverse so blocks are reported in document order.
      for (AST.Directive directive : scope.directives.reverse()) {
        if (directive.hasBlock() && !directive.block().get().isRaw()) {
          scopes.push(new Scope(directive.name(), directive.block().get().directives()));
        }
      }
    }
    return errors.build();
  }

  private LintError report(
      AST.Directive directive, String context, Multiset<Integer> directivesPerLine) {
    LintError error =
        LintError.warning(
            NAME,
            category(),
            String.format("Duplicate directive '%s' in %s context", directive.name(), context));
    if (directive.span().isSynthetic()) {
      return error;
    }

    error = error.at(directive.span().start());
    int line = directive.span().start().line();
    boolean aloneOnLine =
        directive.span().end().line() == line
            && directivesPerLine.count(line) == 1
            && !directive.trailingComment().isPresent();
    return aloneOnLine ? error.withFix(Fix.delete(line)) : error;
  }
}
