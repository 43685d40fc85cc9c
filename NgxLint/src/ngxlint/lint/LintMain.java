package ngxlint.lint;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import com.google.common.collect.ImmutableList;

public class LintMain {

  private static final String USAGE =
      "Usage: ngxlint [--fix] [--config FILE] [--verbose] FILE...";

  private static final Comparator<LintError> BY_POSITION =
      Comparator.<LintError>comparingInt(e -> e.line().orElse(0))
          .thenComparingInt(e -> e.column().orElse(0));

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Returns the exit code: 1 if any error remains, 2 for bad usage or config, else 0. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    boolean fix = false;
    boolean verbose = false;
    Optional<Path> configPath = Optional.empty();
    List<Path> files = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--fix":
          fix = true;
          break;
        case "--verbose":
          verbose = true;
          break;
        case "--config":
          if (++i == args.length) {
            err.println(USAGE);
            return 2;
          }
          configPath = Optional.of(Paths.get(args[i]));
          break;
        default:
          if (args[i].startsWith("--")) {
            err.println("Unknown option " + args[i]);
            err.println(USAGE);
            return 2;
          }
          files.add(Paths.get(args[i]));
      }
    }
    if (files.isEmpty()) {
      err.println(USAGE);
      return 2;
    }
    if (verbose) {
      LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
      context.getLogger("ngxlint").setLevel(Level.DEBUG);
    }

    LintConfig config;
    try {
      config = LintConfig.load(configPath.orElse(Paths.get(LintConfig.FILE_NAME)));
    } catch (LintConfigException ex) {
      err.println("ERROR: " + ex.getMessage());
      return 2;
    }

    ImmutableList<LintRunner.FileResult> results = LintRunner.create(config, fix).run(files);

    boolean failed = false;
    int applied = 0;
    for (LintRunner.FileResult result : results) {
      result.errors().stream()
          .sorted(BY_POSITION)
          .forEach(e -> out.println(e.format(result.path().toString())));
      failed |= result.hasErrors();
      applied += result.appliedFixes();
    }
    if (fix) {
      out.println(String.format("Applied %d fix(es)", applied));
    }
    return failed ? 1 : 0;
  }
}
