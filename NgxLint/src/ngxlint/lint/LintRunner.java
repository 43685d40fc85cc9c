package ngxlint.lint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.ParseException;
import ngxlint.Parser;
import ngxlint.fix.Fix;
import ngxlint.fix.FixApplier;
import ngxlint.lint.rules.BuiltinRules;

/**
 * Lints files: pre-parse checks, then a parse, then the rules. In fix mode every fix found in a
 * file is applied in one pass and the file is rewritten if anything changed.
 */
public class LintRunner {
  private static final Logger logger = LoggerFactory.getLogger(LintRunner.class);

  public static final String PARSE_ERROR = "parse-error";

  public static final String READ_ERROR = "read-error";

  public static final String WRITE_ERROR = "write-error";

  @AutoValue
  public abstract static class FileResult {
    public abstract Path path();

    /** What remains to be reported; after fixing, what the fixed file still has. */
    public abstract ImmutableList<LintError> errors();

    public abstract int appliedFixes();

    public boolean hasErrors() {
      return errors().stream().anyMatch(LintError::isError);
    }

    public static FileResult create(Path path, List<LintError> errors, int appliedFixes) {
      return new AutoValue_LintRunner_FileResult(path, ImmutableList.copyOf(errors), appliedFixes);
    }
  }

  private final Linter linter;
  private final ImmutableList<SourceCheck> sourceChecks;
  private final boolean fix;

  public LintRunner(
      Linter linter, Iterable<? extends SourceCheck> sourceChecks, LintConfig config, boolean fix) {
    this.linter = linter;
    ImmutableList.Builder<SourceCheck> enabled = ImmutableList.builder();
    for (SourceCheck check : sourceChecks) {
      if (config.isEnabled(check.name())) {
        enabled.add(check);
      }
    }
    this.sourceChecks = enabled.build();
    this.fix = fix;
  }

  public static LintRunner create(LintConfig config, boolean fix) {
    return new LintRunner(Linter.create(config), BuiltinRules.sourceChecks(), config, fix);
  }

  /** Lints the files in parallel; results are in the order of {@code paths}. */
  public ImmutableList<FileResult> run(List<Path> paths) {
    return paths.parallelStream().map(this::runFile).collect(ImmutableList.toImmutableList());
  }

  public FileResult runFile(Path path) {
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      logger.warn("Cannot read {}", path, ex);
      return FileResult.create(
          path, ImmutableList.of(LintError.error(READ_ERROR, "io", "cannot read file: " + ex)), 0);
    }

    ImmutableList<LintError> errors = check(source);
    if (!fix) {
      return FileResult.create(path, errors, 0);
    }

    ImmutableList<Fix> fixes =
        errors.stream().flatMap(e -> e.fixes().stream()).collect(ImmutableList.toImmutableList());
    if (fixes.isEmpty()) {
      return FileResult.create(path, errors, 0);
    }

    FixApplier.Result result = FixApplier.apply(source, fixes);
    if (result.appliedCount() == 0) {
      return FileResult.create(path, errors, 0);
    }
    try {
      Files.writeString(path, result.content(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      logger.warn("Cannot write {}", path, ex);
      return FileResult.create(
          path,
          ImmutableList.<LintError>builder()
              .addAll(errors)
              .add(LintError.error(WRITE_ERROR, "io", "cannot write fixes: " + ex))
              .build(),
          0);
    }
    logger.debug("Applied {} of {} fix(es) to {}", result.appliedCount(), fixes.size(), path);
    return FileResult.create(path, check(result.content()), result.appliedCount());
  }

  /**
   * All diagnostics for {@code source}. A parse failure already explained by a pre-parse check
   * is not reported a second time.
   */
  public ImmutableList<LintError> check(String source) {
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    boolean sourceErrors = false;
    for (SourceCheck check : sourceChecks) {
      for (LintError error : check.check(source)) {
        errors.add(error);
        sourceErrors |= error.isError();
      }
    }

    AST.Config config;
    try {
      config = Parser.parseString(source);
    } catch (ParseException ex) {
      if (sourceErrors) {
        logger.debug("Parse failed after pre-parse errors: {}", ex.getMessage());
      } else {
        errors.add(LintError.error(PARSE_ERROR, "syntax", ex.getMessage()).at(ex.position()));
      }
      return errors.build();
    }

    errors.addAll(linter.lint(config, source));
    return errors.build();
  }
}
