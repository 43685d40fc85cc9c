package ngxlint.lint;

import java.nio.file.Path;

public class LintConfigException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Path path;

  public LintConfigException(Path path, String errorMsg, Throwable cause) {
    super(String.format("%s: %s", path, errorMsg), cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
