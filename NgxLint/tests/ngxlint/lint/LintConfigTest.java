package ngxlint.lint;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LintConfigTest {

  @TempDir Path dir;

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private LintConfig load() throws IOException, LintConfigException {
    Path path = dir.resolve(LintConfig.FILE_NAME);
    Files.writeString(path, file.toString(), StandardCharsets.UTF_8);
    return LintConfig.load(path);
  }

  @Test
  public void missingFileMeansDefaults() throws LintConfigException {
    LintConfig config = LintConfig.load(dir.resolve("absent.toml"));

    assertThat(config).isEqualTo(LintConfig.defaults());
    assertThat(config.isEnabled("indent")).isTrue();
    assertThat(config.indentSize()).isEqualTo(4);
  }

  @Test
  public void rulesCanBeDisabled() throws IOException, LintConfigException {
    println("[rules.trailing-whitespace]");
    println("enabled = false");
    println("");
    println("[rules.indent]");
    println("enabled = true");
    println("indent_size = 2");

    LintConfig config = load();

    assertThat(config.isEnabled("trailing-whitespace")).isFalse();
    assertThat(config.isEnabled("indent")).isTrue();
    assertThat(config.isEnabled("server-tokens-enabled")).isTrue();
    assertThat(config.indentSize()).isEqualTo(2);
  }

  @Test
  public void unknownKeysAreIgnored() throws IOException, LintConfigException {
    println("color = \"always\"");
    println("[rules.indent]");
    println("style = \"spaces\"");

    LintConfig config = load();

    assertThat(config.isEnabled("indent")).isTrue();
    assertThat(config.indentSize()).isEqualTo(4);
  }

  @Test
  public void malformedToml() throws IOException {
    println("[rules.indent");

    LintConfigException ex = assertThrows(LintConfigException.class, this::load);

    assertThat(ex.path()).isEqualTo(dir.resolve(LintConfig.FILE_NAME));
    assertThat(ex).hasMessageThat().contains(LintConfig.FILE_NAME);
  }

  @Test
  public void indentSizeMustBePositive() throws IOException {
    println("[rules.indent]");
    println("indent_size = 0");

    assertThrows(LintConfigException.class, this::load);
  }
}
