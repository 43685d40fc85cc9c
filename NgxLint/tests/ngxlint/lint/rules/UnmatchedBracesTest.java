package ngxlint.lint.rules;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ngxlint.fix.Fix;
import ngxlint.fix.FixApplier;
import ngxlint.lint.LintError;
import ngxlint.lint.Severity;

public class UnmatchedBracesTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private List<LintError> check() {
    return new UnmatchedBraces().check(file.toString());
  }

  private String fixed(List<LintError> errors) {
    List<Fix> fixes =
        errors.stream().flatMap(e -> e.fixes().stream()).collect(Collectors.toList());
    return FixApplier.apply(file.toString(), fixes).content();
  }

  @Test
  public void balanced() {
    println("http {");
    println("    server { listen 80; }");
    println("    return 200 \"}\"; # {");
    println("    location ~ ^/a{2}$ {");
    println("    }");
    println("}");
    println("content_by_lua_block {");
    println("    local t = {}");
    println("}");

    assertThat(check()).isEmpty();
  }

  @Test
  public void extraClosingBrace() {
    println("http {");
    println("}");
    println("}");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message())
        .isEqualTo("Unexpected closing brace '}' without matching opening brace");
    assertThat(errors.get(0).severity()).isEqualTo(Severity.ERROR);
    assertThat(errors.get(0).line()).hasValue(3);
    assertThat(errors.get(0).column()).hasValue(1);
    assertThat(fixed(errors)).isEqualTo("http {\n}\n");
  }

  @Test
  public void extraClosingBraceSharingALineIsNotDeleted() {
    println("listen 80; }");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).column()).hasValue(12);
    assertThat(errors.get(0).fixes()).isEmpty();
  }

  @Test
  public void unclosedBracesAreClosedAtTheEnd() {
    println("http {");
    println("    server {");
    println("        listen 80;");

    List<LintError> errors = check();

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).message()).isEqualTo("Unclosed brace '{' - missing closing brace '}'");
    assertThat(errors.get(0).line()).hasValue(2);
    assertThat(errors.get(0).column()).hasValue(12);
    assertThat(errors.get(1).line()).hasValue(1);
    assertThat(fixed(errors))
        .isEqualTo("http {\n    server {\n        listen 80;\n    }\n}\n");
  }

  @Test
  public void blockDirectiveWithoutBrace() {
    println("server");
    println("    listen 80;");
    println("}");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message())
        .isEqualTo("Block directive 'server' is missing opening brace '{'");
    assertThat(fixed(errors)).isEqualTo("server {\n    listen 80;\n}\n");
  }

  @Test
  public void braceOnNextLine() {
    println("server");
    println("{");
    println("    listen 80;");
    println("}");

    assertThat(check()).isEmpty();
  }
}
