package ngxlint.lint.rules;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ngxlint.fix.Fix;
import ngxlint.fix.FixApplier;
import ngxlint.lint.LintError;

public class UnclosedQuoteTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private List<LintError> check() {
    return new UnclosedQuote().check(file.toString());
  }

  private String fixed(List<LintError> errors) {
    List<Fix> fixes =
        errors.stream().flatMap(e -> e.fixes().stream()).collect(Collectors.toList());
    return FixApplier.apply(file.toString(), fixes).content();
  }

  @Test
  public void closedQuotes() {
    println("add_header X \"a \\\" b\";");
    println("return 200 'multi");
    println("line';");
    println("# \"not a string");

    assertThat(check()).isEmpty();
  }

  @Test
  public void quoteOpenAtSemicolon() {
    println("add_header X \"abc;");
    println("listen 80;");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("Unclosed double quote - missing closing \"");
    assertThat(errors.get(0).line()).hasValue(1);
    assertThat(errors.get(0).column()).hasValue(14);
    assertThat(fixed(errors)).isEqualTo("add_header X \"abc\";\nlisten 80;\n");
  }

  @Test
  public void closingQuoteGoesBeforeFlagWord() {
    println("rewrite ^ \"/new permanent;");

    List<LintError> errors = check();

    assertThat(fixed(errors)).isEqualTo("rewrite ^ \"/new\" permanent;\n");
  }

  @Test
  public void quoteOpenAtEndOfFile() {
    println("listen 80;");
    println("return 200 'abc");
    println("}");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("Unclosed single quote - missing closing '");
    assertThat(errors.get(0).line()).hasValue(2);
    assertThat(errors.get(0).column()).hasValue(12);
    assertThat(errors.get(0).fixes()).isEmpty();
  }

  @Test
  public void offsetsAreBytes() {
    println("# 開発");
    println("add_header X \"例え;");

    assertThat(fixed(check())).isEqualTo("# 開発\nadd_header X \"例え\";\n");
  }
}
