package ngxlint.lint.rules;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ngxlint.ParseException;
import ngxlint.Parser;
import ngxlint.fix.Fix;
import ngxlint.fix.FixApplier;
import ngxlint.lint.LintError;
import ngxlint.lint.Severity;

public class TrailingWhitespaceTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private List<LintError> check() throws ParseException {
    String source = file.toString();
    return new TrailingWhitespace().check(Parser.parseString(source), source);
  }

  private String fixed(List<LintError> errors) {
    List<Fix> fixes =
        errors.stream().flatMap(e -> e.fixes().stream()).collect(Collectors.toList());
    return FixApplier.apply(file.toString(), fixes).content();
  }

  @Test
  public void cleanFile() throws ParseException {
    println("listen 80;");
    println("");

    assertThat(check()).isEmpty();
  }

  @Test
  public void reportsSpacesAndTabs() throws ParseException {
    println("listen 80;  ");
    println("http {\t");
    println("}");

    List<LintError> errors = check();

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).message()).isEqualTo("trailing whitespace at end of line");
    assertThat(errors.get(0).severity()).isEqualTo(Severity.WARNING);
    assertThat(errors.get(0).line()).hasValue(1);
    assertThat(errors.get(0).column()).hasValue(11);
    assertThat(errors.get(1).line()).hasValue(2);
    assertThat(fixed(errors)).isEqualTo("listen 80;\nhttp {\n}\n");
  }

  @Test
  public void keepsCarriageReturn() throws ParseException {
    file.append("listen 80; \r\n");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(fixed(errors)).isEqualTo("listen 80;\r\n");
  }

  @Test
  public void whitespaceOnlyLine() throws ParseException {
    println("listen 80;");
    println("    ");
    println("root /;");

    List<LintError> errors = check();

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).column()).hasValue(1);
    assertThat(fixed(errors)).isEqualTo("listen 80;\n\nroot /;\n");
  }

  @Test
  public void columnsCountCharacters() throws ParseException {
    println("# 開発 ");

    List<LintError> errors = check();

    assertThat(errors.get(0).column()).hasValue(5);
    assertThat(fixed(errors)).isEqualTo("# 開発\n");
  }

  @Test
  public void ignoresWhitespaceInsideStrings() throws ParseException {
    println("return 200 \"a  ");
    println("b\";");

    assertThat(check()).isEmpty();
  }
}
