package ngxlint.lint.rules;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.ParseException;
import ngxlint.Parser;
import ngxlint.fix.Fix;
import ngxlint.fix.FixApplier;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

public class SwitchedOnRuleTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private List<LintError> check(LintRule rule) throws ParseException {
    String source = file.toString();
    return rule.check(Parser.parseString(source), source);
  }

  private String fixed(List<LintError> errors) {
    List<Fix> fixes =
        errors.stream().flatMap(e -> e.fixes().stream()).collect(Collectors.toList());
    return FixApplier.apply(file.toString(), fixes).content();
  }

  @Test
  public void serverTokensOn() throws ParseException {
    println("http {");
    println("    server_tokens on;");
    println("    server {");
    println("        server_tokens   on ; # again");
    println("    }");
    println("}");

    List<LintError> errors = check(new ServerTokensEnabled());

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).rule()).isEqualTo("server-tokens-enabled");
    assertThat(errors.get(0).category()).isEqualTo("security");
    assertThat(errors.get(0).message())
        .isEqualTo("server_tokens should be 'off' to hide nginx version");
    assertThat(errors.get(0).line()).hasValue(2);
    assertThat(errors.get(0).column()).hasValue(5);
    assertThat(fixed(errors))
        .isEqualTo(
            "http {\n"
                + "    server_tokens off;\n"
                + "    server {\n"
                + "        server_tokens   off ; # again\n"
                + "    }\n"
                + "}\n");
  }

  @Test
  public void serverTokensOffOrBuild() throws ParseException {
    println("server_tokens off;");
    println("server_tokens build;");

    assertThat(check(new ServerTokensEnabled())).isEmpty();
  }

  @Test
  public void autoindexOn() throws ParseException {
    println("location / {");
    println("    autoindex on;");
    println("}");

    List<LintError> errors = check(new AutoindexEnabled());

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message())
        .isEqualTo("autoindex is enabled, which can expose directory contents");
    assertThat(fixed(errors)).isEqualTo("location / {\n    autoindex off;\n}\n");
  }

  @Test
  public void syntheticDirectiveHasNoFix() {
    AST.Directive autoindex =
        AST.Directive.builder("autoindex")
            .setArgs(ImmutableList.of(AST.Argument.literal("on")))
            .build();

    List<LintError> errors =
        new AutoindexEnabled().check(AST.Config.create(ImmutableList.of(autoindex)), "");

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).line()).isEmpty();
    assertThat(errors.get(0).fixes()).isEmpty();
  }
}
