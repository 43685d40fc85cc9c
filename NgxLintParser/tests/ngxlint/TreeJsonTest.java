package ngxlint;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import ngxlint.AST.Config;
import ngxlint.AST.Directive;

public class TreeJsonTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private Config parse() throws ParseException {
    return Parser.parseString(file.toString());
  }

  @Test
  public void itemsAreExternallyTagged() throws ParseException, IOException {
    println("# hello");
    println("listen 80;");
    println("");
    println("http {");
    println("}");

    JsonNode items = TreeJson.mapper().readTree(TreeJson.toJson(parse())).get("items");

    assertThat(items.size()).isEqualTo(4);
    assertThat(items.get(0).has("Comment")).isTrue();
    assertThat(items.get(1).has("Directive")).isTrue();
    assertThat(items.get(2).has("BlankLine")).isTrue();
    assertThat(items.get(3).get("Directive").has("block")).isTrue();
  }

  @Test
  public void fieldNamesAndArgumentShape() throws ParseException, IOException {
    println("add_header X \"a b\" $host;");

    JsonNode directive =
        TreeJson.mapper()
            .readTree(TreeJson.toJson(parse()))
            .get("items")
            .get(0)
            .get("Directive");

    assertThat(directive.get("name").asText()).isEqualTo("add_header");
    assertThat(directive.get("name_span").get("start").get("column").asInt()).isEqualTo(1);
    assertThat(directive.get("span").get("end").get("offset").asInt()).isEqualTo(25);

    JsonNode quoted = directive.get("args").get(1);
    assertThat(quoted.get("kind").asText()).isEqualTo("QuotedString");
    assertThat(quoted.get("value").asText()).isEqualTo("a b");
    assertThat(quoted.get("raw").asText()).isEqualTo("\"a b\"");
    assertThat(directive.get("args").get(2).get("kind").asText()).isEqualTo("Variable");
  }

  @Test
  public void emptyOptionalFieldsAreOmitted() throws ParseException {
    println("listen 80;");

    String json = TreeJson.toJson(parse());

    assertThat(json).doesNotContain("null");
    assertThat(json).doesNotContain("\"block\"");
    assertThat(json).doesNotContain("\"trailing_comment\"");
    assertThat(json).doesNotContain("\"name_raw\"");
    assertThat(json).doesNotContain("\"include_context\"");
    assertThat(json).doesNotContain("\"space_before_terminator\"");
    assertThat(json).doesNotContain("\"raw_content\"");
  }

  @Test
  public void rawContentIsKeptEvenWhenEmpty() throws ParseException {
    println("content_by_lua_block {}");

    String json = TreeJson.toJson(parse());

    assertThat(json).contains("\"raw_content\":\"\"");
    assertThat(json).doesNotContain("\"raw_source\"");
  }

  @Test
  public void trailingCommentIsTaggedLikeItems() throws ParseException, IOException {
    println("listen 80; # web");

    JsonNode directive =
        TreeJson.mapper()
            .readTree(TreeJson.toJson(parse()))
            .get("items")
            .get(0)
            .get("Directive");

    assertThat(directive.get("trailing_comment").get("Comment").get("text").asText())
        .isEqualTo("# web");
  }

  @Test
  public void readsBackAnEqualTree() throws ParseException, IOException {
    println("# top");
    println("http {");
    println("    map $a $b { \"x y\" 1; }");
    println("    content_by_lua_block { ngx.say('{') }");
    println("");
    println("    listen 80 ; # web");
    println("}   ");
    Config config = parse().withIncludeContext(ImmutableList.of("main"));

    Config read = TreeJson.fromJson(TreeJson.toPrettyJson(config));

    assertThat(read).isEqualTo(config);
    assertThat(read.toSource()).isEqualTo(file.toString());
  }

  @Test
  public void readsMinimalDocument() throws IOException {
    Config config =
        TreeJson.fromJson(
            "{\"items\":[{\"Directive\":{\"name\":\"pid\",\"args\":"
                + "[{\"kind\":\"Literal\",\"value\":\"/run/x.pid\",\"raw\":\"/run/x.pid\"}]}}]}");

    Directive pid = config.directives().get(0);
    assertThat(pid.name()).isEqualTo("pid");
    assertThat(pid.span().isSynthetic()).isTrue();
    assertThat(config.toSource()).isEqualTo("pid /run/x.pid;\n");
  }
}
