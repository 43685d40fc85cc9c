package ngxlint.fix;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import ngxlint.TreeJson;

public class FixApplierTest {

  private static FixApplier.Result apply(String source, Fix... fixes) {
    return FixApplier.apply(source, ImmutableList.copyOf(fixes));
  }

  private static Fix read(String json) throws IOException {
    return TreeJson.mapper().readValue(json, Fix.class);
  }

  @Test
  public void noFixes() {
    FixApplier.Result result = apply("listen 80;\n");

    assertThat(result.content()).isEqualTo("listen 80;\n");
    assertThat(result.appliedCount()).isEqualTo(0);
  }

  @Test
  public void rangeFixesUseOriginalOffsets() {
    // Both offsets point into the untouched text even though the first edit grows it.
    String source = "a  ;\nb  ;\n";

    FixApplier.Result result =
        apply(source, Fix.replaceRange(1, 3, "    "), Fix.deleteRange(6, 8));

    assertThat(result.content()).isEqualTo("a    ;\nb;\n");
    assertThat(result.appliedCount()).isEqualTo(2);
  }

  @Test
  public void overlappingRangeFixesKeepTheRightmost() {
    FixApplier.Result result =
        apply("hello world", Fix.replaceRange(0, 5, "HELLO"), Fix.replaceRange(3, 8, "X"));

    assertThat(result.content()).isEqualTo("helXrld");
    assertThat(result.appliedCount()).isEqualTo(1);
  }

  @Test
  public void adjacentRangeFixesDoNotConflict() {
    FixApplier.Result result =
        apply("abcdef", Fix.replaceRange(0, 3, "X"), Fix.replaceRange(3, 6, "Y"));

    assertThat(result.content()).isEqualTo("XY");
    assertThat(result.appliedCount()).isEqualTo(2);
  }

  @Test
  public void insertionsAtOneOffsetAreAllApplied() {
    FixApplier.Result result = apply("ab", Fix.insertAt(1, "1"), Fix.insertAt(1, "2"));

    assertThat(result.appliedCount()).isEqualTo(2);
    assertThat(result.content()).isEqualTo("a21b");
  }

  @Test
  public void offsetsAreBytes() {
    String source = "# 開発\nlisten 80 ;\n";

    FixApplier.Result result = apply(source, Fix.deleteRange(18, 19));

    assertThat(result.content()).isEqualTo("# 開発\nlisten 80;\n");
  }

  @Test
  public void rangeInsideCharacterIsDropped() {
    FixApplier.Result result = apply("# 開発", Fix.replaceRange(3, 4, "x"));

    assertThat(result.content()).isEqualTo("# 開発");
    assertThat(result.appliedCount()).isEqualTo(0);
  }

  @Test
  public void rangeOutsideSourceIsDropped() {
    FixApplier.Result result = apply("abc", Fix.replaceRange(2, 10, "x"), Fix.insertAt(0, ">"));

    assertThat(result.content()).isEqualTo(">abc");
    assertThat(result.appliedCount()).isEqualTo(1);
  }

  @Test
  public void deleteLinesBottomUp() {
    FixApplier.Result result = apply("a\nb\nc\nd\n", Fix.delete(1), Fix.delete(3));

    assertThat(result.content()).isEqualTo("b\nd\n");
    assertThat(result.appliedCount()).isEqualTo(2);
  }

  @Test
  public void replaceLine() {
    FixApplier.Result result = apply("a\nb\n", Fix.replaceLine(2, "B;"));

    assertThat(result.content()).isEqualTo("a\nB;\n");
  }

  @Test
  public void replaceFirstOccurrenceOnly() {
    FixApplier.Result result = apply("on on\n", Fix.replace(1, "on", "off"));

    assertThat(result.content()).isEqualTo("off on\n");
    assertThat(result.appliedCount()).isEqualTo(1);
  }

  @Test
  public void replaceMissingTextIsNotCounted() {
    FixApplier.Result result = apply("a\n", Fix.replace(1, "zzz", "y"));

    assertThat(result.content()).isEqualTo("a\n");
    assertThat(result.appliedCount()).isEqualTo(0);
  }

  @Test
  public void insertionsAfterOneLineNestOutward() {
    FixApplier.Result result =
        apply("http {\n  server {\n", Fix.insertAfter(2, "  }"), Fix.insertAfter(2, "}"));

    assertThat(result.content()).isEqualTo("http {\n  server {\n  }\n}\n");
    assertThat(result.appliedCount()).isEqualTo(2);
  }

  @Test
  public void insertAfterPastEndAppends() {
    FixApplier.Result result = apply("a\n", Fix.insertAfter(10, "b"));

    assertThat(result.content()).isEqualTo("a\nb\n");
  }

  @Test
  public void invalidLinesAreSkipped() {
    FixApplier.Result result =
        apply("a\nb\n", Fix.delete(0), Fix.delete(3), Fix.replaceLine(5, "x"));

    assertThat(result.content()).isEqualTo("a\nb\n");
    assertThat(result.appliedCount()).isEqualTo(0);
  }

  @Test
  public void missingFinalNewlineIsPreserved() {
    FixApplier.Result result = apply("a\nb", Fix.replaceLine(2, "c"));

    assertThat(result.content()).isEqualTo("a\nc");
  }

  @Test
  public void lineFixesRunAfterRangeFixes() {
    // Line 2 is deleted from the text the range fix already changed.
    FixApplier.Result result =
        apply("a ;\nb;\nc;\n", Fix.deleteRange(1, 2), Fix.delete(2));

    assertThat(result.content()).isEqualTo("a;\nc;\n");
    assertThat(result.appliedCount()).isEqualTo(2);
  }

  @Test
  public void carriageReturnsArePreserved() {
    FixApplier.Result result = apply("a;\r\nb;\r\n", Fix.delete(1));

    assertThat(result.content()).isEqualTo("b;\r\n");
  }

  @Test
  public void negativeOffsetIsDropped() throws IOException {
    Fix fix =
        read(
            "{\"line\":0,\"new_text\":\"x\",\"delete_line\":false,"
                + "\"insert_after\":false,\"start_offset\":-1,\"end_offset\":1}");

    FixApplier.Result result = apply("abc;", fix, Fix.insertAt(4, "\n"));

    assertThat(result.content()).isEqualTo("abc;\n");
    assertThat(result.appliedCount()).isEqualTo(1);
  }

  @Test
  public void negativeLineIsSkipped() throws IOException {
    Fix fix =
        read("{\"line\":-2,\"new_text\":\"\",\"delete_line\":true,\"insert_after\":false}");

    FixApplier.Result result = apply("a\n", fix);

    assertThat(result.content()).isEqualTo("a\n");
    assertThat(result.appliedCount()).isEqualTo(0);
  }

  @Test
  public void insertAfterLineZeroIsSkipped() {
    FixApplier.Result result = apply("a\n", Fix.insertAfter(0, "top"));

    assertThat(result.content()).isEqualTo("a\n");
    assertThat(result.appliedCount()).isEqualTo(0);
  }
}
