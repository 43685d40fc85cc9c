package ngxlint.fix;

import java.util.Optional;
import java.util.OptionalInt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * One textual edit. Range-based fixes replace a byte range of the original source; all others
 * act on a 1-based line of it.
 *
 * <p>The JSON form is a stable wire format: {@code line} is 0 when unused and absent offsets or
 * old text are omitted.
 */
@AutoValue
@JsonSerialize(as = Fix.class)
public abstract class Fix {
  @JsonProperty("line")
  public abstract int line();

  @JsonProperty("old_text")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  public abstract Optional<String> oldText();

  @JsonProperty("new_text")
  public abstract String newText();

  @JsonProperty("delete_line")
  public abstract boolean deleteLine();

  @JsonProperty("insert_after")
  public abstract boolean insertAfter();

  @JsonProperty("start_offset")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public abstract OptionalInt startOffset();

  @JsonProperty("end_offset")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public abstract OptionalInt endOffset();

  public boolean isRangeBased() {
    return startOffset().isPresent() && endOffset().isPresent();
  }

  /** Replaces the first occurrence of {@code oldText} on the line. */
  public static Fix replace(int line, String oldText, String newText) {
    return create(line, Optional.of(oldText), newText, false, false, null, null);
  }

  public static Fix replaceLine(int line, String newText) {
    return create(line, Optional.empty(), newText, false, false, null, null);
  }

  public static Fix delete(int line) {
    return create(line, Optional.empty(), "", true, false, null, null);
  }

  /** Inserts {@code newText} as a new line after the given 1-based line. */
  public static Fix insertAfter(int line, String newText) {
    return create(line, Optional.empty(), newText, false, true, null, null);
  }

  /** Replaces the bytes {@code [startOffset, endOffset)} of the original source. */
  public static Fix replaceRange(int startOffset, int endOffset, String newText) {
    Preconditions.checkArgument(
        0 <= startOffset && startOffset <= endOffset,
        "bad range [%s, %s)",
        startOffset,
        endOffset);
    return create(0, Optional.empty(), newText, false, false, startOffset, endOffset);
  }

  public static Fix insertAt(int offset, String text) {
    return replaceRange(offset, offset, text);
  }

  public static Fix deleteRange(int startOffset, int endOffset) {
    return replaceRange(startOffset, endOffset, "");
  }

  @JsonCreator
  static Fix fromJson(
      @JsonProperty("line") Integer line,
      @JsonProperty("old_text") String oldText,
      @JsonProperty("new_text") String newText,
      @JsonProperty("delete_line") Boolean deleteLine,
      @JsonProperty("insert_after") Boolean insertAfter,
      @JsonProperty("start_offset") Integer startOffset,
      @JsonProperty("end_offset") Integer endOffset) {
    return create(
        line == null ? 0 : line,
        Optional.ofNullable(oldText),
        Strings.nullToEmpty(newText),
        deleteLine != null && deleteLine,
        insertAfter != null && insertAfter,
        startOffset,
        endOffset);
  }

  private static Fix create(
      int line,
      Optional<String> oldText,
      String newText,
      boolean deleteLine,
      boolean insertAfter,
      Integer startOffset,
      Integer endOffset) {
    return new AutoValue_Fix(
        line,
        oldText,
        newText,
        deleteLine,
        insertAfter,
        startOffset == null ? OptionalInt.empty() : OptionalInt.of(startOffset),
        endOffset == null ? OptionalInt.empty() : OptionalInt.of(endOffset));
  }
}
