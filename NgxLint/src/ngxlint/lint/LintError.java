package ngxlint.lint;

import java.util.OptionalInt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import ngxlint.Lexer;
import ngxlint.fix.Fix;

/** One diagnostic reported by a rule, with the fixes that would resolve it. */
@AutoValue
@JsonSerialize(as = LintError.class)
public abstract class LintError {
  @JsonProperty("rule")
  public abstract String rule();

  @JsonProperty("category")
  public abstract String category();

  @JsonProperty("message")
  public abstract String message();

  @JsonProperty("severity")
  public abstract Severity severity();

  /** 1-based. */
  @JsonProperty("line")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public abstract OptionalInt line();

  /** 1-based, in characters. */
  @JsonProperty("column")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public abstract OptionalInt column();

  @JsonProperty("fixes")
  public abstract ImmutableList<Fix> fixes();

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public abstract Builder toBuilder();

  public static Builder builder(String rule, String category, Severity severity, String message) {
    return new AutoValue_LintError.Builder()
        .setRule(rule)
        .setCategory(category)
        .setSeverity(severity)
        .setMessage(message);
  }

  public static LintError error(String rule, String category, String message) {
    return builder(rule, category, Severity.ERROR, message).build();
  }

  public static LintError warning(String rule, String category, String message) {
    return builder(rule, category, Severity.WARNING, message).build();
  }

  public LintError at(int line, int column) {
    return toBuilder().setLine(line).setColumn(column).build();
  }

  public LintError at(Lexer.Position position) {
    return at(position.line(), position.column());
  }

  public LintError withFix(Fix fix) {
    Builder builder = toBuilder();
    builder.fixesBuilder().add(fix);
    return builder.build();
  }

  /** Renders as {@code path:line:column: SEVERITY [rule] message}, with 0 for unknown positions. */
  public String format(String path) {
    return String.format(
        "%s:%d:%d: %s [%s] %s",
        path, line().orElse(0), column().orElse(0), severity(), rule(), message());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRule(String rule);

    public abstract Builder setCategory(String category);

    public abstract Builder setMessage(String message);

    public abstract Builder setSeverity(Severity severity);

    public abstract Builder setLine(int line);

    public abstract Builder setColumn(int column);

    public abstract ImmutableList.Builder<Fix> fixesBuilder();

    public abstract LintError build();
  }
}
