package ngxlint.lint;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {
  @JsonProperty("error")
  ERROR,
  @JsonProperty("warning")
  WARNING;
}
