package ngxlint.lint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Per-rule settings read from {@code .nginx-lint.toml}:
 *
 * <pre>
 * [rules.trailing-whitespace]
 * enabled = false
 *
 * [rules.indent]
 * indent_size = 2
 * </pre>
 *
 * Unknown keys are ignored and every rule is enabled unless switched off.
 */
@AutoValue
public abstract class LintConfig {
  private static final Logger logger = LoggerFactory.getLogger(LintConfig.class);

  public static final String FILE_NAME = ".nginx-lint.toml";

  public static final int DEFAULT_INDENT_SIZE = 4;

  private static final TomlMapper MAPPER =
      TomlMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();

  @AutoValue
  public abstract static class RuleConfig {
    public abstract Optional<Boolean> enabled();

    public abstract OptionalInt indentSize();

    public static RuleConfig create(Optional<Boolean> enabled, OptionalInt indentSize) {
      indentSize.ifPresent(
          size -> Preconditions.checkArgument(size > 0, "indent_size must be positive: %s", size));
      return new AutoValue_LintConfig_RuleConfig(enabled, indentSize);
    }

    @JsonCreator
    static RuleConfig fromJson(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("indent_size") Integer indentSize) {
      return create(
          Optional.ofNullable(enabled),
          indentSize == null ? OptionalInt.empty() : OptionalInt.of(indentSize));
    }
  }

  public abstract ImmutableMap<String, RuleConfig> rules();

  public static LintConfig create(Map<String, RuleConfig> rules) {
    return new AutoValue_LintConfig(ImmutableMap.copyOf(rules));
  }

  public static LintConfig defaults() {
    return create(ImmutableMap.of());
  }

  @JsonCreator
  static LintConfig fromJson(@JsonProperty("rules") Map<String, RuleConfig> rules) {
    return rules == null ? defaults() : create(rules);
  }

  /** Reads {@code path}, or returns the defaults if it does not exist. */
  public static LintConfig load(Path path) throws LintConfigException {
    if (!Files.exists(path)) {
      logger.debug("No config at {}, using defaults", path);
      return defaults();
    }

    String toml;
    try {
      toml = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new LintConfigException(path, "cannot read config", ex);
    }
    return parse(path, toml);
  }

  static LintConfig parse(Path path, String toml) throws LintConfigException {
    try {
      LintConfig config = MAPPER.readValue(toml, LintConfig.class);
      logger.debug("Loaded config {} with {} rule section(s)", path, config.rules().size());
      return config;
    } catch (JsonProcessingException ex) {
      throw new LintConfigException(path, "invalid config: " + ex.getOriginalMessage(), ex);
    }
  }

  public boolean isEnabled(String rule) {
    RuleConfig config = rules().get(rule);
    return config == null || config.enabled().orElse(true);
  }

  public int indentSize() {
    RuleConfig config = rules().get("indent");
    return config == null ? DEFAULT_INDENT_SIZE : config.indentSize().orElse(DEFAULT_INDENT_SIZE);
  }
}
