package ngxlint;

import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.base.VerifyException;

import ngxlint.AST.Config;

/**
 * JSON form of syntax trees, for handing a parsed file to code outside this process. Only members
 * annotated with {@code @JsonProperty} take part, and empty optional fields are left out.
 */
public final class TreeJson {
  private static final ObjectMapper MAPPER = newMapper();

  public static ObjectMapper newMapper() {
    return JsonMapper.builder()
        .addModule(new Jdk8Module())
        .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  /** The shared, thread-safe mapper. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Config config) {
    try {
      return MAPPER.writeValueAsString(config);
    } catch (JsonProcessingException e) {
      // Every node type is annotated, so this means a programming error.
      throw new VerifyException("could not serialize config", e);
    }
  }

  public static String toPrettyJson(Config config) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    } catch (JsonProcessingException e) {
      throw new VerifyException("could not serialize config", e);
    }
  }

  public static Config fromJson(String json) throws IOException {
    return MAPPER.readValue(json, Config.class);
  }

  private TreeJson() {}
}
