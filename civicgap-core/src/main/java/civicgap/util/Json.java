package civicgap.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Shared Jackson configuration for queue files and JSON columns.
 *
 * <p>Timestamps are written as ISO-8601 strings, unknown properties are ignored,
 * null fields are omitted and content after the first JSON value is an error.
 */
public final class Json {
  private static final ObjectMapper MAPPER = newMapper();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  private Json() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Creates a new mapper with the shared settings. Callers may customise the copy.
   */
  public static ObjectMapper newMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  /**
   * Encodes a metadata map for a JSON column. Empty maps are stored as {@code null}.
   */
  public static String writeMap(Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return null;
    }
    return write(map);
  }

  /**
   * Returns {@code map} as it reads back from a JSON column: integral numbers become
   * {@code Integer} or {@code Long} by magnitude, decimals {@code Double}, nested
   * objects {@code LinkedHashMap}.
   *
   * @throws IllegalArgumentException if a value cannot be written as JSON
   */
  public static Map<String, Object> normalizeMap(Map<String, Object> map) {
    return readMap(writeMap(map));
  }

  public static Map<String, Object> readMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return MAPPER.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Encodes a string collection as a JSON array. Empty collections are stored as {@code null}.
   */
  public static String writeStrings(Collection<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    return write(values);
  }

  public static List<String> readStrings(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return MAPPER.readValue(json, LIST_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON array: " + e.getOriginalMessage(), e);
    }
  }

  private static String write(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-serialisable: " + e.getOriginalMessage(), e);
    }
  }
}
