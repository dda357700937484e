package io.trail.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed {@link JsonCodec}.
 *
 * <p>Integral numbers are read as {@code Long} and floating point numbers as
 * {@code BigDecimal}, so values survive a write/read cycle unchanged. {@code java.time}
 * values are written as ISO-8601 strings.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Returns a mapper configured the way this codec expects. */
  public static ObjectMapper defaultMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.enable(DeserializationFeature.USE_LONG_FOR_INTS);
    mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    return mapper;
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode value as JSON", e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return mapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object", e);
    }
  }

  @Override
  public Object parse(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return mapper.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON", e);
    }
  }

  @Override
  public Map<String, Object> normalize(Map<String, ?> value) {
    if (value == null) {
      return null;
    }
    Map<String, Object> normalized = parseObject(toJson(value));
    return normalized == null ? new LinkedHashMap<>() : normalized;
  }
}
