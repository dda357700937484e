package io.trail.util;

import java.util.Map;

/**
 * Codec for the JSON payloads of the version ledger ({@code item_changes}, {@code meta})
 * and for JSON-typed entity columns.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by Jackson.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes a value as JSON. Returns {@code null} for a {@code null} value.
   *
   * @param value the value to encode
   * @return JSON string, or {@code null}
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Parses a JSON object. Returns {@code null} for {@code null} or blank input.
   *
   * @param json the JSON string to parse
   * @return parsed map with JSON-normal values
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);

  /**
   * Parses any JSON value. Returns {@code null} for {@code null} or blank input.
   *
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  Object parse(String json);

  /**
   * Converts a map to its JSON-normal form: integral numbers become {@code Long},
   * temporal values become ISO-8601 strings, nested maps and lists are preserved.
   * Equal to what {@link #parseObject(String)} returns for the encoded map.
   */
  Map<String, Object> normalize(Map<String, ?> value);
}
