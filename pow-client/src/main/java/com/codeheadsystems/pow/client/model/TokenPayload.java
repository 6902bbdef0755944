package com.codeheadsystems.pow.client.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The token string viewed as structured data.
 * <p>
 * Tokens are opaque, but the issuing service usually encodes them as a JSON object. {@link #parse}
 * never fails: a token that is not JSON yields a payload with no node, and callers decide what
 * that means for them.
 *
 * @param node the parsed token, null when the token is not JSON.
 */
public record TokenPayload(JsonNode node) {

  /**
   * Attempts to parse the token as a single JSON document.
   *
   * @param objectMapper the object mapper
   * @param token        the token
   * @return the token payload
   */
  public static TokenPayload parse(final ObjectMapper objectMapper, final String token) {
    try {
      final JsonNode parsed = objectMapper.reader()
          .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .readTree(token);
      if (parsed == null || parsed.isMissingNode()) {
        return new TokenPayload(null);
      }
      return new TokenPayload(parsed);
    } catch (JsonProcessingException e) {
      return new TokenPayload(null);
    }
  }

  /**
   * Is json boolean.
   *
   * @return true when the token parsed as JSON.
   */
  public boolean isJson() {
    return node != null;
  }

  /**
   * Is object boolean.
   *
   * @return true when the token parsed as a JSON object.
   */
  public boolean isObject() {
    return node != null && node.isObject();
  }

  /**
   * The device id carried in the token's {@code id} field.
   *
   * @return the id rendered as text, empty when the token is not an object or has no scalar id.
   */
  public Optional<String> deviceId() {
    if (!isObject()) {
      return Optional.empty();
    }
    final JsonNode id = node.get("id");
    if (id == null || !id.isValueNode() || id.isNull()) {
      return Optional.empty();
    }
    return Optional.of(id.asText());
  }

  /**
   * Top-level field names, in document order.
   *
   * @return the field names, empty when the token is not an object.
   */
  public List<String> fieldNames() {
    final List<String> names = new ArrayList<>();
    if (isObject()) {
      node.fieldNames().forEachRemaining(names::add);
    }
    return names;
  }

  /**
   * Top-level fields, in document order.
   *
   * @return the fields, empty when the token is not an object.
   */
  public List<Map.Entry<String, JsonNode>> fields() {
    final List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
    if (isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
      iterator.forEachRemaining(fields::add);
    }
    return fields;
  }
}
