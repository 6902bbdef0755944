package com.codeheadsystems.pow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Envelope returned by {@code GET /api/pow/token}: { success, token, device_id, user_agent, cached }.
 * <p>
 * Every field may be missing from the wire, so all components are nullable. Use the presence
 * accessors rather than the raw components when deciding what the issuing service actually sent.
 *
 * @param success   whether the issuing service produced a token.
 * @param token     the POW token. Opaque to the client, though often a JSON document itself.
 * @param deviceId  the device identifier bound to the token, if the service supplied one.
 * @param userAgent the user agent the token was generated for, if the service supplied one.
 * @param cached    true when the service served a previously generated token.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PowTokenResponse(@JsonProperty("success") Boolean success,
                               @JsonProperty("token") String token,
                               @JsonProperty("device_id") String deviceId,
                               @JsonProperty("user_agent") String userAgent,
                               @JsonProperty("cached") Boolean cached) {

  /**
   * Is success boolean.
   *
   * @return true only when the service explicitly sent {@code success: true}.
   */
  public boolean isSuccess() {
    return Boolean.TRUE.equals(success);
  }

  /**
   * Is cached boolean.
   *
   * @return the cached flag, false when absent.
   */
  public boolean isCached() {
    return Boolean.TRUE.equals(cached);
  }

  /**
   * Token value.
   *
   * @return the token, empty when it is missing or blank on the wire.
   */
  public Optional<String> tokenValue() {
    return nonEmpty(token);
  }

  /**
   * Device id value.
   *
   * @return the device id, empty when it is missing or blank on the wire.
   */
  public Optional<String> deviceIdValue() {
    return nonEmpty(deviceId);
  }

  private static Optional<String> nonEmpty(final String value) {
    if (value == null || value.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }
}
