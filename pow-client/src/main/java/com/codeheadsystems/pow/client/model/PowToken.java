package com.codeheadsystems.pow.client.model;

/**
 * A POW token obtained from the issuing service.
 *
 * @param token     the token, never empty.
 * @param deviceId  the device id bound to the token, null when neither the envelope nor the token carried one.
 * @param userAgent the user agent the token was generated for, null when not supplied.
 */
public record PowToken(String token, String deviceId, String userAgent) {

  @Override
  public String toString() {
    return "PowToken[token=<length=" + token.length() + ">, deviceId=" + deviceId + ", userAgent=" + userAgent + "]";
  }
}
