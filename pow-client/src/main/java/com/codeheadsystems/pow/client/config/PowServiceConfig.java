package com.codeheadsystems.pow.client.config;

/**
 * Live view of the POW service configuration.
 * <p>
 * Values are consulted on every token request and may change between requests, so implementations
 * must not cache them on behalf of the caller.
 */
public interface PowServiceConfig {

  /**
   * Server url string.
   *
   * @return the base URL of the issuing service, or null/empty when not configured.
   */
  String serverUrl();

  /**
   * Api key string.
   *
   * @return the bearer API key, or null/empty when not configured.
   */
  String apiKey();

  /**
   * Proxy enabled boolean.
   *
   * @return whether requests should be routed through {@link #proxyUrl()}.
   */
  boolean proxyEnabled();

  /**
   * Proxy url string.
   *
   * @return the forward proxy URL. Ignored unless {@link #proxyEnabled()} is true.
   */
  String proxyUrl();

  /**
   * Reads all four values into an immutable snapshot for a single request.
   *
   * @return the pow service settings
   */
  default PowServiceSettings snapshot() {
    return new PowServiceSettings(serverUrl(), apiKey(), proxyEnabled(), proxyUrl());
  }
}
