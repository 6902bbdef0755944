package com.codeheadsystems.pow.client.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable snapshot of the POW service configuration, taken once per token request.
 *
 * @param serverUrl    the base URL of the issuing service (e.g. https://pow.example.com).
 * @param apiKey       the bearer API key.
 * @param proxyEnabled whether to route through the proxy.
 * @param proxyUrl     the forward proxy URL used for both http and https traffic.
 */
public record PowServiceSettings(String serverUrl, String apiKey, boolean proxyEnabled, String proxyUrl) {

  /**
   * Path of the token endpoint relative to the server base URL.
   */
  public static final String TOKEN_PATH = "/api/pow/token";

  /**
   * Connect and request timeout applied to the token request.
   */
  public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Is configured boolean.
   *
   * @return true when both the server URL and the API key are present.
   */
  public boolean isConfigured() {
    return serverUrl != null && !serverUrl.isEmpty() && apiKey != null && !apiKey.isEmpty();
  }

  /**
   * Builds the token endpoint by stripping trailing slashes from the server URL.
   *
   * @return the token endpoint url
   */
  public String tokenEndpoint() {
    if (serverUrl == null) {
      throw new IllegalStateException("POW service server url is not configured");
    }
    int end = serverUrl.length();
    while (end > 0 && serverUrl.charAt(end - 1) == '/') {
      end--;
    }
    return serverUrl.substring(0, end) + TOKEN_PATH;
  }

  /**
   * The proxy to use for this request.
   *
   * @return the proxy URL when enabled and non-empty, otherwise empty (direct connection).
   */
  public Optional<String> activeProxyUrl() {
    if (!proxyEnabled || proxyUrl == null || proxyUrl.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(proxyUrl);
  }

  @Override
  public String toString() {
    return "PowServiceSettings[serverUrl=" + serverUrl
        + ", apiKey=" + (apiKey == null || apiKey.isEmpty() ? "<unset>" : "<redacted>")
        + ", proxyEnabled=" + proxyEnabled
        + ", proxyUrl=" + ProxyAddress.redactCredentials(proxyUrl) + "]";
  }
}
