package com.codeheadsystems.pow.client.accessor;

import com.codeheadsystems.pow.client.config.ProxyAddress;
import java.net.http.HttpClient;
import java.util.Optional;

/**
 * Supplies the {@link HttpClient} for a token request.
 * <p>
 * The proxy is part of the client and may change between requests, so the accessor asks for a
 * client on every request. Implementations may hand back a shared client for a proxy choice they
 * have seen before.
 */
@FunctionalInterface
public interface HttpClientFactory {

  /**
   * Returns a client for the proxy choice.
   *
   * @param proxy the proxy to route both http and https traffic through, or empty for a direct connection.
   * @return the http client
   */
  HttpClient create(Optional<ProxyAddress> proxy);
}
