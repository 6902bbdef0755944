package com.codeheadsystems.pow.client.accessor;

import com.codeheadsystems.pow.client.config.PowServiceSettings;
import com.codeheadsystems.pow.client.config.ProxyAddress;
import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies JDK {@link HttpClient}s with the POW request timeout and an explicit proxy choice.
 * <p>
 * A direct connection uses {@link HttpClient.Builder#NO_PROXY} so that JVM-wide proxy properties
 * never leak into requests the configuration says should go direct.
 * <p>
 * Clients are cached per proxy choice, one direct client and one per distinct proxy, so requests
 * with the same settings share a selector thread and a connection pool. The cache holds at most
 * {@link #MAX_CACHED_CLIENTS} entries and is emptied when a new proxy would exceed that.
 */
@Singleton
public class DefaultHttpClientFactory implements HttpClientFactory {

  /**
   * Upper bound on the number of cached clients.
   */
  public static final int MAX_CACHED_CLIENTS = 8;

  private static final Logger log = LoggerFactory.getLogger(DefaultHttpClientFactory.class);

  private final Map<Optional<ProxyAddress>, HttpClient> clients = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Default http client factory.
   */
  @Inject
  public DefaultHttpClientFactory() {
    log.info("DefaultHttpClientFactory()");
  }

  @Override
  public HttpClient create(final Optional<ProxyAddress> proxy) {
    final HttpClient cached = clients.get(proxy);
    if (cached != null) {
      return cached;
    }
    synchronized (clients) {
      if (!clients.containsKey(proxy) && clients.size() >= MAX_CACHED_CLIENTS) {
        log.debug("create(): evicting {} cached clients", clients.size());
        clients.clear();
      }
      return clients.computeIfAbsent(proxy, this::build);
    }
  }

  private HttpClient build(final Optional<ProxyAddress> proxy) {
    final HttpClient.Builder builder = HttpClient.newBuilder()
        .connectTimeout(PowServiceSettings.REQUEST_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL);
    if (proxy.isPresent()) {
      final ProxyAddress address = proxy.get();
      log.debug("build(proxy={})", address);
      builder.proxy(ProxySelector.of(address.socketAddress()));
      if (address.hasCredentials()) {
        builder.authenticator(new ProxyAuthenticator(address));
      }
    } else {
      builder.proxy(HttpClient.Builder.NO_PROXY);
    }
    return builder.build();
  }

  /**
   * Answers proxy authentication challenges with the credentials from the proxy URL.
   */
  static class ProxyAuthenticator extends Authenticator {

    private final ProxyAddress address;

    ProxyAuthenticator(final ProxyAddress address) {
      this.address = address;
    }

    @Override
    protected PasswordAuthentication getPasswordAuthentication() {
      if (getRequestorType() != RequestorType.PROXY) {
        return null;
      }
      return new PasswordAuthentication(address.username(), address.password().toCharArray());
    }
  }
}
