package com.codeheadsystems.pow.client.config;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link PowServiceConfig} that can be changed at runtime, for example by an admin
 * endpoint or a config file watcher.
 * <p>
 * All four values live in one {@link AtomicReference}, so {@link #snapshot()} never observes a
 * half-applied update.
 */
public class MutablePowServiceConfig implements PowServiceConfig {

  private static final Logger log = LoggerFactory.getLogger(MutablePowServiceConfig.class);

  private final AtomicReference<PowServiceSettings> current;

  /**
   * Instantiates an unconfigured instance.
   */
  public MutablePowServiceConfig() {
    this(new PowServiceSettings(null, null, false, null));
  }

  /**
   * Instantiates a new Mutable pow service config.
   *
   * @param initial the initial settings
   */
  public MutablePowServiceConfig(final PowServiceSettings initial) {
    this.current = new AtomicReference<>(initial);
  }

  /**
   * Atomically replaces the settings.
   *
   * @param settings the settings
   */
  public void set(final PowServiceSettings settings) {
    current.set(settings);
    log.info("set({})", settings);
  }

  /**
   * Atomically applies a change to the settings.
   *
   * @param change the change
   * @return the settings after the change
   */
  public PowServiceSettings update(final UnaryOperator<PowServiceSettings> change) {
    final PowServiceSettings updated = current.updateAndGet(change);
    log.info("update({})", updated);
    return updated;
  }

  /**
   * Sets the server url.
   *
   * @param serverUrl the server url
   */
  public void serverUrl(final String serverUrl) {
    update(s -> new PowServiceSettings(serverUrl, s.apiKey(), s.proxyEnabled(), s.proxyUrl()));
  }

  /**
   * Sets the api key.
   *
   * @param apiKey the api key
   */
  public void apiKey(final String apiKey) {
    update(s -> new PowServiceSettings(s.serverUrl(), apiKey, s.proxyEnabled(), s.proxyUrl()));
  }

  /**
   * Enables or disables the proxy without touching its URL.
   *
   * @param proxyEnabled the proxy enabled
   */
  public void proxyEnabled(final boolean proxyEnabled) {
    update(s -> new PowServiceSettings(s.serverUrl(), s.apiKey(), proxyEnabled, s.proxyUrl()));
  }

  /**
   * Sets the proxy url.
   *
   * @param proxyUrl the proxy url
   */
  public void proxyUrl(final String proxyUrl) {
    update(s -> new PowServiceSettings(s.serverUrl(), s.apiKey(), s.proxyEnabled(), proxyUrl));
  }

  @Override
  public String serverUrl() {
    return current.get().serverUrl();
  }

  @Override
  public String apiKey() {
    return current.get().apiKey();
  }

  @Override
  public boolean proxyEnabled() {
    return current.get().proxyEnabled();
  }

  @Override
  public String proxyUrl() {
    return current.get().proxyUrl();
  }

  @Override
  public PowServiceSettings snapshot() {
    return current.get();
  }
}
