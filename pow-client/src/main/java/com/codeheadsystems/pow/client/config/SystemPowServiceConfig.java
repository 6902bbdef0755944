package com.codeheadsystems.pow.client.config;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * {@link PowServiceConfig} backed by JVM system properties, falling back to environment variables.
 * <p>
 * Each accessor performs a fresh lookup, so changes made with {@link System#setProperty} are
 * picked up by the next token request.
 * <pre>
 *   pow.service.server-url     POW_SERVICE_SERVER_URL
 *   pow.service.api-key        POW_SERVICE_API_KEY
 *   pow.service.proxy-enabled  POW_SERVICE_PROXY_ENABLED
 *   pow.service.proxy-url      POW_SERVICE_PROXY_URL
 * </pre>
 */
public class SystemPowServiceConfig implements PowServiceConfig {

  /**
   * The constant SERVER_URL.
   */
  public static final String SERVER_URL = "pow.service.server-url";
  /**
   * The constant API_KEY.
   */
  public static final String API_KEY = "pow.service.api-key";
  /**
   * The constant PROXY_ENABLED.
   */
  public static final String PROXY_ENABLED = "pow.service.proxy-enabled";
  /**
   * The constant PROXY_URL.
   */
  public static final String PROXY_URL = "pow.service.proxy-url";

  private final UnaryOperator<String> properties;
  private final UnaryOperator<String> environment;

  /**
   * Instantiates a config reading {@link System#getProperty} and {@link System#getenv}.
   */
  public SystemPowServiceConfig() {
    this(System::getProperty, System::getenv);
  }

  /**
   * Instantiates a new System pow service config with explicit lookups.
   *
   * @param properties  property lookup by dotted key
   * @param environment environment lookup by upper-case key
   */
  public SystemPowServiceConfig(final UnaryOperator<String> properties,
                                final UnaryOperator<String> environment) {
    this.properties = properties;
    this.environment = environment;
  }

  /**
   * Maps a dotted property key to its environment variable name.
   *
   * @param key the key
   * @return the environment variable name
   */
  public static String environmentName(final String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  @Override
  public String serverUrl() {
    return lookup(SERVER_URL);
  }

  @Override
  public String apiKey() {
    return lookup(API_KEY);
  }

  @Override
  public boolean proxyEnabled() {
    final String value = lookup(PROXY_ENABLED);
    if (value == null) {
      return false;
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes") || normalized.equals("on");
  }

  @Override
  public String proxyUrl() {
    return lookup(PROXY_URL);
  }

  private String lookup(final String key) {
    final String value = properties.apply(key);
    if (value != null) {
      return value;
    }
    return environment.apply(environmentName(key));
  }
}
