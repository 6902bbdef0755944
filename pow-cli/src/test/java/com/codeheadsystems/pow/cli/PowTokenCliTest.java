package com.codeheadsystems.pow.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pow.client.config.PowServiceSettings;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Pow token cli test.
 */
class PowTokenCliTest {

  private static final PowServiceSettings DEFAULTS =
      new PowServiceSettings("https://env.example.com", "env-key", false, "http://env-proxy:3128");

  private HttpServer server;

  /**
   * Sets up.
   *
   * @throws IOException the io exception
   */
  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
  }

  /**
   * Tear down.
   */
  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private PowServiceSettings serveOnce(final int status, final String body) {
    server.createContext("/", exchange -> {
      final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    });
    return new PowServiceSettings("http://127.0.0.1:" + server.getAddress().getPort(), "sk-test", false, null);
  }

  @Test
  void run_tokenObtained_returnsZeroAndShutsDownExecutor() {
    ExecutorService executor = Executors.newSingleThreadExecutor();

    int exitCode = PowTokenCli.run(serveOnce(200, "{\"success\":true,\"token\":\"abc\"}"), executor);

    assertThat(exitCode).isZero();
    assertThat(executor.isShutdown()).isTrue();
  }

  @Test
  void run_noToken_returnsOneAndShutsDownExecutor() {
    ExecutorService executor = Executors.newSingleThreadExecutor();

    int exitCode = PowTokenCli.run(serveOnce(503, "unavailable"), executor);

    assertThat(exitCode).isEqualTo(1);
    assertThat(executor.isShutdown()).isTrue();
  }

  @Test
  void parseArguments_noArgs_keepsDefaults() {
    assertThat(PowTokenCli.parseArguments(new String[0], DEFAULTS)).isEqualTo(DEFAULTS);
  }

  @Test
  void parseArguments_overridesServerAndKey() {
    PowServiceSettings settings = PowTokenCli.parseArguments(
        new String[]{"--server", "https://cli.example.com", "--api-key", "cli-key"}, DEFAULTS);

    assertThat(settings.serverUrl()).isEqualTo("https://cli.example.com");
    assertThat(settings.apiKey()).isEqualTo("cli-key");
    assertThat(settings.proxyEnabled()).isFalse();
    assertThat(settings.activeProxyUrl()).isEmpty();
  }

  @Test
  void parseArguments_proxy_enablesProxy() {
    PowServiceSettings settings = PowTokenCli.parseArguments(new String[]{"--proxy", "http://proxy:8080"}, DEFAULTS);

    assertThat(settings.activeProxyUrl()).contains("http://proxy:8080");
  }

  @Test
  void parseArguments_missingValue_throws() {
    assertThatThrownBy(() -> PowTokenCli.parseArguments(new String[]{"--server"}, DEFAULTS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Missing value for --server");
  }

  @Test
  void parseArguments_unknownOption_throws() {
    assertThatThrownBy(() -> PowTokenCli.parseArguments(new String[]{"--retries", "3"}, DEFAULTS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown option: --retries");
  }

  @Test
  void parseArguments_positional_throws() {
    assertThatThrownBy(() -> PowTokenCli.parseArguments(new String[]{"https://cli.example.com"}, DEFAULTS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Unexpected argument");
  }
}
