package com.codeheadsystems.pow.cli;

import com.codeheadsystems.pow.client.accessor.DefaultHttpClientFactory;
import com.codeheadsystems.pow.client.accessor.PowServiceAccessor;
import com.codeheadsystems.pow.client.config.MutablePowServiceConfig;
import com.codeheadsystems.pow.client.config.PowServiceSettings;
import com.codeheadsystems.pow.client.config.SystemPowServiceConfig;
import com.codeheadsystems.pow.client.logging.Slf4jDiagnosticLogger;
import com.codeheadsystems.pow.client.manager.PowTokenFetcher;
import com.codeheadsystems.pow.client.model.PowToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line client that fetches one POW token and prints it.
 *
 * <pre>
 * Usage:
 *   java -cp pow-cli.jar com.codeheadsystems.pow.cli.PowTokenCli [--server &lt;url&gt;] [--api-key &lt;key&gt;] [--proxy &lt;url&gt;]
 *
 * Examples:
 *   PowTokenCli --server https://pow.example.com --api-key sk-test
 *   POW_SERVICE_SERVER_URL=https://pow.example.com POW_SERVICE_API_KEY=sk-test PowTokenCli --proxy http://proxy:8080
 * </pre>
 *
 * <p>Options not given on the command line fall back to the {@code pow.service.*} system
 * properties and {@code POW_SERVICE_*} environment variables. The token goes to stdout and the
 * diagnostics go to the log, so the output can be piped.
 */
public class PowTokenCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final PowServiceSettings settings;
    try {
      settings = parseArguments(args, new SystemPowServiceConfig().snapshot());
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      printUsage();
      System.exit(2);
      return;
    }

    if (!settings.isConfigured()) {
      printUsage();
      System.exit(2);
      return;
    }

    System.exit(run(settings, Executors.newSingleThreadExecutor()));
  }

  /**
   * Fetches one token and prints it to stdout. The worker executor is shut down before returning.
   *
   * @param settings configured settings
   * @param executor worker for the HTTP exchange
   * @return the process exit code, 0 when a token was printed and 1 when none was obtained
   */
  static int run(final PowServiceSettings settings, final ExecutorService executor) {
    final Optional<PowToken> result;
    try {
      final ObjectMapper objectMapper = new ObjectMapper();
      final PowTokenFetcher fetcher = new PowTokenFetcher(
          new MutablePowServiceConfig(settings),
          new PowServiceAccessor(new DefaultHttpClientFactory(), objectMapper),
          new Slf4jDiagnosticLogger(),
          objectMapper,
          executor);
      result = fetcher.fetchToken().join();
    } finally {
      executor.shutdownNow();
    }

    if (result.isEmpty()) {
      System.err.println("No token obtained; see the log for the reason.");
      return 1;
    }
    final PowToken token = result.get();
    System.out.println("token      : " + token.token());
    System.out.println("device-id  : " + token.deviceId());
    System.out.println("user-agent : " + token.userAgent());
    return 0;
  }

  /**
   * Overlays command-line options onto the defaults.
   *
   * @param args     the args
   * @param defaults settings from the environment
   * @return the pow service settings
   * @throws IllegalArgumentException on an unknown option or an option missing its value
   */
  static PowServiceSettings parseArguments(final String[] args, final PowServiceSettings defaults) {
    String server = defaults.serverUrl();
    String apiKey = defaults.apiKey();
    boolean proxyEnabled = defaults.proxyEnabled();
    String proxy = defaults.proxyUrl();

    for (int i = 0; i < args.length; i++) {
      final String option = args[i];
      if (!option.startsWith("--")) {
        throw new IllegalArgumentException("Unexpected argument: " + option);
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Missing value for " + option);
      }
      final String value = args[++i];
      switch (option) {
        case "--server" -> server = value;
        case "--api-key" -> apiKey = value;
        case "--proxy" -> {
          proxy = value;
          proxyEnabled = true;
        }
        default -> throw new IllegalArgumentException("Unknown option: " + option);
      }
    }
    return new PowServiceSettings(server, apiKey, proxyEnabled, proxy);
  }

  private static void printUsage() {
    System.err.println("Usage: PowTokenCli [--server <url>] [--api-key <key>] [--proxy <url>]");
    System.err.println();
    System.err.println("  --server <url>    Issuing service base URL (default: $" + env(SystemPowServiceConfig.SERVER_URL) + ")");
    System.err.println("  --api-key <key>   Bearer API key (default: $" + env(SystemPowServiceConfig.API_KEY) + ")");
    System.err.println("  --proxy <url>     Route through this http proxy (default: $" + env(SystemPowServiceConfig.PROXY_URL)
        + " when $" + env(SystemPowServiceConfig.PROXY_ENABLED) + " is true)");
  }

  private static String env(final String key) {
    return SystemPowServiceConfig.environmentName(key);
  }
}
