package com.codeheadsystems.pow.client.logging;

import com.codeheadsystems.pow.client.model.PowToken;
import com.codeheadsystems.pow.client.model.TokenPayload;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the success report for an obtained token to a {@link DiagnosticLogger}.
 * <p>
 * The report names the token's top-level fields, but any value longer than
 * {@link #MAX_LOGGED_VALUE_LENGTH} characters is replaced by a placeholder with its type and
 * length, since long fields are where token secrets live.
 */
public class TokenDiagnostics {

  /**
   * Longest value, in characters, that is logged verbatim.
   */
  public static final int MAX_LOGGED_VALUE_LENGTH = 100;

  static final String SEPARATOR = "=".repeat(100);
  static final String PREFIX = "[POW Service] ";

  private final DiagnosticLogger diagnosticLogger;

  /**
   * Instantiates a new Token diagnostics.
   *
   * @param diagnosticLogger the diagnostic logger
   */
  public TokenDiagnostics(final DiagnosticLogger diagnosticLogger) {
    this.diagnosticLogger = diagnosticLogger;
  }

  /**
   * Renders a token field for logging.
   *
   * @param value the value
   * @return the value, or a {@code <type, length=N>} placeholder when it is too long to log.
   */
  static String render(final JsonNode value) {
    final String rendered = value.isTextual() ? value.textValue() : value.toString();
    final int length = rendered.codePointCount(0, rendered.length());
    if (length > MAX_LOGGED_VALUE_LENGTH) {
      return "<" + value.getNodeType().name().toLowerCase(Locale.ROOT) + ", length=" + length + ">";
    }
    return rendered;
  }

  /**
   * Reports a successfully obtained token.
   *
   * @param powToken the token returned to the caller
   * @param cached   whether the issuing service served a cached token
   * @param payload  the token parsed as structured data
   */
  public void report(final PowToken powToken, final boolean cached, final TokenPayload payload) {
    final String token = powToken.token();
    diagnosticLogger.logInfo(SEPARATOR);
    diagnosticLogger.logInfo(PREFIX + "Token obtained successfully (" + (cached ? "cached" : "fresh") + ")");
    diagnosticLogger.logInfo(PREFIX + "Token length: " + token.codePointCount(0, token.length()));
    diagnosticLogger.logInfo(PREFIX + "Device ID: " + powToken.deviceId());
    diagnosticLogger.logInfo(PREFIX + "User Agent: " + powToken.userAgent());

    if (!payload.isJson()) {
      diagnosticLogger.logInfo(PREFIX + "Token is not valid JSON");
    } else if (!payload.isObject()) {
      diagnosticLogger.logInfo(PREFIX + "Token is not a JSON object ("
          + payload.node().getNodeType().name().toLowerCase(Locale.ROOT) + ")");
    } else if (!payload.fieldNames().isEmpty()) {
      diagnosticLogger.logInfo(PREFIX + "Token structure keys: " + payload.fieldNames());
      for (Map.Entry<String, JsonNode> field : payload.fields()) {
        diagnosticLogger.logInfo(PREFIX + "Token[" + field.getKey() + "]: " + render(field.getValue()));
      }
    }
    diagnosticLogger.logInfo(SEPARATOR);
  }
}
