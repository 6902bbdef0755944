package com.codeheadsystems.pow.client.logging;

/**
 * Sink for the diagnostic records produced while fetching a POW token.
 * <p>
 * Persistence and formatting belong to the implementation; the token fetcher only ever calls these
 * two methods.
 */
public interface DiagnosticLogger {

  /**
   * Records an informational line.
   *
   * @param message the message
   */
  void logInfo(String message);

  /**
   * Records a failed token request.
   *
   * @param errorMessage the error message, prefixed with the failure kind
   * @param statusCode   the HTTP status, 0 when no response was received
   * @param responseText the raw response body or error text
   * @param source       the component reporting the error
   */
  void logError(String errorMessage, int statusCode, String responseText, String source);
}
