package com.codeheadsystems.pow.client.exceptions;

/**
 * Raised when a 200 response body cannot be decoded into a token envelope.
 */
public class PowEnvelopeException extends PowAccessorException {

  private final int statusCode;
  private final String responseBody;

  /**
   * Instantiates a new Pow envelope exception.
   *
   * @param message      the message
   * @param statusCode   the status code
   * @param responseBody the raw response body
   * @param cause        the cause, null when the body decoded to JSON null
   */
  public PowEnvelopeException(final String message,
                              final int statusCode,
                              final String responseBody,
                              final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  /**
   * Gets status code.
   *
   * @return the status code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Gets response body.
   *
   * @return the response body
   */
  public String getResponseBody() {
    return responseBody;
  }
}
