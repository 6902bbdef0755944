package com.codeheadsystems.pow.client.exceptions;

/**
 * Raised when the issuing service answers with anything other than HTTP 200.
 */
public class PowUpstreamException extends PowAccessorException {

  private final int statusCode;
  private final String responseBody;

  /**
   * Instantiates a new Pow upstream exception.
   *
   * @param statusCode   the status code
   * @param responseBody the raw response body
   */
  public PowUpstreamException(final int statusCode, final String responseBody) {
    super("POW service returned HTTP " + statusCode, null);
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
