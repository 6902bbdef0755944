package com.codeheadsystems.pow.client.model;

/**
 * Why a token request produced no token.
 */
public enum PowFailureKind {
  /**
   * Server url or api key not configured; no request was sent.
   */
  CONFIG_MISSING("ConfigMissing"),
  /**
   * Issuing service answered with a status other than 200.
   */
  UPSTREAM_ERROR("UpstreamError"),
  /**
   * Body was not a JSON token envelope.
   */
  INVALID_ENVELOPE("InvalidEnvelope"),
  /**
   * Envelope did not carry {@code success: true}.
   */
  UPSTREAM_REJECTED("UpstreamRejected"),
  /**
   * Envelope carried no token.
   */
  EMPTY_TOKEN("EmptyToken"),
  /**
   * Transport failure, timeout or any other unexpected exception.
   */
  REQUEST_EXCEPTION("RequestException");

  private final String label;

  PowFailureKind(final String label) {
    this.label = label;
  }

  /**
   * Label string.
   *
   * @return the label used in diagnostic messages.
   */
  public String label() {
    return label;
  }

  /**
   * Prefixes a diagnostic message with this kind.
   *
   * @param message the message
   * @return the message as {@code [Label] message}
   */
  public String describe(final String message) {
    return "[" + label + "] " + message;
  }
}
