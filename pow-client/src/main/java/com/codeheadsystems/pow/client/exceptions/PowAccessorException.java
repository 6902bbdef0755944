package com.codeheadsystems.pow.client.exceptions;

/**
 * The type Pow accessor exception.
 */
public class PowAccessorException extends RuntimeException {
  /**
   * Instantiates a new Pow accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PowAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
