package com.codeheadsystems.hawk.client.exceptions;

/**
 * Raised when a Hawk-authenticated HTTP exchange fails for reasons other than authentication:
 * I/O errors, interruption, or an unexpected HTTP status.
 */
public class HawkAccessorException extends RuntimeException {

  /**
   * Instantiates a new Hawk accessor exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public HawkAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
