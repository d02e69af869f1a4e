package com.codeheadsystems.hawk.exceptions;

/**
 * Raised when Hawk input cannot be parsed or decoded, or when the cryptographic backend fails.
 * <p>
 * Validation failures are never reported with this exception; they collapse to {@code false}.
 */
public class HawkException extends RuntimeException {

  private final HawkError error;

  /**
   * Instantiates a new Hawk exception with the default description of the error kind.
   *
   * @param error the error kind
   */
  public HawkException(final HawkError error) {
    this(error, error.description(), null);
  }

  /**
   * Instantiates a new Hawk exception.
   *
   * @param error   the error kind
   * @param message the message
   */
  public HawkException(final HawkError error, final String message) {
    this(error, message, null);
  }

  /**
   * Instantiates a new Hawk exception.
   *
   * @param error   the error kind
   * @param message the message
   * @param cause   the cause
   */
  public HawkException(final HawkError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * The kind of failure.
   *
   * @return the error kind
   */
  public HawkError error() {
    return error;
  }
}
