package com.codeheadsystems.onepass.server.exception;

/**
 * An operation failed for a reason the caller cannot fix, typically an aborted transaction.
 */
public class InternalErrorException extends RuntimeException {

  /**
   * Instantiates a new internal error exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InternalErrorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
