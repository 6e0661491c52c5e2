package com.codeheadsystems.onepass.server.exception;

/**
 * A record the operation depends on does not exist.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(final String message) {
    super(message);
  }
}
