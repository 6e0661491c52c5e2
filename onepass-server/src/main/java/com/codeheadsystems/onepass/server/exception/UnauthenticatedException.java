package com.codeheadsystems.onepass.server.exception;

/**
 * The caller presented no identity.
 */
public class UnauthenticatedException extends SecurityException {

  public UnauthenticatedException(final String message) {
    super(message);
  }
}
