package com.codeheadsystems.onepass.server.credential;

/**
 * Thrown when a presented credential string cannot be parsed into a payload and signature.
 */
public class MalformedCredentialException extends IllegalArgumentException {

  public MalformedCredentialException(final String message) {
    super(message);
  }

  public MalformedCredentialException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
