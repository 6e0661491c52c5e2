package com.codeheadsystems.onepass.server.exception;

/**
 * No signing key is flagged active, so nothing can be signed.
 * <p>
 * This is a deployment configuration problem, not a verification failure: passes signed by
 * existing keys keep verifying.
 */
public class NoActiveKeyException extends IllegalStateException {

  public NoActiveKeyException(final String message) {
    super(message);
  }
}
