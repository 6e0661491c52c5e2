package com.codeheadsystems.onepass.server.exception;

/**
 * The caller is authenticated but its role is not allowed to perform the operation.
 */
public class PermissionDeniedException extends SecurityException {

  public PermissionDeniedException(final String message) {
    super(message);
  }
}
