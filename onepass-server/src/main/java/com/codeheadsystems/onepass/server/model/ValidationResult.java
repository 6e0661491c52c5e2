package com.codeheadsystems.onepass.server.model;

/**
 * Result column of the validation audit log.
 */
public enum ValidationResult {
  ACCEPTED("accepted"),
  REJECTED("rejected"),
  ERROR("error"),
  PASS_REVOKED("pass_revoked");

  private final String code;

  ValidationResult(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
