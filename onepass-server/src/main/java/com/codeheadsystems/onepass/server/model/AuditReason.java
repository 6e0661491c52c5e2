package com.codeheadsystems.onepass.server.model;

/**
 * Reason codes written to the audit log for rejected scans. These are finer grained than the
 * {@link com.codeheadsystems.onepass.model.entry.RejectReason} returned to the scanner.
 */
public enum AuditReason {
  BAD_FORMAT("bad_format"),
  BAD_SIGNATURE("bad_signature"),
  REVOKED("revoked"),
  NOT_REGISTERED("not_registered"),
  ALREADY_SCANNED("already_scanned");

  private final String code;

  AuditReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
