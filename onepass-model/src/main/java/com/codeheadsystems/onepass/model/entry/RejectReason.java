package com.codeheadsystems.onepass.model.entry;

/**
 * Reason a scanning client shows when entry is denied.
 * <p>
 * Malformed credentials and bad signatures are deliberately collapsed into
 * {@link #BAD_SIGNATURE} so the client cannot tell which check failed.
 */
public enum RejectReason {
  UNREGISTERED,
  ALREADY_SCANNED,
  BAD_SIGNATURE,
  REVOKED,
  UNKNOWN
}
