package com.codeheadsystems.onepass.server.model;

import com.codeheadsystems.onepass.server.auth.Role;
import java.time.Instant;

/**
 * Append-only audit row for scans and revocations. Also backs the replay window lookup.
 *
 * @param id          unique id, chosen by the writer
 * @param uid         pass owner, null when the credential could not be parsed
 * @param eventId     event scanned for, null for revocations
 * @param ticketId    ticket involved, if one was located
 * @param result      accepted, rejected, error or pass_revoked
 * @param reason      audit reason code, error message or revocation reason
 * @param scannedBy   uid of the scanner
 * @param scannerRole role of the scanner
 * @param revokedBy   uid of the revoking admin
 * @param timestamp   when the row was written
 */
public record ValidationRecord(
    String id,
    String uid,
    String eventId,
    String ticketId,
    ValidationResult result,
    String reason,
    String scannedBy,
    Role scannerRole,
    String revokedBy,
    Instant timestamp) {

  public static ValidationRecord scan(String id, String uid, String eventId, String ticketId,
                                      ValidationResult result, String reason,
                                      String scannedBy, Role scannerRole, Instant timestamp) {
    return new ValidationRecord(id, uid, eventId, ticketId, result, reason, scannedBy, scannerRole,
        null, timestamp);
  }

  public static ValidationRecord revocation(String id, String uid, String reason, String revokedBy,
                                            Instant timestamp) {
    return new ValidationRecord(id, uid, null, null, ValidationResult.PASS_REVOKED, reason, null,
        null, revokedBy, timestamp);
  }
}
