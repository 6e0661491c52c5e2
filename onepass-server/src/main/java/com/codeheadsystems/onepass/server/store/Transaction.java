package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.model.EventRecord;
import com.codeheadsystems.onepass.server.model.Ticket;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.model.ValidationRecord;
import java.time.Instant;
import java.util.Optional;

/**
 * A unit of work handed to a {@link TransactionBody}.
 * <p>
 * All reads must happen before the first write. Writes are buffered and applied atomically on
 * commit; a write to a document that does not exist at commit time aborts the whole commit.
 * Documents read here are checked for concurrent modification at commit.
 */
public interface Transaction {

  Optional<UserRecord> getUser(String uid);

  Optional<Ticket> getTicket(String ticketId);

  Optional<EventRecord> getEvent(String eventId);

  void redeemTicket(String ticketId, Instant redeemedAt, String scannedBy, Role scannerRole);

  void markPassScanned(String uid, long scannedAtEpochSeconds);

  /**
   * Adds the deltas to the committed counter values at commit time.
   */
  void incrementEventCounters(String eventId, long redeemedDelta, long remainingDelta);

  void revokePass(String uid, long revokedAtEpochSeconds, String revokedBy, String reason);

  void appendValidation(ValidationRecord record);
}
