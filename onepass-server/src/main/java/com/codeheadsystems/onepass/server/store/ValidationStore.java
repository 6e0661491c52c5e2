package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.model.ValidationRecord;
import java.time.Instant;
import java.util.List;

/**
 * The append-only {@code validations} audit log.
 */
public interface ValidationStore {

  void append(ValidationRecord record);

  /**
   * Whether an accepted scan of the user's pass for the event was recorded at or after
   * {@code since}.
   */
  boolean hasAcceptedSince(String uid, String eventId, Instant since);

  /**
   * Audit rows for a user in insertion order.
   */
  List<ValidationRecord> findByUid(String uid);

  /**
   * Audit rows for an event in insertion order, including scans whose credential could not be
   * attributed to a user.
   */
  List<ValidationRecord> findByEventId(String eventId);
}
