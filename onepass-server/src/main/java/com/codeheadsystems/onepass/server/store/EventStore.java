package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.model.EventRecord;
import java.util.Optional;

/**
 * The {@code events} collection, holding entry counters.
 */
public interface EventStore {

  Optional<EventRecord> findEvent(String eventId);

  void saveEvent(EventRecord event);
}
