package com.codeheadsystems.onepass.server.manager;

/**
 * Aborts an entry transaction for an event with no admissions left.
 */
class EventCapacityExceededException extends IllegalStateException {

  EventCapacityExceededException(final String eventId) {
    super("Event " + eventId + " is at full capacity");
  }
}
