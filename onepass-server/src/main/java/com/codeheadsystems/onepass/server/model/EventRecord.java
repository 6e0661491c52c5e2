package com.codeheadsystems.onepass.server.model;

/**
 * Entry counters of an event. {@code ticketsRemaining} never drops below zero.
 *
 * @param eventId          unique id
 * @param ticketsRemaining admissions still available
 * @param ticketsRedeemed  admissions already granted
 */
public record EventRecord(String eventId, long ticketsRemaining, long ticketsRedeemed) {

  public EventRecord increment(long redeemedDelta, long remainingDelta) {
    return new EventRecord(eventId, ticketsRemaining + remainingDelta, ticketsRedeemed + redeemedDelta);
  }
}
