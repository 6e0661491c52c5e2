package com.codeheadsystems.onepass.server.model;

import com.codeheadsystems.onepass.server.auth.Role;
import java.time.Instant;

/**
 * A ticket for one event, owned by one user.
 *
 * @param ticketId    unique id
 * @param ownerId     uid of the holder
 * @param eventId     event the ticket admits to
 * @param state       lifecycle state
 * @param redeemedAt  when the ticket was scanned in, null until redeemed
 * @param scannedBy   uid of the scanner that redeemed it
 * @param scannerRole role the scanner held at redemption
 */
public record Ticket(
    String ticketId,
    String ownerId,
    String eventId,
    TicketState state,
    Instant redeemedAt,
    String scannedBy,
    Role scannerRole) {

  public static Ticket issued(String ticketId, String ownerId, String eventId) {
    return new Ticket(ticketId, ownerId, eventId, TicketState.ISSUED, null, null, null);
  }

  public Ticket redeem(Instant at, String scanner, Role role) {
    return new Ticket(ticketId, ownerId, eventId, TicketState.REDEEMED, at, scanner, role);
  }

  public boolean belongsTo(String uid, String event) {
    return ownerId.equals(uid) && eventId.equals(event);
  }
}
