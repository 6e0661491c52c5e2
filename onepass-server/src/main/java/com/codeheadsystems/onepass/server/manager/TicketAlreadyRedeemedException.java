package com.codeheadsystems.onepass.server.manager;

import com.codeheadsystems.onepass.server.model.Ticket;

/**
 * Aborts an entry transaction that found its ticket already redeemed.
 */
class TicketAlreadyRedeemedException extends RuntimeException {

  private final transient Ticket ticket;

  TicketAlreadyRedeemedException(final Ticket ticket) {
    super("Ticket " + ticket.ticketId() + " already redeemed");
    this.ticket = ticket;
  }

  Ticket ticket() {
    return ticket;
  }
}
