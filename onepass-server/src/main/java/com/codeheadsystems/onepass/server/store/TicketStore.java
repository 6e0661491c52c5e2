package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.model.Ticket;
import java.util.List;
import java.util.Optional;

/**
 * The {@code tickets} collection.
 */
public interface TicketStore {

  Optional<Ticket> findTicket(String ticketId);

  /**
   * All tickets a user holds for one event, in any state.
   */
  List<Ticket> findTickets(String ownerId, String eventId);

  void saveTicket(Ticket ticket);
}
