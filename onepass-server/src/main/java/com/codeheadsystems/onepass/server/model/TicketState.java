package com.codeheadsystems.onepass.server.model;

/**
 * Lifecycle states of a ticket. Only {@link #ISSUED} and {@link #TRANSFERRED} tickets can be
 * redeemed at the door.
 */
public enum TicketState {
  ISSUED,
  LISTED,
  TRANSFERRED,
  REDEEMED,
  REVOKED;

  public boolean isRedeemable() {
    return this == ISSUED || this == TRANSFERRED;
  }
}
