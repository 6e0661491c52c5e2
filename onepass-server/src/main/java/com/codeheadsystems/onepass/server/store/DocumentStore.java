package com.codeheadsystems.onepass.server.store;

/**
 * All collections the pass service persists to, plus transactions spanning them.
 */
public interface DocumentStore
    extends UserStore, TicketStore, EventStore, ValidationStore, TransactionRunner {
}
