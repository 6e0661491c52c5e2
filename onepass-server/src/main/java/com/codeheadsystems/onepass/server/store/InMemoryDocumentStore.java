package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.model.EventRecord;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.Ticket;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.model.ValidationRecord;
import com.codeheadsystems.onepass.server.model.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link DocumentStore} with optimistic transactions.
 * <p>
 * Every document carries a version that is bumped on each write. A transaction remembers the
 * version of every document it read and commits under a single lock only if none of them
 * changed; otherwise the body is run again, up to {@link #MAX_ATTEMPTS} times.
 * <p>
 * All data is lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  public static final int MAX_ATTEMPTS = 5;

  private record Versioned<T>(T value, long version) {

    Versioned<T> next(T newValue) {
      return new Versioned<>(newValue, version + 1);
    }
  }

  private record PendingWrite(String path, BooleanSupplier exists, Runnable apply) {
  }

  private final Object lock = new Object();
  private final Map<String, Versioned<UserRecord>> users = new HashMap<>();
  private final Map<String, Versioned<Ticket>> tickets = new HashMap<>();
  private final Map<String, Versioned<EventRecord>> events = new HashMap<>();
  private final List<ValidationRecord> validations = new ArrayList<>();
  private final List<UserCreatedListener> listeners = new CopyOnWriteArrayList<>();

  public InMemoryDocumentStore() {
    log.warn("Using InMemoryDocumentStore: users, tickets and events will NOT survive restarts. "
        + "Replace with a persistent DocumentStore for production.");
  }

  // Users

  @Override
  public Optional<UserRecord> findUser(String uid) {
    synchronized (lock) {
      return valueOf(users.get(uid));
    }
  }

  @Override
  public boolean createUser(UserRecord user) {
    synchronized (lock) {
      if (users.containsKey(user.uid())) {
        return false;
      }
      users.put(user.uid(), new Versioned<>(user, 1));
    }
    log.debug("Created user {}", user.uid());
    for (UserCreatedListener listener : listeners) {
      listener.onUserCreated(user);
    }
    return true;
  }

  @Override
  public void mergePass(String uid, Pass pass) {
    synchronized (lock) {
      users.compute(uid, (id, existing) -> existing == null
          ? new Versioned<>(new UserRecord(uid, null, Role.USER, pass), 1)
          : existing.next(existing.value().withPass(pass)));
    }
  }

  @Override
  public void addUserCreatedListener(UserCreatedListener listener) {
    listeners.add(listener);
  }

  // Tickets

  @Override
  public Optional<Ticket> findTicket(String ticketId) {
    synchronized (lock) {
      return valueOf(tickets.get(ticketId));
    }
  }

  @Override
  public List<Ticket> findTickets(String ownerId, String eventId) {
    synchronized (lock) {
      return tickets.values().stream()
          .map(Versioned::value)
          .filter(ticket -> ticket.belongsTo(ownerId, eventId))
          .toList();
    }
  }

  @Override
  public void saveTicket(Ticket ticket) {
    synchronized (lock) {
      upsert(tickets, ticket.ticketId(), ticket);
    }
  }

  // Events

  @Override
  public Optional<EventRecord> findEvent(String eventId) {
    synchronized (lock) {
      return valueOf(events.get(eventId));
    }
  }

  @Override
  public void saveEvent(EventRecord event) {
    synchronized (lock) {
      upsert(events, event.eventId(), event);
    }
  }

  // Validations

  @Override
  public void append(ValidationRecord record) {
    synchronized (lock) {
      validations.add(record);
    }
  }

  @Override
  public boolean hasAcceptedSince(String uid, String eventId, Instant since) {
    synchronized (lock) {
      return validations.stream()
          .anyMatch(record -> record.result() == ValidationResult.ACCEPTED
              && uid.equals(record.uid())
              && eventId.equals(record.eventId())
              && !record.timestamp().isBefore(since));
    }
  }

  @Override
  public List<ValidationRecord> findByUid(String uid) {
    synchronized (lock) {
      return validations.stream().filter(record -> uid.equals(record.uid())).toList();
    }
  }

  @Override
  public List<ValidationRecord> findByEventId(String eventId) {
    synchronized (lock) {
      return validations.stream().filter(record -> eventId.equals(record.eventId())).toList();
    }
  }

  // Transactions

  @Override
  public <T> T runTransaction(TransactionBody<T> body) {
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      InMemoryTransaction transaction = new InMemoryTransaction();
      T result = body.apply(transaction);
      if (transaction.commit()) {
        return result;
      }
      log.debug("Transaction conflict on attempt {}/{}", attempt, MAX_ATTEMPTS);
    }
    throw new TransactionConflictException(
        "Transaction did not commit after " + MAX_ATTEMPTS + " attempts");
  }

  private static <T> Optional<T> valueOf(Versioned<T> versioned) {
    return versioned == null ? Optional.empty() : Optional.of(versioned.value());
  }

  private static <T> void upsert(Map<String, Versioned<T>> collection, String id, T value) {
    collection.compute(id, (key, existing) ->
        existing == null ? new Versioned<>(value, 1) : existing.next(value));
  }

  private static <T> void update(Map<String, Versioned<T>> collection, String id,
                                 UnaryOperator<T> change) {
    collection.computeIfPresent(id, (key, existing) -> existing.next(change.apply(existing.value())));
  }

  private static long versionOf(Map<String, ? extends Versioned<?>> collection, String id) {
    Versioned<?> versioned = collection.get(id);
    return versioned == null ? 0 : versioned.version();
  }

  private class InMemoryTransaction implements Transaction {

    private final Map<String, Long> userReads = new HashMap<>();
    private final Map<String, Long> ticketReads = new HashMap<>();
    private final Map<String, Long> eventReads = new HashMap<>();
    private final List<PendingWrite> writes = new ArrayList<>();
    private final List<ValidationRecord> appends = new ArrayList<>();

    @Override
    public Optional<UserRecord> getUser(String uid) {
      return read(users, userReads, uid);
    }

    @Override
    public Optional<Ticket> getTicket(String ticketId) {
      return read(tickets, ticketReads, ticketId);
    }

    @Override
    public Optional<EventRecord> getEvent(String eventId) {
      return read(events, eventReads, eventId);
    }

    @Override
    public void redeemTicket(String ticketId, Instant redeemedAt, String scannedBy,
                             Role scannerRole) {
      writes.add(new PendingWrite("tickets/" + ticketId,
          () -> tickets.containsKey(ticketId),
          () -> update(tickets, ticketId, ticket -> ticket.redeem(redeemedAt, scannedBy, scannerRole))));
    }

    @Override
    public void markPassScanned(String uid, long scannedAtEpochSeconds) {
      writes.add(new PendingWrite("users/" + uid + "/pass",
          () -> hasPass(uid),
          () -> update(users, uid,
              user -> user.withPass(user.pass().withLastScannedAt(scannedAtEpochSeconds)))));
    }

    @Override
    public void incrementEventCounters(String eventId, long redeemedDelta, long remainingDelta) {
      writes.add(new PendingWrite("events/" + eventId,
          () -> events.containsKey(eventId),
          () -> update(events, eventId, event -> event.increment(redeemedDelta, remainingDelta))));
    }

    @Override
    public void revokePass(String uid, long revokedAtEpochSeconds, String revokedBy,
                           String reason) {
      writes.add(new PendingWrite("users/" + uid + "/pass",
          () -> hasPass(uid),
          () -> update(users, uid, user ->
              user.withPass(user.pass().revoked(revokedAtEpochSeconds, revokedBy, reason)))));
    }

    @Override
    public void appendValidation(ValidationRecord record) {
      appends.add(record);
    }

    private <T> Optional<T> read(Map<String, Versioned<T>> collection, Map<String, Long> reads,
                                 String id) {
      if (!writes.isEmpty() || !appends.isEmpty()) {
        throw new IllegalStateException("Transaction reads must happen before writes");
      }
      synchronized (lock) {
        Versioned<T> versioned = collection.get(id);
        reads.put(id, versioned == null ? 0L : versioned.version());
        return valueOf(versioned);
      }
    }

    private boolean hasPass(String uid) {
      Versioned<UserRecord> user = users.get(uid);
      return user != null && user.value().pass() != null;
    }

    /**
     * Applies the buffered writes if nothing read has changed.
     *
     * @return false on a conflict, in which case nothing was written
     * @throws IllegalStateException if a write targets a missing document
     */
    boolean commit() {
      synchronized (lock) {
        if (changed(users, userReads) || changed(tickets, ticketReads)
            || changed(events, eventReads)) {
          return false;
        }
        for (PendingWrite write : writes) {
          if (!write.exists().getAsBoolean()) {
            throw new IllegalStateException("No document to update: " + write.path());
          }
        }
        writes.forEach(write -> write.apply().run());
        validations.addAll(appends);
        return true;
      }
    }

    private boolean changed(Map<String, ? extends Versioned<?>> collection,
                            Map<String, Long> reads) {
      return reads.entrySet().stream()
          .anyMatch(read -> versionOf(collection, read.getKey()) != read.getValue());
    }
  }
}
