package com.codeheadsystems.onepass.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.model.EventRecord;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.PassPayload;
import com.codeheadsystems.onepass.server.model.Ticket;
import com.codeheadsystems.onepass.server.model.TicketState;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.model.ValidationRecord;
import com.codeheadsystems.onepass.server.model.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDocumentStoreTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private InMemoryDocumentStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore();
    store.saveEvent(new EventRecord("e1", 5, 0));
    store.saveTicket(Ticket.issued("t1", "u1", "e1"));
  }

  @Test
  void createUser_firesListenersOnlyOnce() {
    List<String> created = new ArrayList<>();
    store.addUserCreatedListener(user -> created.add(user.uid()));

    assertThat(store.createUser(UserRecord.of("u1", Role.USER))).isTrue();
    assertThat(store.createUser(UserRecord.of("u1", Role.ADMIN))).isFalse();

    assertThat(created).containsExactly("u1");
    assertThat(store.findUser("u1").orElseThrow().role()).isEqualTo(Role.USER);
  }

  @Test
  void mergePass_keepsOtherFieldsAndCreatesMissingUsers() {
    store.createUser(new UserRecord("u1", "u1@example.com", Role.STAFF, null));
    Pass pass = Pass.issued(new PassPayload("u1", "k1", 1L, 1), "sig");

    store.mergePass("u1", pass);
    store.mergePass("u2", pass);

    assertThat(store.findUser("u1").orElseThrow())
        .isEqualTo(new UserRecord("u1", "u1@example.com", Role.STAFF, pass));
    assertThat(store.findUser("u2").orElseThrow().role()).isEqualTo(Role.USER);
  }

  @Test
  void findTickets_filtersByOwnerAndEvent() {
    store.saveTicket(Ticket.issued("t2", "u1", "e2"));
    store.saveTicket(Ticket.issued("t3", "u2", "e1"));

    assertThat(store.findTickets("u1", "e1")).extracting(Ticket::ticketId).containsExactly("t1");
  }

  @Test
  void hasAcceptedSince_onlyCountsAcceptedRowsAtOrAfterCutoff() {
    store.append(scan("u1", ValidationResult.REJECTED, NOW));
    assertThat(store.hasAcceptedSince("u1", "e1", NOW.minusSeconds(30))).isFalse();

    store.append(scan("u1", ValidationResult.ACCEPTED, NOW.minusSeconds(30)));
    assertThat(store.hasAcceptedSince("u1", "e1", NOW.minusSeconds(30))).isTrue();
    assertThat(store.hasAcceptedSince("u1", "e1", NOW.minusSeconds(29))).isFalse();
    assertThat(store.hasAcceptedSince("u2", "e1", NOW.minusSeconds(30))).isFalse();
  }

  @Test
  void runTransaction_commitsAllWritesTogether() {
    store.mergePass("u1", Pass.issued(new PassPayload("u1", "k1", 1L, 1), "sig"));

    String result = store.runTransaction(tx -> {
      tx.getTicket("t1");
      tx.redeemTicket("t1", NOW, "staff", Role.STAFF);
      tx.markPassScanned("u1", NOW.getEpochSecond());
      tx.incrementEventCounters("e1", 1, -1);
      tx.appendValidation(scan("u1", ValidationResult.ACCEPTED, NOW));
      return "done";
    });

    assertThat(result).isEqualTo("done");
    assertThat(store.findTicket("t1").orElseThrow().state()).isEqualTo(TicketState.REDEEMED);
    assertThat(store.findUser("u1").orElseThrow().pass().lastScannedAt())
        .isEqualTo(NOW.getEpochSecond());
    assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 4, 1));
    assertThat(store.findByUid("u1")).hasSize(1);
  }

  @Test
  void runTransaction_writesNothingBeforeCommit() {
    store.runTransaction(tx -> {
      tx.incrementEventCounters("e1", 1, -1);
      assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 5, 0));
      return null;
    });

    assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 4, 1));
  }

  @Test
  void runTransaction_retriesWhenReadDocumentChanges() {
    AtomicInteger attempts = new AtomicInteger();

    TicketState seen = store.runTransaction(tx -> {
      Ticket ticket = tx.getTicket("t1").orElseThrow();
      if (attempts.incrementAndGet() == 1) {
        store.saveTicket(ticket.redeem(NOW, "other", Role.SECURITY));
      }
      return ticket.state();
    });

    assertThat(attempts).hasValue(2);
    assertThat(seen).isEqualTo(TicketState.REDEEMED);
  }

  @Test
  void runTransaction_incrementsApplyToCommittedValue() {
    store.runTransaction(tx -> {
      tx.incrementEventCounters("e1", 1, -1);
      store.saveEvent(new EventRecord("e1", 10, 3));
      return null;
    });

    assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 9, 4));
  }

  @Test
  void runTransaction_givesUpAfterMaxAttempts() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> store.runTransaction(tx -> {
      attempts.incrementAndGet();
      EventRecord event = tx.getEvent("e1").orElseThrow();
      store.saveEvent(event);
      return null;
    })).isInstanceOf(TransactionConflictException.class);

    assertThat(attempts).hasValue(InMemoryDocumentStore.MAX_ATTEMPTS);
  }

  @Test
  void runTransaction_bodyExceptionPropagatesWithoutRetry() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> store.runTransaction(tx -> {
      attempts.incrementAndGet();
      tx.incrementEventCounters("e1", 1, -1);
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

    assertThat(attempts).hasValue(1);
    assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 5, 0));
  }

  @Test
  void runTransaction_updateOfMissingDocumentAbortsEverything() {
    assertThatThrownBy(() -> store.runTransaction(tx -> {
      tx.incrementEventCounters("e1", 1, -1);
      tx.redeemTicket("missing", NOW, "staff", Role.STAFF);
      tx.appendValidation(scan("u1", ValidationResult.ACCEPTED, NOW));
      return null;
    })).isInstanceOf(IllegalStateException.class).hasMessageContaining("tickets/missing");

    assertThat(store.findEvent("e1")).contains(new EventRecord("e1", 5, 0));
    assertThat(store.findByUid("u1")).isEmpty();
  }

  @Test
  void runTransaction_readAfterWrite_throws() {
    assertThatThrownBy(() -> store.runTransaction(tx -> {
      tx.incrementEventCounters("e1", 1, -1);
      return tx.getEvent("e1");
    })).isInstanceOf(IllegalStateException.class);
  }

  private static ValidationRecord scan(String uid, ValidationResult result, Instant at) {
    return ValidationRecord.scan("id-" + at + "-" + result, uid, "e1", "t1", result, null,
        "staff", Role.STAFF, at);
  }
}
