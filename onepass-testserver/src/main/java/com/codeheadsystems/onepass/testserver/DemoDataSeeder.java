package com.codeheadsystems.onepass.testserver;

import com.codeheadsystems.onepass.server.auth.JwtManager;
import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.model.EventRecord;
import com.codeheadsystems.onepass.server.model.Ticket;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeds one event, one ticket holder, one staff scanner and one admin into a fresh store.
 */
public class DemoDataSeeder {

  public static final String EVENT_ID = "demo-event";
  public static final String TICKET_ID = "demo-ticket";
  public static final String HOLDER_UID = "demo-holder";
  public static final String STAFF_UID = "demo-staff";
  public static final String ADMIN_UID = "demo-admin";
  public static final long EVENT_CAPACITY = 100;

  private static final Logger log = LoggerFactory.getLogger(DemoDataSeeder.class);

  private final DocumentStore documentStore;
  private final JwtManager jwtManager;

  public DemoDataSeeder(DocumentStore documentStore, JwtManager jwtManager) {
    this.documentStore = documentStore;
    this.jwtManager = jwtManager;
  }

  /**
   * Writes the demo records and logs a bearer token per demo user. Existing users are left alone.
   */
  public void seed() {
    documentStore.saveEvent(new EventRecord(EVENT_ID, EVENT_CAPACITY, 0));
    createUser(HOLDER_UID, "holder@example.com", Role.USER);
    createUser(STAFF_UID, "staff@example.com", Role.STAFF);
    createUser(ADMIN_UID, "admin@example.com", Role.ADMIN);
    documentStore.saveTicket(Ticket.issued(TICKET_ID, HOLDER_UID, EVENT_ID));
    log.info("Seeded demo event {} with capacity {} and ticket {} for {}",
        EVENT_ID, EVENT_CAPACITY, TICKET_ID, HOLDER_UID);
  }

  private void createUser(String uid, String email, Role role) {
    if (!documentStore.createUser(new UserRecord(uid, email, role, null))) {
      log.debug("Demo user {} already exists", uid);
    }
    log.info("Demo {} token for {}: {}", role, uid, jwtManager.issueToken(uid));
  }
}
