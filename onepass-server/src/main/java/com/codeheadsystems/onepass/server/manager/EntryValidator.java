package com.codeheadsystems.onepass.server.manager;

import com.codeheadsystems.onepass.model.entry.RejectReason;
import com.codeheadsystems.onepass.model.entry.ValidateEntryResponse;
import com.codeheadsystems.onepass.server.auth.AccessController;
import com.codeheadsystems.onepass.server.auth.Permission;
import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.credential.CredentialCodec;
import com.codeheadsystems.onepass.server.credential.MalformedCredentialException;
import com.codeheadsystems.onepass.server.credential.ParsedCredential;
import com.codeheadsystems.onepass.server.crypto.SignatureCodec;
import com.codeheadsystems.onepass.server.model.AuditReason;
import com.codeheadsystems.onepass.server.model.EventRecord;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.Ticket;
import com.codeheadsystems.onepass.server.model.TicketState;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.model.ValidationRecord;
import com.codeheadsystems.onepass.server.model.ValidationResult;
import com.codeheadsystems.onepass.server.store.DocumentStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a scanned pass credential at an event entrance and redeems one ticket.
 * <p>
 * The checks before the commit only serve as a fast path. At-most-once redemption is enforced by
 * the transaction, which re-reads the ticket and the event and aborts if either changed.
 * <p>
 * Business rejections are returned as values. Thrown exceptions are reserved for the caller:
 * {@link com.codeheadsystems.onepass.server.exception.UnauthenticatedException},
 * {@link com.codeheadsystems.onepass.server.exception.PermissionDeniedException} and
 * {@link IllegalArgumentException} for a missing credential or event id.
 */
public class EntryValidator {

  private static final Logger log = LoggerFactory.getLogger(EntryValidator.class);

  public static final Duration DEFAULT_REPLAY_WINDOW = Duration.ofSeconds(30);

  private final AccessController accessController;
  private final CredentialCodec credentialCodec;
  private final SignatureCodec signatureCodec;
  private final DocumentStore store;
  private final Clock clock;
  private final Duration replayWindow;

  public EntryValidator(final AccessController accessController,
                        final CredentialCodec credentialCodec,
                        final SignatureCodec signatureCodec,
                        final DocumentStore store,
                        final Clock clock) {
    this(accessController, credentialCodec, signatureCodec, store, clock, DEFAULT_REPLAY_WINDOW);
  }

  public EntryValidator(final AccessController accessController,
                        final CredentialCodec credentialCodec,
                        final SignatureCodec signatureCodec,
                        final DocumentStore store,
                        final Clock clock,
                        final Duration replayWindow) {
    this.accessController = accessController;
    this.credentialCodec = credentialCodec;
    this.signatureCodec = signatureCodec;
    this.store = store;
    this.clock = clock;
    this.replayWindow = replayWindow;
  }

  /**
   * Validates a credential for an event.
   *
   * @param callerUid scanner's uid, null when anonymous
   * @param qrText    the scanned credential
   * @param eventId   event being entered
   * @return accepted with the redeemed ticket, or rejected with a reason
   */
  public ValidateEntryResponse validate(String callerUid, String qrText, String eventId) {
    Role scannerRole = accessController.authorize(callerUid, Permission.SCAN_ENTRY);
    if (qrText == null || qrText.isBlank() || eventId == null || eventId.isBlank()) {
      throw new IllegalArgumentException("qrText and eventId are required");
    }
    log.info("Validating entry for event {} by {} ({})", eventId, callerUid, scannerRole);
    Scan scan = new Scan(callerUid, scannerRole, eventId);

    ParsedCredential credential;
    try {
      credential = credentialCodec.parse(qrText);
    } catch (MalformedCredentialException e) {
      log.warn("Malformed credential: {}", e.getMessage());
      scan.reject(null, null, AuditReason.BAD_FORMAT);
      return ValidateEntryResponse.rejected(RejectReason.BAD_SIGNATURE);
    }
    String uid = credential.uid();

    if (!signatureCodec.verify(credential.payloadBytes(), credential.signature(), credential.kid())) {
      log.warn("Invalid signature for uid={} kid={}", uid, credential.kid());
      scan.reject(uid, null, AuditReason.BAD_SIGNATURE);
      return ValidateEntryResponse.rejected(RejectReason.BAD_SIGNATURE);
    }

    Optional<Pass> pass = store.findUser(uid).map(UserRecord::pass);
    if (pass.isEmpty() || !pass.get().isUsable()) {
      log.warn("Pass revoked or inactive for uid={}", uid);
      scan.reject(uid, null, AuditReason.REVOKED);
      return ValidateEntryResponse.rejected(RejectReason.REVOKED);
    }

    Instant now = clock.instant();
    List<Ticket> tickets = store.findTickets(uid, eventId);
    Optional<Ticket> redeemable = tickets.stream()
        .filter(ticket -> ticket.state().isRedeemable())
        .findFirst();
    if (redeemable.isEmpty()) {
      Optional<Ticket> redeemed = tickets.stream()
          .filter(ticket -> ticket.state() == TicketState.REDEEMED)
          .findFirst();
      if (redeemed.isPresent() && isReplay(uid, eventId, now)) {
        return ValidateEntryResponse.rejected(RejectReason.ALREADY_SCANNED);
      }
      if (redeemed.isPresent()) {
        log.warn("Ticket {} already redeemed for uid={}, event={}",
            redeemed.get().ticketId(), uid, eventId);
        return scan.alreadyScanned(uid, redeemed.get());
      }
      log.warn("No valid ticket for uid={}, event={}", uid, eventId);
      scan.reject(uid, null, AuditReason.NOT_REGISTERED);
      return ValidateEntryResponse.rejected(RejectReason.UNREGISTERED);
    }

    if (isReplay(uid, eventId, now)) {
      return ValidateEntryResponse.rejected(RejectReason.ALREADY_SCANNED);
    }

    return redeem(scan, uid, redeemable.get().ticketId(), now);
  }

  // Retries inside the window are rejected without an audit row.
  private boolean isReplay(String uid, String eventId, Instant now) {
    if (store.hasAcceptedSince(uid, eventId, now.minus(replayWindow))) {
      log.warn("Duplicate scan detected for uid={}, event={}", uid, eventId);
      return true;
    }
    return false;
  }

  private ValidateEntryResponse redeem(Scan scan, String uid, String ticketId, Instant now) {
    String eventId = scan.eventId();
    ValidationRecord accepted = ValidationRecord.scan(newId(), uid, eventId, ticketId,
        ValidationResult.ACCEPTED, null, scan.scannerUid(), scan.scannerRole(), now);
    try {
      store.runTransaction(tx -> {
        EventRecord event = tx.getEvent(eventId)
            .orElseThrow(() -> new IllegalStateException("Event not found: " + eventId));
        Ticket ticket = tx.getTicket(ticketId)
            .orElseThrow(() -> new IllegalStateException("Ticket not found: " + ticketId));
        if (ticket.state() == TicketState.REDEEMED) {
          throw new TicketAlreadyRedeemedException(ticket);
        }
        if (!ticket.state().isRedeemable() || !ticket.belongsTo(uid, eventId)) {
          throw new IllegalStateException("Ticket " + ticketId + " is no longer valid for entry");
        }
        if (event.ticketsRemaining() <= 0) {
          throw new EventCapacityExceededException(eventId);
        }
        tx.redeemTicket(ticketId, now, scan.scannerUid(), scan.scannerRole());
        tx.markPassScanned(uid, now.getEpochSecond());
        tx.incrementEventCounters(eventId, 1, -1);
        tx.appendValidation(accepted);
        return null;
      });
    } catch (TicketAlreadyRedeemedException e) {
      log.warn("Ticket {} was redeemed concurrently for uid={}", ticketId, uid);
      return scan.alreadyScanned(uid, e.ticket());
    } catch (RuntimeException e) {
      log.error("Transaction failed for uid={}, event={}", uid, eventId, e);
      scan.audit(uid, ticketId, ValidationResult.ERROR, e.getMessage());
      return ValidateEntryResponse.rejected(RejectReason.UNKNOWN);
    }

    long remaining = store.findEvent(eventId).map(EventRecord::ticketsRemaining).orElse(0L);
    log.info("Entry accepted for uid={}, ticket={}, event={}", uid, ticketId, eventId);
    return ValidateEntryResponse.accepted(ticketId, now.getEpochSecond(), Math.max(0, remaining));
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }

  /**
   * The scanner side of one validation, used to write audit rows.
   */
  private final class Scan {

    private final String scannerUid;
    private final Role scannerRole;
    private final String eventId;

    private Scan(String scannerUid, Role scannerRole, String eventId) {
      this.scannerUid = scannerUid;
      this.scannerRole = scannerRole;
      this.eventId = eventId;
    }

    String scannerUid() {
      return scannerUid;
    }

    Role scannerRole() {
      return scannerRole;
    }

    String eventId() {
      return eventId;
    }

    void reject(String uid, String ticketId, AuditReason reason) {
      audit(uid, ticketId, ValidationResult.REJECTED, reason.code());
    }

    ValidateEntryResponse alreadyScanned(String uid, Ticket ticket) {
      reject(uid, ticket.ticketId(), AuditReason.ALREADY_SCANNED);
      Long redeemedAt = ticket.redeemedAt() == null ? null : ticket.redeemedAt().getEpochSecond();
      return ValidateEntryResponse.alreadyScanned(redeemedAt, ticket.scannedBy());
    }

    void audit(String uid, String ticketId, ValidationResult result, String reason) {
      try {
        store.append(ValidationRecord.scan(newId(), uid, eventId, ticketId, result, reason,
            scannerUid, scannerRole, clock.instant()));
      } catch (RuntimeException e) {
        log.error("Failed to log validation for uid={}", uid, e);
      }
    }
  }
}
