package com.codeheadsystems.onepass.server.manager;

import com.codeheadsystems.onepass.model.pass.RevokePassResponse;
import com.codeheadsystems.onepass.server.auth.AccessController;
import com.codeheadsystems.onepass.server.auth.Permission;
import com.codeheadsystems.onepass.server.exception.InternalErrorException;
import com.codeheadsystems.onepass.server.exception.NotFoundException;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.model.ValidationRecord;
import com.codeheadsystems.onepass.server.store.DocumentStore;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Revokes a user's pass on behalf of an administrator.
 * <p>
 * Revocation is idempotent and writes exactly one audit row when it takes effect.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link com.codeheadsystems.onepass.server.exception.UnauthenticatedException} and
 *   {@link com.codeheadsystems.onepass.server.exception.PermissionDeniedException} for callers
 *   who are not administrators</li>
 *   <li>{@link IllegalArgumentException} for a missing target or reason</li>
 *   <li>{@link NotFoundException} when the target user or its pass does not exist</li>
 *   <li>{@link InternalErrorException} when the revocation could not be committed</li>
 * </ul>
 */
public class PassRevoker {

  private static final Logger log = LoggerFactory.getLogger(PassRevoker.class);

  static final String REVOKED_MESSAGE = "Pass revoked successfully";
  static final String ALREADY_REVOKED_MESSAGE = "Pass was already revoked";

  private final AccessController accessController;
  private final DocumentStore store;
  private final Clock clock;

  public PassRevoker(final AccessController accessController,
                     final DocumentStore store,
                     final Clock clock) {
    this.accessController = accessController;
    this.store = store;
    this.clock = clock;
  }

  /**
   * Revokes the target user's pass.
   *
   * @param adminUid  caller, null when anonymous
   * @param targetUid owner of the pass to revoke
   * @param reason    why the pass is revoked, kept on the pass and in the audit log
   * @return success, with a message telling whether this call revoked the pass
   */
  public RevokePassResponse revokePass(String adminUid, String targetUid, String reason) {
    accessController.authorize(adminUid, Permission.REVOKE_PASS);
    if (targetUid == null || targetUid.isBlank() || reason == null || reason.isBlank()) {
      throw new IllegalArgumentException("targetUid and reason are required");
    }
    log.info("Revoking pass for {} by admin {}: {}", targetUid, adminUid, reason);

    UserRecord user = store.findUser(targetUid)
        .orElseThrow(() -> new NotFoundException("User not found"));
    if (user.pass() == null) {
      throw new NotFoundException("User has no pass");
    }
    if (!user.pass().isUsable()) {
      log.info("Pass for user {} is already revoked", targetUid);
      return new RevokePassResponse(true, ALREADY_REVOKED_MESSAGE);
    }

    Instant now = clock.instant();
    ValidationRecord audit = ValidationRecord.revocation(UUID.randomUUID().toString(), targetUid,
        reason, adminUid, now);
    boolean revoked;
    try {
      revoked = store.runTransaction(tx -> {
        Pass current = tx.getUser(targetUid).map(UserRecord::pass).orElse(null);
        if (current == null || !current.isUsable()) {
          return false;
        }
        tx.revokePass(targetUid, now.getEpochSecond(), adminUid, reason);
        tx.appendValidation(audit);
        return true;
      });
    } catch (RuntimeException e) {
      log.error("Failed to revoke pass for user {}", targetUid, e);
      throw new InternalErrorException("Failed to revoke pass: " + e.getMessage(), e);
    }

    if (!revoked) {
      log.info("Pass for user {} was revoked concurrently", targetUid);
      return new RevokePassResponse(true, ALREADY_REVOKED_MESSAGE);
    }
    log.info("Pass revoked for user {} by admin {}", targetUid, adminUid);
    return new RevokePassResponse(true, REVOKED_MESSAGE);
  }
}
