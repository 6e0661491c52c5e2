package com.codeheadsystems.onepass.server.auth;

import com.codeheadsystems.onepass.server.exception.PermissionDeniedException;
import com.codeheadsystems.onepass.server.exception.UnauthenticatedException;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates callers and checks their stored role against a {@link Permission}.
 * <p>
 * The role is always read from the caller's user record, never from the bearer token, so a role
 * change takes effect on the next request.
 */
public class AccessController {

  private static final Logger log = LoggerFactory.getLogger(AccessController.class);

  private final UserStore userStore;

  public AccessController(final UserStore userStore) {
    this.userStore = userStore;
  }

  /**
   * Requires a caller identity.
   *
   * @param callerUid uid of the authenticated caller, null when anonymous
   * @return the caller uid
   * @throws UnauthenticatedException if {@code callerUid} is null or blank
   */
  public String authenticate(String callerUid) {
    if (callerUid == null || callerUid.isBlank()) {
      throw new UnauthenticatedException("Authentication required");
    }
    return callerUid;
  }

  /**
   * Requires a caller identity whose role is allowed the given permission.
   *
   * @param callerUid  uid of the authenticated caller, null when anonymous
   * @param permission the operation being attempted
   * @return the caller's role
   * @throws UnauthenticatedException  if {@code callerUid} is null or blank
   * @throws PermissionDeniedException if the caller has no user record or its role is not allowed
   */
  public Role authorize(String callerUid, Permission permission) {
    authenticate(callerUid);
    Role role = userStore.findUser(callerUid).map(UserRecord::role).orElse(null);
    if (!permission.allows(role)) {
      log.warn("Denied {} to {} (role: {})", permission, callerUid, role);
      throw new PermissionDeniedException("Not authorized to " + describe(permission));
    }
    return role;
  }

  private static String describe(Permission permission) {
    return switch (permission) {
      case SCAN_ENTRY -> "scan tickets";
      case REVOKE_PASS -> "revoke passes";
    };
  }
}
