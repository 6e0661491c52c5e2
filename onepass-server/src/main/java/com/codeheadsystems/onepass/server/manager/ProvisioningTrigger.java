package com.codeheadsystems.onepass.server.manager;

import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.UserCreatedListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues a pass for every newly created account.
 * <p>
 * Can be fed by an identity provider hook ({@link #onAuthUserCreated(String)}) or registered as a
 * {@link UserCreatedListener} on the user store. Both are safe to deliver more than once. A
 * failure never fails account creation: the pass is issued lazily on the next
 * {@code POST /pass} instead.
 */
public class ProvisioningTrigger implements UserCreatedListener {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningTrigger.class);

  private final PassIssuer passIssuer;

  public ProvisioningTrigger(final PassIssuer passIssuer) {
    this.passIssuer = passIssuer;
  }

  /**
   * Handles an identity provider's "user created" event.
   *
   * @param uid the new user's id
   */
  public void onAuthUserCreated(String uid) {
    provision(uid);
  }

  @Override
  public void onUserCreated(UserRecord user) {
    provision(user.uid());
  }

  private void provision(String uid) {
    try {
      Pass pass = passIssuer.issueOrGetPass(uid);
      log.info("Provisioned pass for new user {} (kid: {})", uid, pass.kid());
    } catch (RuntimeException e) {
      log.error("Failed to provision pass for new user {}", uid, e);
    }
  }
}
