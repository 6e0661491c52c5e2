package com.codeheadsystems.onepass.server.manager;

import com.codeheadsystems.onepass.model.pass.PassResponse;
import com.codeheadsystems.onepass.server.auth.AccessController;
import com.codeheadsystems.onepass.server.credential.CredentialCodec;
import com.codeheadsystems.onepass.server.credential.PayloadSerializer;
import com.codeheadsystems.onepass.server.crypto.SignatureCodec;
import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.exception.NoActiveKeyException;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.PassPayload;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.KeyStore;
import com.codeheadsystems.onepass.server.store.UserStore;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues signed passes, one per user.
 * <p>
 * Issuance is idempotent: a user whose pass is active and signed gets that pass back unchanged.
 * A missing, inactive or revoked pass is replaced by a freshly signed one.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for a blank uid</li>
 *   <li>{@link com.codeheadsystems.onepass.server.exception.UnauthenticatedException} for an
 *   anonymous caller of {@link #generateUserPass(String)}</li>
 *   <li>{@link NoActiveKeyException} when no signing key is active, before anything is written</li>
 * </ul>
 */
public class PassIssuer {

  private static final Logger log = LoggerFactory.getLogger(PassIssuer.class);

  private final AccessController accessController;
  private final KeyStore keyStore;
  private final SignatureCodec signatureCodec;
  private final CredentialCodec credentialCodec;
  private final UserStore userStore;
  private final Clock clock;

  public PassIssuer(final AccessController accessController,
                    final KeyStore keyStore,
                    final SignatureCodec signatureCodec,
                    final CredentialCodec credentialCodec,
                    final UserStore userStore,
                    final Clock clock) {
    this.accessController = accessController;
    this.keyStore = keyStore;
    this.signatureCodec = signatureCodec;
    this.credentialCodec = credentialCodec;
    this.userStore = userStore;
    this.clock = clock;
  }

  /**
   * Returns the caller's own pass, issuing it first if needed.
   *
   * @param callerUid authenticated caller, null when anonymous
   * @return the pass with its QR text
   */
  public PassResponse generateUserPass(String callerUid) {
    String uid = accessController.authenticate(callerUid);
    return toResponse(issueOrGetPass(uid));
  }

  /**
   * Returns the user's usable pass, or signs and stores a new one.
   *
   * @param uid owner of the pass
   * @return the current pass
   */
  public Pass issueOrGetPass(String uid) {
    if (uid == null || uid.isBlank()) {
      throw new IllegalArgumentException("uid is required");
    }
    Optional<Pass> existing = userStore.findUser(uid).map(UserRecord::pass);
    if (existing.isPresent() && existing.get().isUsable() && existing.get().hasSignature()) {
      log.debug("Pass already issued for {}", uid);
      return existing.get();
    }

    SigningKey key = keyStore.getActiveKey();
    PassPayload payload = new PassPayload(uid, key.keyId(), clock.instant().getEpochSecond(),
        Pass.CURRENT_VERSION);
    String signature = signatureCodec.sign(PayloadSerializer.toCanonicalJson(payload),
        key.privateKey());
    Pass pass = Pass.issued(payload, signature);
    userStore.mergePass(uid, pass);
    log.info("Issued pass for {} with key {}{}", uid, key.keyId(),
        existing.isPresent() ? " (reissue)" : "");
    return pass;
  }

  private PassResponse toResponse(Pass pass) {
    return new PassResponse(
        pass.uid(),
        pass.kid(),
        pass.issuedAt(),
        pass.version(),
        pass.active(),
        pass.signature(),
        pass.lastScannedAt(),
        pass.revokedAt(),
        pass.status().name(),
        credentialCodec.encode(pass));
  }
}
