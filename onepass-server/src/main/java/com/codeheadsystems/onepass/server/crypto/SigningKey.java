package com.codeheadsystems.onepass.server.crypto;

import java.time.Instant;
import java.util.Base64;

/**
 * An Ed25519 key pair used to sign passes.
 * <p>
 * Exactly one key is active at a time and is used for new signatures. Inactive keys keep
 * verifying the passes they signed until they are revoked.
 *
 * @param keyId      the {@code kid} embedded in every pass it signs
 * @param publicKey  raw 32-byte public key
 * @param privateKey raw 32-byte seed, or 64-byte {@code seed || publicKey}; null on verify-only copies
 * @param active     whether new passes are signed with this key
 * @param revokedAt  when the key was revoked, null while trusted
 */
public record SigningKey(
    String keyId,
    byte[] publicKey,
    byte[] privateKey,
    boolean active,
    Instant revokedAt) {

  public boolean isRevoked() {
    return revokedAt != null;
  }

  public SigningKey withActive(boolean isActive) {
    return new SigningKey(keyId, publicKey, privateKey, isActive, revokedAt);
  }

  public SigningKey withRevokedAt(Instant at) {
    return new SigningKey(keyId, publicKey, privateKey, false, at);
  }

  @Override
  public String toString() {
    return "SigningKey[keyId=" + keyId
        + ", publicKey=" + Base64.getEncoder().encodeToString(publicKey)
        + ", active=" + active
        + ", revokedAt=" + revokedAt + "]";
  }
}
