package com.codeheadsystems.onepass.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.exception.NoActiveKeyException;
import com.codeheadsystems.onepass.server.store.KeyStore;

/**
 * Health check that verifies a pass signing key is active, so new passes can be issued.
 */
public class SigningKeyHealthCheck extends HealthCheck {

  private static final int ED25519_PUBLIC_KEY_LENGTH = 32;

  private final KeyStore keyStore;

  /**
   * Instantiates a new signing key health check.
   *
   * @param keyStore the key store
   */
  public SigningKeyHealthCheck(KeyStore keyStore) {
    this.keyStore = keyStore;
  }

  @Override
  protected Result check() {
    SigningKey key;
    try {
      key = keyStore.getActiveKey();
    } catch (NoActiveKeyException e) {
      return Result.unhealthy(e.getMessage());
    }
    if (key.publicKey() == null || key.publicKey().length != ED25519_PUBLIC_KEY_LENGTH) {
      return Result.unhealthy("Active key %s has no valid Ed25519 public key", key.keyId());
    }
    return Result.healthy("active key=%s", key.keyId());
  }
}
