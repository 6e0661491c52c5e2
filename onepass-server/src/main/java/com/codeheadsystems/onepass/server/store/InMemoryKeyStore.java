package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.exception.NoActiveKeyException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link KeyStore} backed by a {@link ConcurrentHashMap}, with rotation and
 * revocation.
 * <p>
 * Keys loaded from configuration or generated at startup live only as long as the process.
 */
public class InMemoryKeyStore implements KeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyStore.class);

  private final Map<String, SigningKey> keys = new ConcurrentHashMap<>();

  /**
   * Adds or replaces a key. Storing an active key makes it the only active one.
   *
   * @param key the key to store
   */
  public synchronized void store(SigningKey key) {
    if (key.active()) {
      deactivateAll();
    }
    keys.put(key.keyId(), key);
    log.info("Stored signing key {} (active: {})", key.keyId(), key.active());
  }

  /**
   * Makes the given key the active signing key. The previous active key stays available for
   * verification.
   *
   * @param keyId key to activate
   * @throws IllegalArgumentException if the key is unknown or revoked
   */
  public synchronized void activate(String keyId) {
    SigningKey key = keys.get(keyId);
    if (key == null) {
      throw new IllegalArgumentException("Unknown signing key: " + keyId);
    }
    if (key.isRevoked()) {
      throw new IllegalArgumentException("Signing key is revoked: " + keyId);
    }
    deactivateAll();
    keys.put(keyId, key.withActive(true));
    log.info("Activated signing key {}", keyId);
  }

  /**
   * Revokes a key. Passes it signed no longer verify.
   *
   * @param keyId key to revoke
   * @param at    revocation time
   * @throws IllegalArgumentException if the key is unknown
   */
  public synchronized void revoke(String keyId, Instant at) {
    SigningKey key = keys.get(keyId);
    if (key == null) {
      throw new IllegalArgumentException("Unknown signing key: " + keyId);
    }
    keys.put(keyId, key.withRevokedAt(at));
    log.warn("Revoked signing key {} at {}", keyId, at);
  }

  @Override
  public SigningKey getActiveKey() {
    return keys.values().stream()
        .filter(SigningKey::active)
        .filter(key -> !key.isRevoked())
        .findFirst()
        .orElseThrow(() -> new NoActiveKeyException("No active signing key"));
  }

  @Override
  public Optional<SigningKey> findKey(String keyId) {
    if (keyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(keys.get(keyId));
  }

  public List<SigningKey> keys() {
    return new ArrayList<>(keys.values());
  }

  private void deactivateAll() {
    keys.replaceAll((id, existing) -> existing.active() ? existing.withActive(false) : existing);
  }
}
