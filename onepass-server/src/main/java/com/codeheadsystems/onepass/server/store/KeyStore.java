package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.exception.NoActiveKeyException;
import java.util.Optional;

/**
 * Source of pass signing keys.
 * <p>
 * Implementations must be thread-safe.
 */
public interface KeyStore {

  /**
   * Returns the key new passes are signed with.
   *
   * @return the active key
   * @throws NoActiveKeyException if no key is currently active
   */
  SigningKey getActiveKey();

  /**
   * Looks up a key by id, whether active, inactive or revoked.
   *
   * @param keyId the {@code kid} to look up
   * @return the key, or empty if unknown
   */
  Optional<SigningKey> findKey(String keyId);
}
