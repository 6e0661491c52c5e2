package com.codeheadsystems.onepass.server.crypto;

import com.codeheadsystems.onepass.server.store.KeyStore;
import java.util.Optional;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detached Ed25519 signatures over pass payloads, encoded as base64url.
 * <p>
 * Verification resolves the key by id and only refuses keys that are missing or revoked; a key
 * that has been superseded by a newer active key still verifies what it signed.
 */
public class SignatureCodec {

  private static final Logger log = LoggerFactory.getLogger(SignatureCodec.class);

  /**
   * Ed25519 seed length. NaCl-style secret keys append the 32-byte public key to it.
   */
  private static final int SEED_LENGTH = Ed25519PrivateKeyParameters.KEY_SIZE;

  private final KeyStore keyStore;

  public SignatureCodec(final KeyStore keyStore) {
    this.keyStore = keyStore;
  }

  /**
   * Signs a payload.
   *
   * @param payload    bytes to sign
   * @param privateKey 32-byte seed or 64-byte {@code seed || publicKey}
   * @return base64url signature without padding
   * @throws IllegalArgumentException if the private key has an unexpected length
   */
  public String sign(byte[] payload, byte[] privateKey) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKeyParameters(privateKey));
    signer.update(payload, 0, payload.length);
    return Base64Url.encode(signer.generateSignature());
  }

  /**
   * Verifies a detached signature with the key named by {@code keyId}.
   *
   * @param payload            the exact bytes that were signed
   * @param signatureBase64Url base64url signature, padding optional
   * @param keyId              id of the signing key
   * @return true only if the key exists, is not revoked, and the signature matches
   */
  public boolean verify(byte[] payload, String signatureBase64Url, String keyId) {
    Optional<SigningKey> key = keyStore.findKey(keyId);
    if (key.isEmpty()) {
      log.debug("verify: unknown kid={}", keyId);
      return false;
    }
    if (key.get().isRevoked()) {
      log.debug("verify: kid={} revoked at {}", keyId, key.get().revokedAt());
      return false;
    }
    try {
      byte[] signature = Base64Url.decode(signatureBase64Url);
      if (signature.length != Ed25519PrivateKeyParameters.SIGNATURE_SIZE) {
        return false;
      }
      Ed25519Signer verifier = new Ed25519Signer();
      verifier.init(false, new Ed25519PublicKeyParameters(key.get().publicKey(), 0));
      verifier.update(payload, 0, payload.length);
      return verifier.verifySignature(signature);
    } catch (IllegalArgumentException e) {
      log.debug("verify: malformed signature or key for kid={}: {}", keyId, e.getMessage());
      return false;
    }
  }

  private static Ed25519PrivateKeyParameters privateKeyParameters(byte[] privateKey) {
    if (privateKey == null
        || (privateKey.length != SEED_LENGTH && privateKey.length != 2 * SEED_LENGTH)) {
      throw new IllegalArgumentException("Ed25519 private key must be 32 or 64 bytes");
    }
    return new Ed25519PrivateKeyParameters(privateKey, 0);
  }
}
