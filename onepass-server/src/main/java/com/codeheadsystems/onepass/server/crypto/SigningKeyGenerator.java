package com.codeheadsystems.onepass.server.crypto;

import java.security.SecureRandom;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.Ed25519KeyPairGenerator;
import org.bouncycastle.crypto.params.Ed25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

/**
 * Generates Ed25519 signing keys.
 */
public class SigningKeyGenerator {

  private final SecureRandom random;

  public SigningKeyGenerator() {
    this(new SecureRandom());
  }

  public SigningKeyGenerator(final SecureRandom random) {
    this.random = random;
  }

  /**
   * Generates a new key pair.
   *
   * @param keyId  id to assign
   * @param active whether the key should be the active signing key
   * @return the new key, with a 32-byte seed as private key
   */
  public SigningKey generate(String keyId, boolean active) {
    Ed25519KeyPairGenerator generator = new Ed25519KeyPairGenerator();
    generator.init(new Ed25519KeyGenerationParameters(random));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    byte[] privateKey = ((Ed25519PrivateKeyParameters) pair.getPrivate()).getEncoded();
    byte[] publicKey = ((Ed25519PublicKeyParameters) pair.getPublic()).getEncoded();
    return new SigningKey(keyId, publicKey, privateKey, active, null);
  }

  /**
   * Rebuilds a key from stored private key material, deriving the public key from the seed.
   *
   * @param keyId      id to assign
   * @param privateKey 32-byte seed or 64-byte {@code seed || publicKey}
   * @param active     whether the key should be the active signing key
   * @return the key
   * @throws IllegalArgumentException if the private key has an unexpected length
   */
  public SigningKey fromPrivateKey(String keyId, byte[] privateKey, boolean active) {
    if (privateKey == null || (privateKey.length != 32 && privateKey.length != 64)) {
      throw new IllegalArgumentException("Ed25519 private key must be 32 or 64 bytes");
    }
    Ed25519PrivateKeyParameters parameters = new Ed25519PrivateKeyParameters(privateKey, 0);
    return new SigningKey(keyId, parameters.generatePublicKey().getEncoded(), privateKey, active,
        null);
  }
}
