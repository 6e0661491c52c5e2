package com.codeheadsystems.onepass.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;

/**
 * One Ed25519 signing key in the application configuration.
 * <p>
 * Generate a key with the test server's {@code KeyGenCli}.
 */
public class SigningKeyConfiguration {

  @NotEmpty
  private String keyId;

  /**
   * Standard base64 of the 32-byte seed or the 64-byte {@code seed || publicKey} secret.
   */
  @NotEmpty
  private String privateKeyBase64;

  /**
   * Standard base64 of the 32-byte public key. Derived from the private key when empty.
   */
  private String publicKeyBase64 = "";

  private boolean active;

  /**
   * When set, passes signed with this key no longer verify.
   */
  private Instant revokedAt;

  @JsonProperty
  public String getKeyId() {
    return keyId;
  }

  @JsonProperty
  public void setKeyId(String keyId) {
    this.keyId = keyId;
  }

  @JsonProperty
  public String getPrivateKeyBase64() {
    return privateKeyBase64;
  }

  @JsonProperty
  public void setPrivateKeyBase64(String privateKeyBase64) {
    this.privateKeyBase64 = privateKeyBase64;
  }

  @JsonProperty
  public String getPublicKeyBase64() {
    return publicKeyBase64;
  }

  @JsonProperty
  public void setPublicKeyBase64(String publicKeyBase64) {
    this.publicKeyBase64 = publicKeyBase64;
  }

  @JsonProperty
  public boolean isActive() {
    return active;
  }

  @JsonProperty
  public void setActive(boolean active) {
    this.active = active;
  }

  @JsonProperty
  public Instant getRevokedAt() {
    return revokedAt;
  }

  @JsonProperty
  public void setRevokedAt(Instant revokedAt) {
    this.revokedAt = revokedAt;
  }
}
