package com.codeheadsystems.onepass.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the OnePass pass service.
 * <p>
 * For production, configure {@code jwtSecretHex} and at least one active entry in
 * {@code signingKeys} so that tokens and passes survive restarts. Omitting the keys causes an
 * ephemeral key to be generated on each startup (dev/test only: every issued pass becomes
 * unverifiable after a restart).
 * <p>
 * Generate a JWT secret with: {@code openssl rand -hex 32}
 */
public class OnePassConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for JWT tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * JWT token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "onepass";

  /**
   * Accepted scans of the same pass for the same event within this many seconds are rejected
   * as duplicates.
   */
  @Min(0)
  private long replayWindowSeconds = 30;

  /**
   * Pass signing keys. Exactly one should be active; the others only verify existing passes.
   */
  @Valid
  @NotNull
  private List<SigningKeyConfiguration> signingKeys = new ArrayList<>();

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getReplayWindowSeconds() {
    return replayWindowSeconds;
  }

  @JsonProperty
  public void setReplayWindowSeconds(long replayWindowSeconds) {
    this.replayWindowSeconds = replayWindowSeconds;
  }

  @JsonProperty
  public List<SigningKeyConfiguration> getSigningKeys() {
    return signingKeys;
  }

  @JsonProperty
  public void setSigningKeys(List<SigningKeyConfiguration> signingKeys) {
    this.signingKeys = signingKeys;
  }
}
