package com.codeheadsystems.onepass.server.model;

/**
 * A user's signed pass, embedded in the user record.
 * <p>
 * {@code signature} is a detached Ed25519 signature over the canonical JSON of exactly
 * {@code {uid, kid, iat, ver}}; all other fields are mutable bookkeeping that is not signed.
 *
 * @param uid              owner of the pass
 * @param kid              id of the key that produced the signature
 * @param issuedAt         epoch seconds, signed as {@code iat}
 * @param version          payload version, signed as {@code ver}
 * @param active           false once revoked
 * @param signature        base64url signature without padding
 * @param lastScannedAt    epoch seconds of the last accepted scan, null if never scanned
 * @param revokedAt        epoch seconds of revocation, null unless revoked
 * @param revokedBy        uid of the revoking admin
 * @param revocationReason reason supplied at revocation
 */
public record Pass(
    String uid,
    String kid,
    long issuedAt,
    int version,
    boolean active,
    String signature,
    Long lastScannedAt,
    Long revokedAt,
    String revokedBy,
    String revocationReason) {

  public static final int CURRENT_VERSION = 1;

  /**
   * A freshly issued, active pass that has never been scanned.
   */
  public static Pass issued(PassPayload payload, String signature) {
    return new Pass(payload.uid(), payload.kid(), payload.iat(), payload.ver(), true, signature,
        null, null, null, null);
  }

  /**
   * True when the pass can be presented at an entrance.
   */
  public boolean isUsable() {
    return active && revokedAt == null;
  }

  public boolean hasSignature() {
    return signature != null && !signature.isEmpty();
  }

  public PassStatus status() {
    if (revokedAt != null) {
      return PassStatus.REVOKED;
    }
    return active ? PassStatus.ACTIVE : PassStatus.INACTIVE;
  }

  /**
   * The signed portion of this pass.
   */
  public PassPayload payload() {
    return new PassPayload(uid, kid, issuedAt, version);
  }

  public Pass withLastScannedAt(long scannedAt) {
    return new Pass(uid, kid, issuedAt, version, active, signature, scannedAt, revokedAt,
        revokedBy, revocationReason);
  }

  public Pass revoked(long at, String by, String reason) {
    return new Pass(uid, kid, issuedAt, version, false, signature, lastScannedAt, at, by, reason);
  }
}
