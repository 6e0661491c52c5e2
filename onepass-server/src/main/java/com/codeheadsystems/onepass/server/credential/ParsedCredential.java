package com.codeheadsystems.onepass.server.credential;

import java.util.Arrays;

/**
 * A credential split into its signed payload and detached signature.
 *
 * @param uid          pass owner from the payload
 * @param kid          signing key id from the payload
 * @param iat          issued-at from the payload, 0 when absent
 * @param ver          payload version, 0 when absent
 * @param payloadBytes the payload exactly as received, the bytes the signature must cover
 * @param signature    base64url signature segment
 */
public record ParsedCredential(
    String uid,
    String kid,
    long iat,
    int ver,
    byte[] payloadBytes,
    String signature) {

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParsedCredential that)) {
      return false;
    }
    return iat == that.iat && ver == that.ver
        && uid.equals(that.uid) && kid.equals(that.kid)
        && Arrays.equals(payloadBytes, that.payloadBytes)
        && signature.equals(that.signature);
  }

  @Override
  public int hashCode() {
    int result = uid.hashCode();
    result = 31 * result + kid.hashCode();
    result = 31 * result + Arrays.hashCode(payloadBytes);
    return 31 * result + signature.hashCode();
  }

  @Override
  public String toString() {
    return "ParsedCredential[uid=" + uid + ", kid=" + kid + ", iat=" + iat + ", ver=" + ver + "]";
  }
}
