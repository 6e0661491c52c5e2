package com.codeheadsystems.onepass.model.pass;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a user's signed pass.
 * <p>
 * The signature covers the canonical payload {@code {"uid","kid","iat","ver"}} only; every other
 * field is server-side bookkeeping. {@code qrText} is the complete credential the holder's device
 * renders as a QR code.
 * <p>
 * Used by: {@code POST /pass} response
 *
 * @param uid           owner of the pass
 * @param kid           id of the signing key
 * @param issuedAt      epoch seconds at issuance ({@code iat} in the signed payload)
 * @param version       payload version ({@code ver} in the signed payload)
 * @param active        false once revoked
 * @param signature     base64url Ed25519 signature, no padding
 * @param lastScannedAt epoch seconds of the last accepted scan, if any
 * @param revokedAt     epoch seconds of revocation, if revoked
 * @param status        ACTIVE, INACTIVE or REVOKED
 * @param qrText        {@code onepass:user:v1.<payload>.<signature>}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PassResponse(
    @JsonProperty("uid") String uid,
    @JsonProperty("kid") String kid,
    @JsonProperty("issuedAt") long issuedAt,
    @JsonProperty("version") int version,
    @JsonProperty("active") boolean active,
    @JsonProperty("signature") String signature,
    @JsonProperty("lastScannedAt") Long lastScannedAt,
    @JsonProperty("revokedAt") Long revokedAt,
    @JsonProperty("status") String status,
    @JsonProperty("qrText") String qrText) {
}
