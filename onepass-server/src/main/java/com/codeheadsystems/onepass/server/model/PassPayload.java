package com.codeheadsystems.onepass.server.model;

/**
 * The four signed fields of a pass, in wire order.
 * <p>
 * The field order {@code uid, kid, iat, ver} is part of the credential format; see
 * {@link com.codeheadsystems.onepass.server.credential.PayloadSerializer}.
 *
 * @param uid owner of the pass
 * @param kid signing key id
 * @param iat issued-at, epoch seconds
 * @param ver payload version
 */
public record PassPayload(String uid, String kid, long iat, int ver) {
}
