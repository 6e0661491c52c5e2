package com.codeheadsystems.onepass.model.pass;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an administrative pass revocation.
 * <p>
 * Used by: {@code POST /pass/revoke}
 *
 * @param targetUid user whose pass is revoked
 * @param reason    free-text reason kept on the pass and in the audit trail
 */
public record RevokePassRequest(
    @JsonProperty("targetUid") String targetUid,
    @JsonProperty("reason") String reason) {
}
