package com.codeheadsystems.onepass.model.pass;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a revocation request. Revoking an already revoked pass is reported as a success.
 *
 * @param success always true when returned; failures are signalled with an HTTP error
 * @param message human-readable outcome
 */
public record RevokePassResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message) {
}
