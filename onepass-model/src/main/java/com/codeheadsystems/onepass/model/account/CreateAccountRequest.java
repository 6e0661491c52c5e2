package com.codeheadsystems.onepass.model.account;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for creating the caller's user record.
 * <p>
 * Used by: {@code POST /accounts}
 *
 * @param email contact address stored on the user record
 */
public record CreateAccountRequest(@JsonProperty("email") String email) {
}
