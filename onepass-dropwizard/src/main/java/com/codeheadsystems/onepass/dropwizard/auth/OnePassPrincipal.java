package com.codeheadsystems.onepass.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated OnePass caller.
 *
 * @param uid the caller's user id from the JWT subject
 * @param jti JWT ID of the presented token
 */
public record OnePassPrincipal(String uid, String jti) implements Principal {

  @Override
  public String getName() {
    return uid;
  }
}
