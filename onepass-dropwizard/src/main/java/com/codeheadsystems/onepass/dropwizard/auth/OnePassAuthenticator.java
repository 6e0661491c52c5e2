package com.codeheadsystems.onepass.dropwizard.auth;

import com.codeheadsystems.onepass.server.auth.JwtManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates JWT bearer tokens using {@link JwtManager}.
 */
public class OnePassAuthenticator implements Authenticator<String, OnePassPrincipal> {

  private final JwtManager jwtManager;

  /**
   * Instantiates a new OnePass authenticator.
   *
   * @param jwtManager the jwt manager
   */
  public OnePassAuthenticator(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  public Optional<OnePassPrincipal> authenticate(String token) throws AuthenticationException {
    return jwtManager.verify(token)
        .map(result -> new OnePassPrincipal(result.subject(), result.jti()));
  }
}
