package com.codeheadsystems.onepass.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer tokens that identify callers of the pass endpoints.
 * <p>
 * Tokens are signed with HMAC-SHA256 and carry the caller's uid as subject. They convey identity
 * only; roles are looked up per request by {@link AccessController}.
 */
public class JwtManager {

  private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new JwtManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   * @param clock      time source for issued-at and expiry
   */
  public JwtManager(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    // java-jwt 4.x only accepts a Clock through BaseVerification.build(Clock).
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a token for a user.
   *
   * @param uid the user id placed in the subject claim
   * @return signed JWT string
   */
  public String issueToken(String uid) {
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(uid)
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued JWT jti={} for uid={}", jti, uid);
    return token;
  }

  /**
   * Result of a successful JWT verification.
   *
   * @param subject the uid of the caller
   * @param jti     the JWT ID
   */
  public record VerifyResult(String subject, String jti) {
  }

  /**
   * Verifies a JWT and returns its subject and JTI if valid.
   *
   * @param token JWT string
   * @return verify result if valid, empty if invalid, expired or lacking a subject
   */
  public Optional<VerifyResult> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      if (decoded.getSubject() == null || decoded.getSubject().isBlank()) {
        log.debug("JWT jti={} has no subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), decoded.getId()));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
