package com.codeheadsystems.onepass.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.HexFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the JWT bearer filter guarding the pass endpoints.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthIntegrationTest {

  static final DropwizardAppExtension<OnePassConfiguration> APP =
      new DropwizardAppExtension<>(
          OnePassApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  @Test
  void validToken_returns200() throws Exception {
    String token = bundle().getJwtManager().issueToken("auth-user-1");

    HttpResponse<String> response = send(post("/pass").header("Authorization", "Bearer " + token));

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"uid\":\"auth-user-1\"");
  }

  @Test
  void noToken_returns401() throws Exception {
    assertThat(send(post("/pass")).statusCode()).isEqualTo(401);
    assertThat(send(post("/entry/validate")).statusCode()).isEqualTo(401);
    assertThat(send(post("/pass/revoke")).statusCode()).isEqualTo(401);
    assertThat(send(post("/accounts")).statusCode()).isEqualTo(401);
  }

  @Test
  void bogusToken_returns401() throws Exception {
    HttpResponse<String> response =
        send(post("/pass").header("Authorization", "Bearer not-a-real-token"));

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void expiredToken_returns401() throws Exception {
    String token = JWT.create()
        .withIssuer("onepass-test")
        .withJWTId("expired-jti")
        .withSubject("auth-user-2")
        .withIssuedAt(Instant.now().minusSeconds(7200))
        .withExpiresAt(Instant.now().minusSeconds(3600))
        .sign(Algorithm.HMAC256(HexFormat.of()
            .parseHex("e37168e955b838df021d354f2b537c8f9cd705cc5e39c4494eccabef55e4446b")));

    HttpResponse<String> response = send(post("/pass").header("Authorization", "Bearer " + token));

    assertThat(response.statusCode()).isEqualTo(401);
  }

  private OnePassBundle<OnePassConfiguration> bundle() {
    return APP.<OnePassApplication>getApplication().getBundle();
  }

  private HttpRequest.Builder post(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d%s", APP.getLocalPort(), path)))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString("{}"));
  }

  private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
    return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
  }
}
