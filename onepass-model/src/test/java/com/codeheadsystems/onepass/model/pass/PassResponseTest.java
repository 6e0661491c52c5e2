package com.codeheadsystems.onepass.model.pass;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PassResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void neverScannedPass_omitsNullTimestamps() throws Exception {
    PassResponse pass = new PassResponse("u1", "k1", 1_700_000_000L, 1, true, "c2ln", null, null,
        "ACTIVE", "onepass:user:v1.e30.c2ln");

    String json = mapper.writeValueAsString(pass);

    assertThat(json)
        .contains("\"uid\":\"u1\"")
        .contains("\"qrText\":\"onepass:user:v1.e30.c2ln\"")
        .doesNotContain("lastScannedAt")
        .doesNotContain("revokedAt");
  }

  @Test
  void revokeRequest_readsWireNames() throws Exception {
    RevokePassRequest request = mapper.readValue(
        "{\"targetUid\":\"u2\",\"reason\":\"Refund requested\"}", RevokePassRequest.class);

    assertThat(request.targetUid()).isEqualTo("u2");
    assertThat(request.reason()).isEqualTo("Refund requested");
  }
}
