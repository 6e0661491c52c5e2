package com.codeheadsystems.onepass.server.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.onepass.server.crypto.Base64Url;
import com.codeheadsystems.onepass.server.crypto.SignatureCodec;
import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.crypto.SigningKeyGenerator;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.PassPayload;
import com.codeheadsystems.onepass.server.store.InMemoryKeyStore;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialCodecTest {

  private static final PassPayload PAYLOAD = new PassPayload("u1", "k1", 1_700_000_000L, 1);

  private final CredentialCodec codec = new CredentialCodec();
  private SignatureCodec signatureCodec;
  private SigningKey key;

  @BeforeEach
  void setUp() {
    InMemoryKeyStore keyStore = new InMemoryKeyStore();
    key = new SigningKeyGenerator().generate("k1", true);
    keyStore.store(key);
    signatureCodec = new SignatureCodec(keyStore);
  }

  @Test
  void canonicalJson_hasFixedFieldOrder() {
    assertThat(new String(PayloadSerializer.toCanonicalJson(PAYLOAD), StandardCharsets.UTF_8))
        .isEqualTo("{\"uid\":\"u1\",\"kid\":\"k1\",\"iat\":1700000000,\"ver\":1}");
  }

  @Test
  void encode_producesPrefixedTwoSegmentCredential() {
    Pass pass = signedPass();

    String qrText = codec.encode(pass);

    assertThat(qrText).startsWith(CredentialCodec.PREFIX);
    String[] segments = qrText.substring(CredentialCodec.PREFIX.length()).split("\\.");
    assertThat(segments).hasSize(2);
    assertThat(segments[1]).isEqualTo(pass.signature());
  }

  @Test
  void parse_returnsPayloadBytesAsReceived() {
    Pass pass = signedPass();

    ParsedCredential parsed = codec.parse(codec.encode(pass));

    assertThat(parsed.uid()).isEqualTo("u1");
    assertThat(parsed.kid()).isEqualTo("k1");
    assertThat(parsed.iat()).isEqualTo(1_700_000_000L);
    assertThat(parsed.ver()).isEqualTo(1);
    assertThat(parsed.payloadBytes()).isEqualTo(PayloadSerializer.toCanonicalJson(PAYLOAD));
    assertThat(signatureCodec.verify(parsed.payloadBytes(), parsed.signature(), parsed.kid()))
        .isTrue();
  }

  @Test
  void reorderedPayload_failsVerification() {
    Pass pass = signedPass();
    byte[] reordered = "{\"kid\":\"k1\",\"uid\":\"u1\",\"iat\":1700000000,\"ver\":1}"
        .getBytes(StandardCharsets.UTF_8);
    String qrText = CredentialCodec.PREFIX + Base64Url.encode(reordered) + "." + pass.signature();

    ParsedCredential parsed = codec.parse(qrText);

    assertThat(parsed.uid()).isEqualTo("u1");
    assertThat(signatureCodec.verify(parsed.payloadBytes(), parsed.signature(), parsed.kid()))
        .isFalse();
  }

  @Test
  void encode_unsignedPass_throws() {
    Pass unsigned = Pass.issued(PAYLOAD, "");
    assertThatThrownBy(() -> codec.encode(unsigned)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_wrongPrefix_throws() {
    assertMalformed("onepass:ticket:v1.abc.def");
    assertMalformed(null);
  }

  @Test
  void parse_wrongSegmentCount_throws() {
    String payload = Base64Url.encode(PayloadSerializer.toCanonicalJson(PAYLOAD));
    assertMalformed(CredentialCodec.PREFIX + payload);
    assertMalformed(CredentialCodec.PREFIX + payload + ".sig.extra");
    assertMalformed(CredentialCodec.PREFIX + payload + ".");
    assertMalformed(CredentialCodec.PREFIX + ".sig");
  }

  @Test
  void parse_undecodablePayload_throws() {
    assertMalformed(CredentialCodec.PREFIX + "@@@.sig");
  }

  @Test
  void parse_nonJsonPayload_throws() {
    assertMalformed(CredentialCodec.PREFIX + encode("not json") + ".sig");
    assertMalformed(CredentialCodec.PREFIX + encode("[1,2]") + ".sig");
  }

  @Test
  void parse_missingFields_throws() {
    assertMalformed(CredentialCodec.PREFIX + encode("{\"kid\":\"k1\"}") + ".sig");
    assertMalformed(CredentialCodec.PREFIX + encode("{\"uid\":\"u1\",\"kid\":\" \"}") + ".sig");
    assertMalformed(CredentialCodec.PREFIX + encode("{\"uid\":7,\"kid\":\"k1\"}") + ".sig");
  }

  private Pass signedPass() {
    String signature = signatureCodec.sign(PayloadSerializer.toCanonicalJson(PAYLOAD),
        key.privateKey());
    return Pass.issued(PAYLOAD, signature);
  }

  private static String encode(String json) {
    return Base64Url.encode(json.getBytes(StandardCharsets.UTF_8));
  }

  private void assertMalformed(String qrText) {
    assertThatThrownBy(() -> codec.parse(qrText)).isInstanceOf(MalformedCredentialException.class);
  }
}
