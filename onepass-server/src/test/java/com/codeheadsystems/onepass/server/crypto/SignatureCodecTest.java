package com.codeheadsystems.onepass.server.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.onepass.server.store.InMemoryKeyStore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignatureCodecTest {

  // RFC 8032 section 7.1, test 1
  private static final byte[] RFC_SEED = HexFormat.of()
      .parseHex("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60");
  private static final byte[] RFC_PUBLIC = HexFormat.of()
      .parseHex("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a");
  private static final byte[] RFC_SIGNATURE = HexFormat.of()
      .parseHex("e5564300c360ac729086e2cc806e828a84877f1eb8e5d974d873e065224901555fb8821590a33bac"
          + "c61e39701cf9b46bd25bf5f0595bbe24655141438e7a100b");

  private static final byte[] PAYLOAD =
      "{\"uid\":\"u1\",\"kid\":\"k1\",\"iat\":1700000000,\"ver\":1}".getBytes(StandardCharsets.UTF_8);

  private InMemoryKeyStore keyStore;
  private SignatureCodec codec;
  private SigningKey key;

  @BeforeEach
  void setUp() {
    keyStore = new InMemoryKeyStore();
    codec = new SignatureCodec(keyStore);
    key = new SigningKeyGenerator().generate("k1", true);
    keyStore.store(key);
  }

  @Test
  void sign_matchesRfc8032Vector() {
    String signature = codec.sign(new byte[0], RFC_SEED);
    assertThat(Base64Url.decode(signature)).isEqualTo(RFC_SIGNATURE);

    keyStore.store(new SigningKey("rfc", RFC_PUBLIC, RFC_SEED, false, null));
    assertThat(codec.verify(new byte[0], signature, "rfc")).isTrue();
  }

  @Test
  void sign_acceptsSixtyFourByteSecretKey() {
    byte[] secret = new byte[64];
    System.arraycopy(RFC_SEED, 0, secret, 0, 32);
    System.arraycopy(RFC_PUBLIC, 0, secret, 32, 32);

    assertThat(codec.sign(PAYLOAD, secret)).isEqualTo(codec.sign(PAYLOAD, RFC_SEED));
  }

  @Test
  void fromPrivateKey_derivesPublicKey() {
    SigningKey rebuilt = new SigningKeyGenerator().fromPrivateKey("rfc", RFC_SEED, true);

    assertThat(rebuilt.publicKey()).isEqualTo(RFC_PUBLIC);
    assertThat(rebuilt.active()).isTrue();
  }

  @Test
  void sign_rejectsWrongKeyLength() {
    assertThatThrownBy(() -> codec.sign(PAYLOAD, new byte[16]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void signThenVerify_roundTrip() {
    String signature = codec.sign(PAYLOAD, key.privateKey());
    assertThat(signature).doesNotContain("=", "+", "/");
    assertThat(codec.verify(PAYLOAD, signature, "k1")).isTrue();
  }

  @Test
  void verify_flippedPayloadByte_fails() {
    String signature = codec.sign(PAYLOAD, key.privateKey());
    byte[] tampered = PAYLOAD.clone();
    tampered[10] ^= 0x01;
    assertThat(codec.verify(tampered, signature, "k1")).isFalse();
  }

  @Test
  void verify_flippedSignatureByte_fails() {
    byte[] signature = Base64Url.decode(codec.sign(PAYLOAD, key.privateKey()));
    signature[0] ^= 0x01;
    assertThat(codec.verify(PAYLOAD, Base64Url.encode(signature), "k1")).isFalse();
  }

  @Test
  void verify_unknownKey_fails() {
    String signature = codec.sign(PAYLOAD, key.privateKey());
    assertThat(codec.verify(PAYLOAD, signature, "nope")).isFalse();
  }

  @Test
  void verify_revokedKey_fails() {
    String signature = codec.sign(PAYLOAD, key.privateKey());
    keyStore.revoke("k1", Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(codec.verify(PAYLOAD, signature, "k1")).isFalse();
  }

  @Test
  void verify_inactiveKey_stillVerifies() {
    String signature = codec.sign(PAYLOAD, key.privateKey());
    keyStore.store(new SigningKeyGenerator().generate("k2", true));

    assertThat(keyStore.findKey("k1").orElseThrow().active()).isFalse();
    assertThat(codec.verify(PAYLOAD, signature, "k1")).isTrue();
  }

  @Test
  void verify_garbageSignature_returnsFalse() {
    assertThat(codec.verify(PAYLOAD, "@@not-base64@@", "k1")).isFalse();
    assertThat(codec.verify(PAYLOAD, "AAAA", "k1")).isFalse();
  }

  @Test
  void toString_hidesPrivateKey() {
    assertThat(key.toString()).doesNotContain("privateKey");
  }
}
