package com.codeheadsystems.onepass.server.credential;

import com.codeheadsystems.onepass.server.crypto.Base64Url;
import com.codeheadsystems.onepass.server.model.Pass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * Builds and parses the text encoded in a pass QR code:
 * {@code onepass:user:v1.<base64url(payload)>.<base64url(signature)>}.
 */
public class CredentialCodec {

  public static final String PREFIX = "onepass:user:v1.";

  private final ObjectMapper objectMapper;

  public CredentialCodec() {
    this(new ObjectMapper());
  }

  public CredentialCodec(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes a signed pass as QR text.
   *
   * @param pass a pass carrying a signature
   * @return the credential string
   * @throws IllegalArgumentException if the pass is unsigned
   */
  public String encode(Pass pass) {
    if (!pass.hasSignature()) {
      throw new IllegalArgumentException("Pass for " + pass.uid() + " is not signed");
    }
    return PREFIX + Base64Url.encode(PayloadSerializer.toCanonicalJson(pass.payload()))
        + "." + pass.signature();
  }

  /**
   * Parses QR text without checking the signature.
   *
   * @param qrText scanned text
   * @return the parsed credential
   * @throws MalformedCredentialException if the text is not a well-formed credential
   */
  public ParsedCredential parse(String qrText) {
    if (qrText == null || !qrText.startsWith(PREFIX)) {
      throw new MalformedCredentialException("Missing credential prefix");
    }
    String[] segments = qrText.substring(PREFIX.length()).split("\\.", -1);
    if (segments.length != 2 || segments[0].isEmpty() || segments[1].isEmpty()) {
      throw new MalformedCredentialException("Expected payload and signature segments");
    }
    byte[] payloadBytes;
    try {
      payloadBytes = Base64Url.decode(segments[0]);
    } catch (IllegalArgumentException e) {
      throw new MalformedCredentialException("Payload is not base64url", e);
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(payloadBytes);
    } catch (IOException e) {
      throw new MalformedCredentialException("Payload is not JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedCredentialException("Payload is not a JSON object");
    }
    String uid = requiredText(node, "uid");
    String kid = requiredText(node, "kid");
    return new ParsedCredential(uid, kid, node.path("iat").asLong(0), node.path("ver").asInt(0),
        payloadBytes, segments[1]);
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new MalformedCredentialException("Payload is missing " + field);
    }
    return value.asText();
  }
}
