package com.codeheadsystems.onepass.server.credential;

import com.codeheadsystems.onepass.server.model.PassPayload;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes the signed pass payload as compact JSON with the fixed field order
 * {@code uid, kid, iat, ver}.
 * <p>
 * Signatures cover these exact bytes, so the order is written field by field rather than left to
 * object mapping.
 */
public final class PayloadSerializer {

  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private PayloadSerializer() {
  }

  public static byte[] toCanonicalJson(PassPayload payload) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(128);
    try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField("uid", payload.uid());
      generator.writeStringField("kid", payload.kid());
      generator.writeNumberField("iat", payload.iat());
      generator.writeNumberField("ver", payload.ver());
      generator.writeEndObject();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to serialize pass payload", e);
    }
    return out.toByteArray();
  }
}
