package com.codeheadsystems.onepass.server.crypto;

import java.util.Base64;

/**
 * URL-safe base64 as used in pass credentials: {@code -} and {@code _} instead of {@code +} and
 * {@code /}, with no padding on output.
 */
public final class Base64Url {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getDecoder();

  private Base64Url() {
  }

  public static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes base64url by restoring the standard alphabet and padding to a multiple of four.
   *
   * @param value base64url text, with or without padding
   * @return the decoded bytes
   * @throws IllegalArgumentException if the value is not valid base64 once restored
   */
  public static byte[] decode(String value) {
    if (value == null) {
      throw new IllegalArgumentException("base64url value is null");
    }
    StringBuilder standard = new StringBuilder(value.replace('-', '+').replace('_', '/'));
    while (standard.length() % 4 != 0) {
      standard.append('=');
    }
    return DECODER.decode(standard.toString());
  }
}
