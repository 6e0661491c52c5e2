package com.codeheadsystems.onepass.testserver.cli;

import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.crypto.SigningKeyGenerator;
import java.util.Base64;

/**
 * Command-line generator for Ed25519 pass signing keys.
 *
 * <pre>
 * Usage:
 *   java -cp onepass-testserver.jar com.codeheadsystems.onepass.testserver.cli.KeyGenCli \
 *       [--key-id &lt;id&gt;] [--inactive]
 * </pre>
 *
 * <p>Prints a {@code signingKeys} entry ready to paste into {@code config/config.yml}. The private
 * key is the 64-byte {@code seed || publicKey} form, base64 encoded. Keep it out of source control.
 */
public class KeyGenCli {

  static final String DEFAULT_KEY_ID = "k1";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String keyId = DEFAULT_KEY_ID;
    boolean active = true;

    for (int i = 0; i < args.length; i++) {
      if ("--key-id".equals(args[i]) && i + 1 < args.length) {
        keyId = args[++i];
      } else if ("--inactive".equals(args[i])) {
        active = false;
      } else {
        System.err.println("Usage: KeyGenCli [--key-id <id>] [--inactive]");
        System.err.println();
        System.err.println("  --key-id <id>   Key id embedded in issued passes (default: " + DEFAULT_KEY_ID + ")");
        System.err.println("  --inactive      Emit the key as inactive, for staged rotation");
        System.exit(1);
      }
    }

    if (keyId.isBlank()) {
      System.err.println("Error: key id must not be blank");
      System.exit(1);
    }

    System.out.print(render(new SigningKeyGenerator().generate(keyId, active)));
  }

  /**
   * Renders a key as a YAML list entry under {@code signingKeys}.
   *
   * @param key generated key with a 32-byte seed
   * @return the YAML snippet
   */
  static String render(SigningKey key) {
    byte[] expanded = new byte[64];
    System.arraycopy(key.privateKey(), 0, expanded, 0, 32);
    System.arraycopy(key.publicKey(), 0, expanded, 32, 32);
    Base64.Encoder encoder = Base64.getEncoder();
    return "signingKeys:\n"
        + "  - keyId: " + key.keyId() + "\n"
        + "    privateKeyBase64: " + encoder.encodeToString(expanded) + "\n"
        + "    publicKeyBase64: " + encoder.encodeToString(key.publicKey()) + "\n"
        + "    active: " + key.active() + "\n";
  }
}
