package com.codeheadsystems.sendkey.server.crypto;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for entry nonces, refresh-token values and password salts.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a provider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates {@code len} random bytes rendered as lowercase hex.
   *
   * @param len the number of random bytes
   * @return a hex string of {@code 2 * len} characters
   */
  public String randomHex(int len) {
    return HexFormat.of().formatHex(randomBytes(len));
  }
}
