package com.codeheadsystems.sendkey.server.crypto;

import org.bouncycastle.crypto.generators.OpenBSDBCrypt;

/**
 * bcrypt password hashing via BouncyCastle's {@link OpenBSDBCrypt}.
 */
public class PasswordHasher {

  /**
   * bcrypt only reads the first 72 bytes of a password.
   */
  public static final int MAX_PASSWORD_BYTES = 72;

  private static final int SALT_LENGTH = 16;

  private final RandomProvider randomProvider;
  private final int cost;

  public PasswordHasher(RandomProvider randomProvider, int cost) {
    if (cost < 4 || cost > 31) {
      throw new IllegalArgumentException("bcrypt cost must be between 4 and 31");
    }
    this.randomProvider = randomProvider;
    this.cost = cost;
  }

  public String hash(String password) {
    return OpenBSDBCrypt.generate(password.toCharArray(), randomProvider.randomBytes(SALT_LENGTH), cost);
  }

  public boolean matches(String passwordHash, String password) {
    return OpenBSDBCrypt.checkPassword(passwordHash, password.toCharArray());
  }
}
