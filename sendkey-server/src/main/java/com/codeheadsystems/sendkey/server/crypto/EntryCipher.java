package com.codeheadsystems.sendkey.server.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM sealing of entry values under a per-entry key.
 * <p>
 * The key is {@code SHA-256(masterKey || UTF-8(secretPhrase))}. It is derived on every call
 * and never stored, so a value can only be opened by someone who knows the phrase and holds
 * the master key. No associated data is bound. Output is {@code ciphertext || 16-byte tag}.
 */
public class EntryCipher {

  private static final Logger log = LoggerFactory.getLogger(EntryCipher.class);

  /**
   * GCM nonce length in bytes.
   */
  public static final int NONCE_LENGTH = 12;

  /**
   * GCM authentication tag length in bytes.
   */
  public static final int TAG_LENGTH = 16;

  private final byte[] masterKey;

  /**
   * Instantiates a new entry cipher.
   *
   * @param masterKey process-wide master key, must not be empty
   */
  public EntryCipher(byte[] masterKey) {
    if (masterKey == null || masterKey.length == 0) {
      throw new IllegalArgumentException("Master key must not be empty");
    }
    this.masterKey = masterKey.clone();
  }

  /**
   * Encrypts a value.
   *
   * @param secretPhrase the phrase the recipient will present
   * @param nonce        12-byte nonce, unique per entry
   * @param plaintext    the value
   * @return ciphertext followed by the tag
   */
  public byte[] seal(String secretPhrase, byte[] nonce, byte[] plaintext) {
    checkNonce(nonce);
    byte[] key = deriveKey(secretPhrase);
    try {
      GCMModeCipher cipher = init(true, key, nonce);
      byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
      int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
      len += cipher.doFinal(out, len);
      return len == out.length ? out : Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("AES-GCM encryption failed", e);
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  /**
   * Decrypts a value. A wrong phrase and a corrupted ciphertext are not distinguished.
   *
   * @param secretPhrase the presented phrase
   * @param nonce        the entry's nonce
   * @param sealed       ciphertext followed by the tag
   * @return the plaintext, or empty if authentication failed
   */
  public Optional<byte[]> open(String secretPhrase, byte[] nonce, byte[] sealed) {
    checkNonce(nonce);
    if (sealed == null || sealed.length < TAG_LENGTH) {
      return Optional.empty();
    }
    byte[] key = deriveKey(secretPhrase);
    try {
      GCMModeCipher cipher = init(false, key, nonce);
      byte[] out = new byte[cipher.getOutputSize(sealed.length)];
      int len = cipher.processBytes(sealed, 0, sealed.length, out, 0);
      len += cipher.doFinal(out, len);
      return Optional.of(len == out.length ? out : Arrays.copyOf(out, len));
    } catch (InvalidCipherTextException e) {
      log.debug("GCM tag verification failed");
      return Optional.empty();
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  byte[] deriveKey(String secretPhrase) {
    byte[] phrase = secretPhrase.getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(masterKey, 0, masterKey.length);
    digest.update(phrase, 0, phrase.length);
    byte[] key = new byte[digest.getDigestSize()];
    digest.doFinal(key, 0);
    return key;
  }

  private static GCMModeCipher init(boolean forEncryption, byte[] key, byte[] nonce) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_LENGTH * 8, nonce));
    return cipher;
  }

  private static void checkNonce(byte[] nonce) {
    if (nonce == null || nonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("Nonce must be " + NONCE_LENGTH + " bytes");
    }
  }
}
