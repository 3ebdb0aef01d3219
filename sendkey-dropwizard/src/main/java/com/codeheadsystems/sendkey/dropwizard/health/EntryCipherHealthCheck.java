package com.codeheadsystems.sendkey.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.sendkey.server.crypto.EntryCipher;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Health check that seals and opens a probe value with the configured master key.
 */
public class EntryCipherHealthCheck extends HealthCheck {

  private static final byte[] PROBE = "sendkey-health".getBytes(StandardCharsets.UTF_8);

  private final EntryCipher entryCipher;
  private final RandomProvider randomProvider;

  public EntryCipherHealthCheck(EntryCipher entryCipher, RandomProvider randomProvider) {
    this.entryCipher = entryCipher;
    this.randomProvider = randomProvider;
  }

  @Override
  protected Result check() {
    byte[] nonce = randomProvider.randomBytes(EntryCipher.NONCE_LENGTH);
    String phrase = randomProvider.randomHex(8);
    byte[] sealed = entryCipher.seal(phrase, nonce, PROBE);
    Optional<byte[]> opened = entryCipher.open(phrase, nonce, sealed);
    if (opened.isEmpty() || !Arrays.equals(opened.get(), PROBE)) {
      return Result.unhealthy("Entry cipher round trip failed");
    }
    if (entryCipher.open(phrase + "x", nonce, sealed).isPresent()) {
      return Result.unhealthy("Entry cipher accepted a wrong phrase");
    }
    return Result.healthy("sealed length=%d", sealed.length);
  }
}
