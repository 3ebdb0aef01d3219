package com.codeheadsystems.sendkey.springboot.health;

import com.codeheadsystems.sendkey.server.crypto.EntryCipher;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Seals and opens a probe value with the configured master key.
 */
@Component
public class SendKeyHealthIndicator implements HealthIndicator {

  private static final byte[] PROBE = "sendkey-health".getBytes(StandardCharsets.UTF_8);

  private final EntryCipher entryCipher;
  private final RandomProvider randomProvider;

  public SendKeyHealthIndicator(EntryCipher entryCipher, RandomProvider randomProvider) {
    this.entryCipher = entryCipher;
    this.randomProvider = randomProvider;
  }

  @Override
  public Health health() {
    byte[] nonce = randomProvider.randomBytes(EntryCipher.NONCE_LENGTH);
    String phrase = randomProvider.randomHex(8);
    byte[] sealed = entryCipher.seal(phrase, nonce, PROBE);
    Optional<byte[]> opened = entryCipher.open(phrase, nonce, sealed);
    if (opened.isEmpty() || !Arrays.equals(opened.get(), PROBE)) {
      return Health.down().withDetail("entryCipher", "round trip failed").build();
    }
    if (entryCipher.open(phrase + "x", nonce, sealed).isPresent()) {
      return Health.down().withDetail("entryCipher", "accepted a wrong phrase").build();
    }
    return Health.up().withDetail("sealedLength", sealed.length).build();
  }
}
