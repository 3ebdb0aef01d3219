package com.codeheadsystems.sendkey.server.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void randomBytes_returnsRequestedLength() {
    assertThat(new RandomProvider().randomBytes(12)).hasSize(12);
  }

  @Test
  void randomHex_isLowercaseAndTwiceTheByteLength() {
    String hex = new RandomProvider().randomHex(25);

    assertThat(hex).hasSize(50).matches("[0-9a-f]+");
  }

  @Test
  void sameSeed_producesSameBytes() throws Exception {
    SecureRandom first = SecureRandom.getInstance("SHA1PRNG");
    first.setSeed(42L);
    SecureRandom second = SecureRandom.getInstance("SHA1PRNG");
    second.setSeed(42L);

    assertThat(new RandomProvider(first).randomBytes(16))
        .isEqualTo(new RandomProvider(second).randomBytes(16));
  }
}
