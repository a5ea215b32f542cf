package org.maap.client.dps;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void doublesFromBaseUntilCeiling() {
    BackoffPolicy p = BackoffPolicy.defaults();
    assertEquals(Duration.ofSeconds(1), p.delayFor(0));
    assertEquals(Duration.ofSeconds(2), p.delayFor(1));
    assertEquals(Duration.ofSeconds(32), p.delayFor(5));
    assertEquals(Duration.ofSeconds(64), p.delayFor(6));
    assertEquals(Duration.ofSeconds(64), p.delayFor(7));
  }

  @Test
  void largeAttemptNumbersDoNotOverflow() {
    BackoffPolicy p = BackoffPolicy.defaults();
    assertEquals(Duration.ofSeconds(64), p.delayFor(63));
    assertEquals(Duration.ofSeconds(64), p.delayFor(Integer.MAX_VALUE));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BackoffPolicy(
                Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(100)));
    assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.defaults().delayFor(-1));
  }
}
