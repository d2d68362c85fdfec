package org.waabox.vecino;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ReconnectPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReconnectPolicyTest {

  @Test
  void whenCreatingDefault_shouldUseOneToFiveSeconds() {
    final ReconnectPolicy policy = ReconnectPolicy.defaultPolicy();

    assertEquals(Duration.ofSeconds(1), policy.baseDelay());
    assertEquals(Duration.ofSeconds(5), policy.maxDelay());
  }

  @Test
  void whenComputingDelay_givenFirstAttempt_shouldJitterAroundBase() {
    final ReconnectPolicy policy = ReconnectPolicy.of(
        Duration.ofMillis(1000), Duration.ofMillis(5000));

    for (int i = 0; i < 200; i++) {
      final long delay = policy.delayFor(1).toMillis();
      assertTrue(delay >= 500 && delay < 1500, "delay " + delay);
    }
  }

  @Test
  void whenComputingDelay_givenManyAttempts_shouldNeverExceedMax() {
    final ReconnectPolicy policy = ReconnectPolicy.of(
        Duration.ofMillis(1000), Duration.ofMillis(5000));

    for (int attempt = 1; attempt <= 100; attempt++) {
      final long delay = policy.delayFor(attempt).toMillis();
      assertTrue(delay <= 5000, "delay " + delay);
    }
  }

  @Test
  void whenComputingDelay_givenThirdAttempt_shouldHaveGrownExponentially() {
    final ReconnectPolicy policy = ReconnectPolicy.of(
        Duration.ofMillis(100), Duration.ofSeconds(60));

    for (int i = 0; i < 200; i++) {
      final long delay = policy.delayFor(3).toMillis();
      assertTrue(delay >= 200 && delay < 600, "delay " + delay);
    }
  }

  @Test
  void whenCreating_givenInvalidDelays_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> ReconnectPolicy.of(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> ReconnectPolicy.of(Duration.ofSeconds(2),
            Duration.ofSeconds(1)));
    assertThrows(NullPointerException.class,
        () -> ReconnectPolicy.of(null, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> ReconnectPolicy.defaultPolicy().delayFor(0));
  }
}
