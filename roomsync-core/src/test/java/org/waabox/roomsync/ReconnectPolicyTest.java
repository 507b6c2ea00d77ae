package org.waabox.roomsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ReconnectPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReconnectPolicyTest {

  @Test
  void whenUsingDefault_shouldMatchDocumentedValues() {
    final ReconnectPolicy policy = ReconnectPolicy.defaultPolicy();

    assertEquals(Duration.ofSeconds(30), policy.healthCheckInterval());
    assertEquals(5, policy.maxAttempts());
    assertEquals(Duration.ofSeconds(2), policy.backoff());
    assertEquals(BackoffStrategy.FIXED, policy.backoffStrategy());
    assertEquals(Duration.ofSeconds(1), policy.minReconnectSpacing());
    assertEquals(Duration.ofSeconds(10), policy.connectTimeout());
  }

  @Test
  void whenComputingDelay_givenFixedStrategy_shouldAlwaysUseBackoff() {
    final ReconnectPolicy policy = ReconnectPolicy.defaultPolicy();

    assertEquals(Duration.ofSeconds(2), policy.delayFor(0));
    assertEquals(Duration.ofSeconds(2), policy.delayFor(4));
  }

  @Test
  void whenComputingDelay_givenExponentialStrategy_shouldDoubleEachAttempt() {
    final ReconnectPolicy policy = ReconnectPolicy.of(Duration.ofSeconds(30),
        5, Duration.ofSeconds(1), BackoffStrategy.EXPONENTIAL,
        Duration.ofSeconds(1), Duration.ofSeconds(10));

    assertEquals(Duration.ofSeconds(1), policy.delayFor(0));
    assertEquals(Duration.ofSeconds(2), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(8), policy.delayFor(3));
  }

  @Test
  void whenCreating_givenZeroAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ReconnectPolicy.of(Duration.ofSeconds(30), 0, Duration.ofSeconds(2),
            BackoffStrategy.FIXED, Duration.ofSeconds(1),
            Duration.ofSeconds(10))
    );
  }

  @Test
  void whenCreating_givenZeroHealthCheckInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ReconnectPolicy.of(Duration.ZERO, 5, Duration.ofSeconds(2),
            BackoffStrategy.FIXED, Duration.ofSeconds(1),
            Duration.ofSeconds(10))
    );
  }

  @Test
  void whenCreating_givenNegativeSpacing_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ReconnectPolicy.of(Duration.ofSeconds(30), 5, Duration.ofSeconds(2),
            BackoffStrategy.FIXED, Duration.ofMillis(-1),
            Duration.ofSeconds(10))
    );
  }

  @Test
  void whenCreating_givenNullStrategy_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        ReconnectPolicy.of(Duration.ofSeconds(30), 5, Duration.ofSeconds(2),
            null, Duration.ofSeconds(1), Duration.ofSeconds(10))
    );
  }
}
