package org.waabox.roomsync;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how push channels are supervised and re-opened after a failure.
 *
 * <p>Instances are created through static factory methods. The default
 * policy samples health every 30 seconds, allows 5 automatic reconnect
 * attempts spaced by a fixed 2-second backoff, never opens the same
 * channel twice within 1 second and gives a handshake 10 seconds to
 * complete.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReconnectPolicy {

  /** The default health sampling interval. */
  private static final Duration DEFAULT_HEALTH_CHECK_INTERVAL =
      Duration.ofSeconds(30);

  /** The default number of automatic reconnect attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 5;

  /** The default backoff duration. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(2);

  /** The default minimum spacing between channel opens for one id. */
  private static final Duration DEFAULT_MIN_RECONNECT_SPACING =
      Duration.ofSeconds(1);

  /** The default handshake timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The interval between two health samples, never null. */
  private final Duration healthCheckInterval;

  /** The maximum number of automatic reconnect attempts. */
  private final int maxAttempts;

  /** The base delay before an automatic reconnect, never null. */
  private final Duration backoff;

  /** How the backoff grows between attempts, never null. */
  private final BackoffStrategy backoffStrategy;

  /** The hard floor between two channel opens for the same id. */
  private final Duration minReconnectSpacing;

  /** How long a channel may stay connecting, never null. */
  private final Duration connectTimeout;

  private ReconnectPolicy(final Duration theHealthCheckInterval,
      final int theMaxAttempts, final Duration theBackoff,
      final BackoffStrategy theBackoffStrategy,
      final Duration theMinReconnectSpacing,
      final Duration theConnectTimeout) {
    healthCheckInterval = theHealthCheckInterval;
    maxAttempts = theMaxAttempts;
    backoff = theBackoff;
    backoffStrategy = theBackoffStrategy;
    minReconnectSpacing = theMinReconnectSpacing;
    connectTimeout = theConnectTimeout;
  }

  /**
   * Creates a reconnect policy with the given parameters.
   *
   * @param healthCheckInterval the interval between health samples, must
   *                            be positive
   * @param maxAttempts         the maximum number of automatic reconnect
   *                            attempts, must be greater than zero
   * @param backoff             the base delay before a reconnect, must not
   *                            be negative
   * @param backoffStrategy     how the delay grows, never null
   * @param minReconnectSpacing the minimum time between two channel opens
   *                            for the same id, must not be negative
   * @param connectTimeout      how long a channel may stay connecting,
   *                            must be positive
   *
   * @return a new reconnect policy, never null
   *
   * @throws IllegalArgumentException if a duration or count is out of range
   * @throws NullPointerException if any argument is null
   */
  public static ReconnectPolicy of(final Duration healthCheckInterval,
      final int maxAttempts, final Duration backoff,
      final BackoffStrategy backoffStrategy,
      final Duration minReconnectSpacing, final Duration connectTimeout) {
    Objects.requireNonNull(healthCheckInterval,
        "healthCheckInterval must not be null");
    Objects.requireNonNull(backoff, "backoff must not be null");
    Objects.requireNonNull(backoffStrategy,
        "backoffStrategy must not be null");
    Objects.requireNonNull(minReconnectSpacing,
        "minReconnectSpacing must not be null");
    Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    requirePositive(healthCheckInterval, "healthCheckInterval");
    requirePositive(connectTimeout, "connectTimeout");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must not be negative, got: " + backoff);
    }
    if (minReconnectSpacing.isNegative()) {
      throw new IllegalArgumentException(
          "minReconnectSpacing must not be negative, got: "
              + minReconnectSpacing);
    }
    return new ReconnectPolicy(healthCheckInterval, maxAttempts, backoff,
        backoffStrategy, minReconnectSpacing, connectTimeout);
  }

  /**
   * Creates a reconnect policy with sensible defaults: 30-second health
   * checks, 5 attempts with a fixed 2-second backoff, 1-second spacing and
   * a 10-second connect timeout.
   *
   * @return the default reconnect policy, never null
   */
  public static ReconnectPolicy defaultPolicy() {
    return new ReconnectPolicy(DEFAULT_HEALTH_CHECK_INTERVAL,
        DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF, BackoffStrategy.FIXED,
        DEFAULT_MIN_RECONNECT_SPACING, DEFAULT_CONNECT_TIMEOUT);
  }

  private static void requirePositive(final Duration value,
      final String name) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(
          name + " must be positive, got: " + value);
    }
  }

  /**
   * Computes the delay before the reconnect attempt with the given index.
   *
   * @param attempt the number of attempts already made, zero or more
   *
   * @return the delay to wait, never null
   */
  public Duration delayFor(final int attempt) {
    if (backoffStrategy == BackoffStrategy.FIXED || attempt <= 0) {
      return backoff;
    }
    // caps the shift so the multiplication cannot overflow.
    final int shift = Math.min(attempt, 20);
    return backoff.multipliedBy(1L << shift);
  }

  /**
   * Returns the interval between two health samples.
   *
   * @return the health check interval, never null
   */
  public Duration healthCheckInterval() {
    return healthCheckInterval;
  }

  /**
   * Returns the maximum number of automatic reconnect attempts.
   *
   * @return the maximum attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the base backoff.
   *
   * @return the backoff, never null
   */
  public Duration backoff() {
    return backoff;
  }

  /**
   * Returns the backoff strategy.
   *
   * @return the strategy, never null
   */
  public BackoffStrategy backoffStrategy() {
    return backoffStrategy;
  }

  /**
   * Returns the minimum spacing between two channel opens for one id.
   *
   * @return the spacing, never null
   */
  public Duration minReconnectSpacing() {
    return minReconnectSpacing;
  }

  /**
   * Returns how long a channel may stay in the connecting state.
   *
   * @return the connect timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  @Override
  public String toString() {
    return "ReconnectPolicy{healthCheckInterval=" + healthCheckInterval
        + ", maxAttempts=" + maxAttempts + ", backoff=" + backoff
        + ", backoffStrategy=" + backoffStrategy
        + ", minReconnectSpacing=" + minReconnectSpacing
        + ", connectTimeout=" + connectTimeout + "}";
  }
}
