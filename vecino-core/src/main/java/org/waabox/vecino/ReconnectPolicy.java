package org.waabox.vecino;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Defines how long a client waits before each reconnection attempt.
 *
 * <p>The delay grows exponentially with the attempt number, starting at
 * the base delay and capped at the maximum delay. A random jitter factor
 * in {@code [0.5, 1.5)} is applied so that many clients losing the same
 * server do not come back in lockstep; the jittered value is capped at
 * the maximum delay as well. There is no attempt limit: a client retries
 * for as long as it runs.
 *
 * <p>The default policy uses a 1-second base and a 5-second maximum.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReconnectPolicy {

  /** The default delay before the first reconnection attempt. */
  private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

  /** The default upper bound for any reconnection delay. */
  private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);

  /** Lower bound of the jitter factor, inclusive. */
  private static final double MIN_JITTER = 0.5;

  /** Upper bound of the jitter factor, exclusive. */
  private static final double MAX_JITTER = 1.5;

  /** The delay before the first attempt, never null. */
  private final Duration baseDelay;

  /** The maximum delay between attempts, never null. */
  private final Duration maxDelay;

  /**
   * Creates a new reconnect policy.
   *
   * @param baseDelay the first delay, never null
   * @param maxDelay  the delay cap, never null
   */
  private ReconnectPolicy(final Duration baseDelay, final Duration maxDelay) {
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
  }

  /**
   * Creates a reconnect policy with the given delays.
   *
   * @param baseDelay the delay before the first attempt, must be positive
   * @param maxDelay  the upper bound for any delay, must not be smaller
   *                  than the base delay
   * @return a new reconnect policy, never null
   *
   * @throws IllegalArgumentException if a delay is not positive or the
   *                                  maximum is below the base
   * @throws NullPointerException if any argument is null
   */
  public static ReconnectPolicy of(final Duration baseDelay,
      final Duration maxDelay) {
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    if (baseDelay.isZero() || baseDelay.isNegative()) {
      throw new IllegalArgumentException(
          "baseDelay must be positive, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    return new ReconnectPolicy(baseDelay, maxDelay);
  }

  /**
   * Creates a reconnect policy with the defaults: 1 second base delay and
   * 5 seconds maximum delay.
   *
   * @return the default reconnect policy, never null
   */
  public static ReconnectPolicy defaultPolicy() {
    return new ReconnectPolicy(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
  }

  /**
   * Computes the delay before the given reconnection attempt.
   *
   * @param attempt the 1-based attempt number since the last successful
   *                connection
   * @return the jittered delay, never null, never above the maximum
   *
   * @throws IllegalArgumentException if attempt is less than 1
   */
  public Duration delayFor(final int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException(
          "attempt must be >= 1, got: " + attempt);
    }
    final long max = maxDelay.toMillis();
    final int exponent = Math.min(attempt - 1, 30);
    final long exponential = Math.min(max, baseDelay.toMillis() << exponent);
    final double jitter = ThreadLocalRandom.current()
        .nextDouble(MIN_JITTER, MAX_JITTER);
    final long jittered = (long) (exponential * jitter);
    return Duration.ofMillis(Math.min(max, jittered));
  }

  /**
   * Returns the delay before the first attempt.
   *
   * @return the base delay, never null
   */
  public Duration baseDelay() {
    return baseDelay;
  }

  /**
   * Returns the upper bound for any delay.
   *
   * @return the maximum delay, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }
}
