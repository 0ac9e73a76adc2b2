package org.waabox.swipermonitor;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the bounded retry behavior shared by database connections and
 * notification sends.
 *
 * <p>Instances are created through static factory methods. The default
 * policy makes 3 attempts with a fixed 5-second delay between them.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default delay between attempts. */
  private static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

  /** The maximum number of attempts, including the first one. */
  private final int maxAttempts;

  /** The fixed duration to wait between two attempts. */
  private final Duration delay;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts the maximum number of attempts, greater than zero
   * @param delay       the duration to wait between attempts, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration delay) {
    this.maxAttempts = maxAttempts;
    this.delay = delay;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param delay       the fixed duration to wait between attempts,
   *                    never null or negative
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero, or delay is negative
   * @throws NullPointerException if delay is null
   */
  public static RetryPolicy of(final int maxAttempts, final Duration delay) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(delay, "delay must not be null");
    if (delay.isNegative()) {
      throw new IllegalArgumentException(
          "delay must not be negative, got: " + delay);
    }
    return new RetryPolicy(maxAttempts, delay);
  }

  /**
   * Creates a retry policy with the defaults: 3 attempts with a 5-second
   * delay.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the duration to wait between attempts.
   *
   * @return the delay, never null
   */
  public Duration delay() {
    return delay;
  }

  @Override
  public String toString() {
    return "RetryPolicy[maxAttempts=" + maxAttempts + ", delay=" + delay
        + "]";
  }
}
