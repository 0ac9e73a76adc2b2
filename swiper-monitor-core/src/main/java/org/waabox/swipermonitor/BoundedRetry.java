package org.waabox.swipermonitor;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to {@link RetryPolicy#maxAttempts()} times, sleeping
 * {@link RetryPolicy#delay()} between two consecutive attempts.
 *
 * <p>This is the only retry primitive of the monitor. Both the database
 * connection and the notification send go through it, so their attempt
 * counting and delay behavior is identical.
 *
 * <p>A retry loop is not cancelled by the shutdown signal; it runs to
 * success or exhaustion. Interrupting the calling thread while it sleeps
 * aborts the loop with a {@link RetryExhaustedException} and restores the
 * interrupt status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BoundedRetry {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

  /** Private constructor to prevent instantiation. */
  private BoundedRetry() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * A single attempt of a retried operation.
   *
   * @param <T> the type of the attempt result
   */
  @FunctionalInterface
  public interface Attempt<T> {

    /**
     * Runs the attempt.
     *
     * @return the attempt result, may be null
     *
     * @throws Exception if the attempt failed and should be retried
     */
    T run() throws Exception;
  }

  /**
   * Executes the given attempt under the given policy.
   *
   * @param <T>       the type of the result
   * @param policy    the retry policy, never null
   * @param operation a short description used in log messages, never null
   * @param attempt   the attempt to run, never null
   *
   * @return the result of the first successful attempt, may be null
   *
   * @throws RetryExhaustedException if every attempt failed, or the thread
   *                                 was interrupted while waiting
   */
  public static <T> T execute(final RetryPolicy policy,
      final String operation, final Attempt<T> attempt) {
    Objects.requireNonNull(policy, "policy must not be null");
    Objects.requireNonNull(operation, "operation must not be null");
    Objects.requireNonNull(attempt, "attempt must not be null");

    final int maxAttempts = policy.maxAttempts();

    Exception lastFailure = null;
    for (int current = 1; current <= maxAttempts; current++) {
      try {
        return attempt.run();
      } catch (final Exception e) {
        lastFailure = e;
        if (current < maxAttempts) {
          log.warn("{} attempt {}/{} failed: {}. Retrying in {} ms",
              operation, current, maxAttempts, e.getMessage(),
              policy.delay().toMillis());
          if (!sleep(policy)) {
            throw new RetryExhaustedException(operation
                + " interrupted after " + current + " attempt(s)",
                current, e);
          }
        }
      }
    }

    throw new RetryExhaustedException(operation + " failed after "
        + maxAttempts + " attempts", maxAttempts, lastFailure);
  }

  /**
   * Sleeps for the policy delay.
   *
   * @param policy the retry policy, never null
   *
   * @return false if the thread was interrupted while sleeping
   */
  private static boolean sleep(final RetryPolicy policy) {
    if (policy.delay().isZero()) {
      return true;
    }
    try {
      Thread.sleep(policy.delay().toMillis());
      return true;
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
