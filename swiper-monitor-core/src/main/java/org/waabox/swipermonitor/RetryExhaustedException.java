package org.waabox.swipermonitor;

/**
 * Thrown by {@link BoundedRetry} when every attempt allowed by a
 * {@link RetryPolicy} has failed.
 *
 * <p>The cause is the failure of the last attempt.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RetryExhaustedException extends SwiperMonitorException {

  private static final long serialVersionUID = 1L;

  /** The number of attempts that were made. */
  private final int attempts;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param theAttempts the number of attempts made.
   * @param cause the failure of the last attempt, cannot be null.
   */
  public RetryExhaustedException(final String message, final int theAttempts,
      final Throwable cause) {
    super(message, cause);
    attempts = theAttempts;
  }

  /** Returns the number of attempts that were made before giving up.
   *
   * @return the attempt count, at least 1.
   */
  public int attempts() {
    return attempts;
  }
}
