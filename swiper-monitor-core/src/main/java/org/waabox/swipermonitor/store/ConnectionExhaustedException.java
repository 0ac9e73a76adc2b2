package org.waabox.swipermonitor.store;

import org.waabox.swipermonitor.RetryExhaustedException;

/**
 * Thrown by {@link ConnectionManager#connect()} when every connection
 * attempt to the event store failed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionExhaustedException
    extends RetryExhaustedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param attempts the number of connection attempts made.
   * @param cause the failure of the last attempt, cannot be null.
   */
  public ConnectionExhaustedException(final int attempts,
      final Throwable cause) {
    super("Failed to connect to the event store after " + attempts
        + " attempts", attempts, cause);
  }
}
