package org.waabox.swipermonitor.notify;

import org.waabox.swipermonitor.RetryExhaustedException;

/**
 * Signals that a notification could not be delivered after every send
 * attempt.
 *
 * <p>It is logged and counted by {@link NotificationDispatcher}; it never
 * reaches the monitor loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DispatchExhaustedException extends RetryExhaustedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param header the header of the undelivered notification, cannot be null.
   * @param attempts the number of send attempts made.
   * @param cause the failure of the last attempt, cannot be null.
   */
  public DispatchExhaustedException(final String header, final int attempts,
      final Throwable cause) {
    super("Failed to send notification '" + header + "' after " + attempts
        + " attempts", attempts, cause);
  }
}
