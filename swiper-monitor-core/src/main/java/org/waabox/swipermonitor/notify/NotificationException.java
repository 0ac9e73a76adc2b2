package org.waabox.swipermonitor.notify;

import org.waabox.swipermonitor.SwiperMonitorException;

/**
 * Thrown by a {@link NotificationSender} when a single send attempt fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NotificationException extends SwiperMonitorException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NotificationException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public NotificationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
