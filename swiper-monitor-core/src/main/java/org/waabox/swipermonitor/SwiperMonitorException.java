package org.waabox.swipermonitor;

/**
 * Base exception for all swiper monitor errors.
 *
 * <p>This is an unchecked exception. Steady-state failures are resolved by
 * the component that owns the retry policy and never reach the monitor loop;
 * only startup failures propagate to the caller.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SwiperMonitorException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SwiperMonitorException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public SwiperMonitorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
