package org.waabox.swipermonitor;

/**
 * Thrown by {@link SwiperMonitor#start()} when the event store cannot be
 * reached during startup.
 *
 * <p>The monitor loop is never entered against an unreachable store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StartupException extends SwiperMonitorException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public StartupException(final String message) {
    super(message);
  }
}
