package org.waabox.swipermonitor.notify;

/**
 * The transport that delivers a notification to its channel.
 *
 * <p>A call represents one attempt; retries are the responsibility of the
 * {@link NotificationDispatcher}. Implementations are invoked concurrently
 * from the dispatch workers and must be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface NotificationSender {

  /**
   * Sends a notification once.
   *
   * @param payload the notification to deliver, never null
   *
   * @throws NotificationException if the channel rejected the notification
   *                               or could not be reached
   */
  void send(NotificationPayload payload);
}
