package org.waabox.swipermonitor.store;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One "swiper placed offline" occurrence read from the event store.
 *
 * <p>An event has no identity beyond its occurrence time; the watermark
 * alone decides whether it was already reported.
 *
 * @param deviceDescription the description of the game swiper, never null
 * @param userName          the user who placed the swiper offline, never null
 * @param comment           the free-text log comment, never null
 * @param occurredAt        when the event was logged, never null
 * @param daysOffline       whole days between the event and the query time
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OfflineEvent(
    String deviceDescription,
    String userName,
    String comment,
    LocalDateTime occurredAt,
    int daysOffline
) {

  /**
   * Creates a new event.
   *
   * @throws NullPointerException if any reference component is null
   */
  public OfflineEvent {
    Objects.requireNonNull(deviceDescription,
        "deviceDescription must not be null");
    Objects.requireNonNull(userName, "userName must not be null");
    Objects.requireNonNull(comment, "comment must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
  }
}
