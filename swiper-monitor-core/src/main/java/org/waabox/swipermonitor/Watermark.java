package org.waabox.swipermonitor;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Objects;

import org.waabox.swipermonitor.store.OfflineEvent;

/**
 * The boundary between already-reported and new offline events.
 *
 * <p>Events whose occurrence time is strictly after the watermark are new.
 * A watermark only moves forward: {@link #advance(Collection)} never
 * returns a watermark earlier than this one.
 *
 * <p>Instances are immutable. The monitor loop owns the current instance
 * and replaces it once per cycle from its coordinator thread.
 *
 * @param value the boundary timestamp, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Watermark(LocalDateTime value) {

  /**
   * Creates a new watermark.
   *
   * @param value the boundary timestamp, never null
   */
  public Watermark {
    Objects.requireNonNull(value, "value must not be null");
  }

  /**
   * Creates the startup watermark: the current time minus a grace window,
   * so events recorded just before the first poll are still reported.
   *
   * @param clock the clock to read the current time from, never null
   * @param grace the grace window, never null or negative
   *
   * @return the initial watermark, never null
   */
  public static Watermark initial(final Clock clock, final Duration grace) {
    Objects.requireNonNull(clock, "clock must not be null");
    Objects.requireNonNull(grace, "grace must not be null");
    if (grace.isNegative()) {
      throw new IllegalArgumentException(
          "grace must not be negative, got: " + grace);
    }
    return new Watermark(LocalDateTime.now(clock).minus(grace));
  }

  /**
   * Returns the watermark after observing a batch of events.
   *
   * <p>The result is the maximum of this watermark and every event
   * occurrence time in the batch.
   *
   * @param events the fetched events, never null, may be empty
   *
   * @return the advanced watermark, this instance if nothing is newer
   */
  public Watermark advance(final Collection<OfflineEvent> events) {
    Objects.requireNonNull(events, "events must not be null");
    LocalDateTime max = value;
    for (final OfflineEvent event : events) {
      if (event.occurredAt().isAfter(max)) {
        max = event.occurredAt();
      }
    }
    return max.equals(value) ? this : new Watermark(max);
  }
}
