package org.waabox.swipermonitor.metrics;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A point-in-time copy of the monitor counters.
 *
 * @param notificationsSent      notifications delivered to the sink
 * @param failedNotifications    notifications that exhausted every attempt
 * @param connectionAttempts     individual event store connection attempts
 * @param connectionFailures     connection calls that exhausted every attempt
 * @param lastSuccessfulCheck    time of the last passed health check, null
 *                               if none passed yet
 * @param capturedAt             when this snapshot was taken, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MetricsSnapshot(
    long notificationsSent,
    long failedNotifications,
    long connectionAttempts,
    long connectionFailures,
    LocalDateTime lastSuccessfulCheck,
    LocalDateTime capturedAt
) {

  /**
   * Creates a new snapshot.
   *
   * @throws NullPointerException if capturedAt is null
   */
  public MetricsSnapshot {
    Objects.requireNonNull(capturedAt, "capturedAt must not be null");
  }

  /**
   * Returns the time of the last passed health check.
   *
   * @return the time, empty if no health check has passed yet
   */
  public Optional<LocalDateTime> lastSuccessfulCheckTime() {
    return Optional.ofNullable(lastSuccessfulCheck);
  }
}
