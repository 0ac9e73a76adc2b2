package org.waabox.swipermonitor.metrics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The operational counters of a monitor instance.
 *
 * <p>Counters are updated from the coordinator thread (connections, health
 * checks) and from the dispatch workers (notifications), so every field is
 * atomic. A {@link #snapshot()} reads each counter once; it is not a
 * transactional view across counters.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MonitorMetrics {

  /** The clock used for check and capture times. */
  private final Clock clock;

  /** Notifications delivered. */
  private final AtomicLong notificationsSent = new AtomicLong();

  /** Notifications that exhausted every send attempt. */
  private final AtomicLong failedNotifications = new AtomicLong();

  /** Individual connection attempts. */
  private final AtomicLong connectionAttempts = new AtomicLong();

  /** Connection calls that exhausted every attempt. */
  private final AtomicLong connectionFailures = new AtomicLong();

  /** Time of the last passed health check, null until one passes. */
  private final AtomicReference<LocalDateTime> lastSuccessfulCheck =
      new AtomicReference<>();

  /**
   * Creates a new set of zeroed counters.
   *
   * @param theClock the clock for timestamps, never null
   */
  public MonitorMetrics(final Clock theClock) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** Records one delivered notification. */
  public void notificationSent() {
    notificationsSent.incrementAndGet();
  }

  /** Records one notification that exhausted its send attempts. */
  public void notificationFailed() {
    failedNotifications.incrementAndGet();
  }

  /** Records one connection attempt. */
  public void connectionAttempted() {
    connectionAttempts.incrementAndGet();
  }

  /** Records one connection call that exhausted its attempts. */
  public void connectionFailed() {
    connectionFailures.incrementAndGet();
  }

  /** Records a passed health check at the current clock time. */
  public void healthCheckSucceeded() {
    lastSuccessfulCheck.set(LocalDateTime.now(clock));
  }

  /**
   * Captures the current counter values.
   *
   * @return the snapshot, never null
   */
  public MetricsSnapshot snapshot() {
    return new MetricsSnapshot(
        notificationsSent.get(),
        failedNotifications.get(),
        connectionAttempts.get(),
        connectionFailures.get(),
        lastSuccessfulCheck.get(),
        LocalDateTime.now(clock));
  }

  /**
   * Writes a fresh snapshot to the given file, replacing its content.
   *
   * <p>The JSON is written to a sibling temporary file and then moved over
   * the target, so a reader never sees a half-written document.
   *
   * @param file the metrics file, never null
   *
   * @return the snapshot that was written, never null
   *
   * @throws UncheckedIOException if the file cannot be written
   */
  public MetricsSnapshot persist(final Path file) {
    Objects.requireNonNull(file, "file must not be null");

    final MetricsSnapshot snapshot = snapshot();
    final Path target = file.toAbsolutePath();
    final Path temp = target.resolveSibling(target.getFileName() + ".tmp");

    try {
      final Path parent = target.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(temp, MetricsSnapshotCodec.serialize(snapshot),
          StandardCharsets.UTF_8);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to save metrics to " + file, e);
    }
    return snapshot;
  }
}
