package org.waabox.swipermonitor.notify;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.BoundedRetry;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryExhaustedException;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.metrics.MonitorMetrics;

/**
 * Sends notifications on a fixed-size worker pool, each with its own bounded
 * retry.
 *
 * <p>{@link #dispatch(NotificationPayload)} never blocks the caller and never
 * throws for a delivery failure: the returned future completes with
 * {@code true} once the payload was delivered and {@code false} once every
 * attempt failed. A delivered notification increments
 * {@code notifications_sent} by one whatever attempt succeeded; an
 * undelivered one increments {@code failed_notifications} by one.
 *
 * <p>Completion order across workers is unspecified.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationDispatcher implements AutoCloseable {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NotificationDispatcher.class);

  /** The default number of workers. */
  public static final int DEFAULT_WORKERS = 3;

  /** How long {@link #close()} waits for in-flight sends. */
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

  /** The transport, never null. */
  private final NotificationSender sender;

  /** The retry policy applied to each notification, never null. */
  private final RetryPolicy retryPolicy;

  /** The metrics counters, never null. */
  private final MonitorMetrics metrics;

  /** The worker pool, never null. */
  private final ExecutorService executor;

  /**
   * Creates a dispatcher with {@value #DEFAULT_WORKERS} workers.
   *
   * @param theSender      the transport, never null
   * @param theRetryPolicy the per-notification retry policy, never null
   * @param context        the monitor context, never null
   */
  public NotificationDispatcher(final NotificationSender theSender,
      final RetryPolicy theRetryPolicy, final MonitorContext context) {
    this(theSender, theRetryPolicy, DEFAULT_WORKERS, context);
  }

  /**
   * Creates a dispatcher.
   *
   * @param theSender      the transport, never null
   * @param theRetryPolicy the per-notification retry policy, never null
   * @param workers        the number of concurrent workers, greater than 0
   * @param context        the monitor context, never null
   */
  public NotificationDispatcher(final NotificationSender theSender,
      final RetryPolicy theRetryPolicy, final int workers,
      final MonitorContext context) {
    sender = Objects.requireNonNull(theSender, "sender cannot be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy cannot be null");
    metrics = Objects.requireNonNull(context, "context cannot be null")
        .metrics();
    if (workers <= 0) {
      throw new IllegalArgumentException(
          "workers must be greater than 0, got: " + workers);
    }

    final AtomicInteger threadCount = new AtomicInteger();
    executor = Executors.newFixedThreadPool(workers, r -> {
      final Thread thread = new Thread(r,
          "swiper-monitor-dispatch-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Submits a notification for delivery.
   *
   * <p>A payload submitted after {@link #shutdown(Duration)} is not sent:
   * it is counted as failed and the future completes with {@code false}.
   *
   * @param payload the notification, never null
   *
   * @return a future completed with the delivery outcome, never null
   */
  public CompletableFuture<Boolean> dispatch(
      final NotificationPayload payload) {
    Objects.requireNonNull(payload, "payload cannot be null");
    try {
      return CompletableFuture.supplyAsync(() -> send(payload), executor);
    } catch (final RejectedExecutionException e) {
      log.error("Dispatcher is shut down, dropping notification '{}'",
          payload.header());
      metrics.notificationFailed();
      return CompletableFuture.completedFuture(false);
    }
  }

  /**
   * Stops accepting notifications and waits for in-flight ones.
   *
   * <p>In-flight sends are not cancelled; each one runs until it succeeds or
   * exhausts its retry policy.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if every submitted notification finished in time
   */
  public boolean shutdown(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    executor.shutdown();
    try {
      final boolean drained = executor.awaitTermination(timeout.toMillis(),
          TimeUnit.MILLISECONDS);
      if (!drained) {
        log.warn("Notification dispatcher did not drain within {} ms",
            timeout.toMillis());
      }
      return drained;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while draining the notification dispatcher");
      return false;
    }
  }

  /**
   * Returns whether {@link #shutdown(Duration)} has been called.
   *
   * @return true once the dispatcher no longer accepts notifications
   */
  public boolean isShutdown() {
    return executor.isShutdown();
  }

  /** Shuts down, waiting at most 30 seconds for in-flight sends. */
  @Override
  public void close() {
    if (!executor.isTerminated()) {
      shutdown(CLOSE_TIMEOUT);
    }
  }

  /**
   * Delivers one notification with retry.
   *
   * @param payload the notification, never null
   *
   * @return true if delivered
   */
  private boolean send(final NotificationPayload payload) {
    try {
      BoundedRetry.execute(retryPolicy, "Notification send", () -> {
        sender.send(payload);
        return null;
      });
      metrics.notificationSent();
      log.info("Notification sent for '{}'",
          payload.fieldValue(NotificationFormatter.GAME));
      return true;
    } catch (final RetryExhaustedException e) {
      metrics.notificationFailed();
      final DispatchExhaustedException failure =
          new DispatchExhaustedException(payload.header(), e.attempts(),
              e.getCause());
      log.error(failure.getMessage(), failure);
      return false;
    }
  }
}
