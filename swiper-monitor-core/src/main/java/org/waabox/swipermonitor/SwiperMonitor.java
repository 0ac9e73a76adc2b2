package org.waabox.swipermonitor;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.notify.NotificationDispatcher;
import org.waabox.swipermonitor.notify.NotificationFormatter;
import org.waabox.swipermonitor.store.ConnectionExhaustedException;
import org.waabox.swipermonitor.store.ConnectionManager;
import org.waabox.swipermonitor.store.EventFetcher;
import org.waabox.swipermonitor.store.HealthChecker;
import org.waabox.swipermonitor.store.OfflineEvent;

/**
 * The main entry point of the swiper monitor.
 *
 * <p>A SwiperMonitor polls the event store for offline events newer than
 * its {@link Watermark} and hands each one to the
 * {@link NotificationDispatcher}. Every cycle goes through the
 * {@link MonitorState states} health check, connect, fetch, dispatch,
 * persist and sleep; a failed health check or connection skips straight to
 * sleep. The loop runs until the {@link ShutdownSignal} of its
 * {@link MonitorContext} is triggered.
 *
 * <p>The watermark is owned by the coordinator thread. It advances to the
 * newest event of each batch as soon as the batch is submitted, whatever the
 * outcome of the sends: a failed notification is never retried by a later
 * poll.
 *
 * <p>Usage example:
 * <pre>{@code
 * MonitorContext context = MonitorContext.create();
 * ConnectionManager connections =
 *     new ConnectionManager(dataSource, RetryPolicy.defaultPolicy(), context);
 *
 * SwiperMonitor monitor = SwiperMonitor.builder()
 *     .context(context)
 *     .connectionManager(connections)
 *     .eventFetcher(new JdbcEventFetcher(query))
 *     .dispatcher(new NotificationDispatcher(sender,
 *         RetryPolicy.defaultPolicy(), context))
 *     .pollInterval(Duration.ofSeconds(60))
 *     .build();
 *
 * monitor.start();
 * // ... on shutdown
 * monitor.stop("SIGTERM");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SwiperMonitor {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SwiperMonitor.class);

  /** The shared counters, signal and clock. */
  private final MonitorContext context;

  /** Opens the connection used by each fetch. */
  private final ConnectionManager connectionManager;

  /** Validates connectivity before each cycle. */
  private final HealthChecker healthChecker;

  /** Reads the new events. */
  private final EventFetcher eventFetcher;

  /** Maps events to notifications. */
  private final NotificationFormatter formatter;

  /** Sends notifications asynchronously. */
  private final NotificationDispatcher dispatcher;

  /** The time to sleep between two cycles. */
  private final Duration pollInterval;

  /** The metrics file, overwritten on each persist. */
  private final Path metricsFile;

  /** The maximum time to wait for in-flight notifications on shutdown. */
  private final Duration drainTimeout;

  /** The current watermark, written by the coordinator thread only. */
  private volatile Watermark watermark;

  /** The current state. */
  private volatile MonitorState state = MonitorState.IDLE;

  /** Whether {@link #start()} has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether the shutdown sequence has run. */
  private final AtomicBoolean terminated = new AtomicBoolean(false);

  /** The coordinator thread, null until started. */
  private volatile Thread loopThread;

  /**
   * Creates a new monitor.
   *
   * @param builder the builder holding the resolved settings, never null
   */
  private SwiperMonitor(final Builder builder) {
    context = builder.context;
    connectionManager = builder.connectionManager;
    healthChecker = builder.healthChecker;
    eventFetcher = builder.eventFetcher;
    formatter = builder.formatter;
    dispatcher = builder.dispatcher;
    pollInterval = builder.pollInterval;
    metricsFile = builder.metricsFile;
    drainTimeout = builder.drainTimeout;
    watermark = Watermark.initial(context.clock(), builder.watermarkGrace);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the monitor.
   *
   * <p>Runs the startup health check on the calling thread. If it passes,
   * the poll loop is started on a new thread named
   * {@code swiper-monitor-loop} and this method returns.
   *
   * @throws StartupException      if the startup health check fails; the
   *                               final metrics are persisted and the loop
   *                               is never started
   * @throws IllegalStateException if the monitor was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("SwiperMonitor has already been started");
    }

    transition(MonitorState.HEALTH_CHECKING);
    if (!healthChecker.check()) {
      log.error("Initial health check failed. Please check configuration"
          + " and connectivity.");
      terminate();
      throw new StartupException("Initial health check against the event"
          + " store failed");
    }

    final Thread thread = new Thread(this::runLoop, "swiper-monitor-loop");
    thread.setDaemon(false);
    loopThread = thread;
    thread.start();
  }

  /**
   * Requests shutdown and waits until the loop has exited.
   *
   * <p>The loop finishes its current step, drains the dispatcher and
   * persists the final metrics. If the loop was never started, the
   * dispatcher is drained and the metrics persisted by this call.
   * Subsequent calls have no further effect.
   *
   * @param reason what requested the shutdown, never null
   */
  public void stop(final String reason) {
    context.shutdown().trigger(reason);

    final Thread thread = loopThread;
    if (thread == null) {
      terminate();
      return;
    }
    if (thread == Thread.currentThread()) {
      return;
    }
    try {
      thread.join();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the monitor loop to exit");
    }
  }

  /**
   * Runs the poll loop on the calling thread until the shutdown signal is
   * triggered, then runs the shutdown sequence.
   */
  public void runLoop() {
    log.info("Starting monitoring of embed swiper offline events...");
    try {
      while (!context.shutdown().isTriggered()) {
        runCycle();
        if (sleep()) {
          break;
        }
      }
    } finally {
      terminate();
    }
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public MonitorState state() {
    return state;
  }

  /**
   * Returns the current watermark.
   *
   * @return the watermark, never null
   */
  public Watermark watermark() {
    return watermark;
  }

  /**
   * Returns the context shared by this monitor's components.
   *
   * @return the context, never null
   */
  public MonitorContext context() {
    return context;
  }

  /**
   * Runs one poll cycle, from health check to metrics persistence.
   *
   * <p>Never throws: every failure is logged and ends the cycle early.
   */
  void runCycle() {
    try {
      transition(MonitorState.HEALTH_CHECKING);
      if (!healthChecker.check()) {
        log.error("Health check failed. Waiting before retry...");
        return;
      }
      if (context.shutdown().isTriggered()) {
        return;
      }

      transition(MonitorState.CONNECTING);
      final Connection connection = connectionManager.connect();
      try {
        transition(MonitorState.FETCHING);
        final List<OfflineEvent> events =
            eventFetcher.fetch(connection, watermark);

        if (!events.isEmpty()) {
          transition(MonitorState.DISPATCHING);
          for (final OfflineEvent event : events) {
            dispatcher.dispatch(formatter.format(event));
          }
          final Watermark previous = watermark;
          watermark = previous.advance(events);
          log.info("Submitted {} notification(s), watermark {} -> {}",
              events.size(), previous.value(), watermark.value());
        }
      } finally {
        close(connection);
      }

      transition(MonitorState.PERSISTING);
      persistMetrics();

    } catch (final ConnectionExhaustedException e) {
      log.warn("Skipping cycle: {}", e.getMessage());
    } catch (final RuntimeException e) {
      log.error("Error during monitoring loop: {}", e.getMessage(), e);
    }
  }

  /**
   * Closes the fetch connection, logging a failure instead of throwing.
   *
   * @param connection the connection to close, never null
   */
  private void close(final Connection connection) {
    try {
      connection.close();
    } catch (final SQLException e) {
      log.error("Failed to close the event store connection: {}",
          e.getMessage(), e);
    }
  }

  /**
   * Sleeps for the poll interval or until the shutdown signal.
   *
   * @return true if the shutdown signal was observed
   */
  private boolean sleep() {
    transition(MonitorState.SLEEPING);
    return context.shutdown().await(pollInterval);
  }

  /** Drains the dispatcher and persists the final metrics, once. */
  private void terminate() {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    transition(MonitorState.SHUTTING_DOWN);
    try {
      dispatcher.shutdown(drainTimeout);
    } finally {
      persistMetrics();
      transition(MonitorState.STOPPED);
      log.info("Monitor terminated ({}). Final metrics saved.",
          context.shutdown().reason().orElse("loop exited"));
    }
  }

  /** Writes the metrics file, logging a failure instead of throwing. */
  private void persistMetrics() {
    try {
      context.metrics().persist(metricsFile);
    } catch (final UncheckedIOException e) {
      log.error("Failed to save metrics: {}", e.getMessage(), e);
    }
  }

  /**
   * Moves to a new state.
   *
   * @param next the new state, never null
   */
  private void transition(final MonitorState next) {
    log.debug("Monitor state {} -> {}", state, next);
    state = next;
  }

  /**
   * A fluent builder for constructing {@link SwiperMonitor} instances.
   *
   * <p>The connection manager, event fetcher and dispatcher are required.
   * Defaults:
   * <ul>
   *   <li>context: {@link MonitorContext#create()}</li>
   *   <li>healthChecker: a {@link HealthChecker} over the connection
   *       manager</li>
   *   <li>formatter: {@link NotificationFormatter} with the default
   *       header</li>
   *   <li>pollInterval: 60 seconds</li>
   *   <li>metricsFile: {@code monitor_metrics.json}</li>
   *   <li>watermarkGrace: 1 minute</li>
   *   <li>drainTimeout: 30 seconds</li>
   * </ul>
   *
   * <p>The components must have been created with the same context given
   * to this builder, otherwise their counters are not the ones persisted.
   */
  public static final class Builder {

    /** The default poll interval. */
    private static final Duration DEFAULT_POLL_INTERVAL =
        Duration.ofSeconds(60);

    /** The default metrics file. */
    private static final Path DEFAULT_METRICS_FILE =
        Path.of("monitor_metrics.json");

    /** The default watermark grace window. */
    private static final Duration DEFAULT_WATERMARK_GRACE =
        Duration.ofMinutes(1);

    /** The default dispatcher drain timeout. */
    private static final Duration DEFAULT_DRAIN_TIMEOUT =
        Duration.ofSeconds(30);

    /** The optional context. */
    private MonitorContext context;

    /** The required connection manager. */
    private ConnectionManager connectionManager;

    /** The optional health checker. */
    private HealthChecker healthChecker;

    /** The required event fetcher. */
    private EventFetcher eventFetcher;

    /** The optional formatter. */
    private NotificationFormatter formatter;

    /** The required dispatcher. */
    private NotificationDispatcher dispatcher;

    /** The poll interval. */
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /** The metrics file. */
    private Path metricsFile = DEFAULT_METRICS_FILE;

    /** The watermark grace window. */
    private Duration watermarkGrace = DEFAULT_WATERMARK_GRACE;

    /** The dispatcher drain timeout. */
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the context shared by the monitor components.
     *
     * @param theContext the context, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder context(final MonitorContext theContext) {
      context = Objects.requireNonNull(theContext, "context must not be null");
      return this;
    }

    /**
     * Sets the connection manager used for the fetch connection and, unless
     * a health checker is set, for the health check.
     *
     * @param theConnectionManager the connection manager, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder connectionManager(
        final ConnectionManager theConnectionManager) {
      connectionManager = Objects.requireNonNull(theConnectionManager,
          "connectionManager must not be null");
      return this;
    }

    /**
     * Sets the health checker.
     *
     * @param theHealthChecker the health checker, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder healthChecker(final HealthChecker theHealthChecker) {
      healthChecker = Objects.requireNonNull(theHealthChecker,
          "healthChecker must not be null");
      return this;
    }

    /**
     * Sets the event fetcher.
     *
     * @param theEventFetcher the event fetcher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder eventFetcher(final EventFetcher theEventFetcher) {
      eventFetcher = Objects.requireNonNull(theEventFetcher,
          "eventFetcher must not be null");
      return this;
    }

    /**
     * Sets the notification formatter.
     *
     * @param theFormatter the formatter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder formatter(final NotificationFormatter theFormatter) {
      formatter = Objects.requireNonNull(theFormatter,
          "formatter must not be null");
      return this;
    }

    /**
     * Sets the notification dispatcher. The monitor drains it on shutdown.
     *
     * @param theDispatcher the dispatcher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder dispatcher(final NotificationDispatcher theDispatcher) {
      dispatcher = Objects.requireNonNull(theDispatcher,
          "dispatcher must not be null");
      return this;
    }

    /**
     * Sets the time to sleep between two cycles.
     *
     * @param thePollInterval the poll interval, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder pollInterval(final Duration thePollInterval) {
      pollInterval = requirePositive(thePollInterval, "pollInterval");
      return this;
    }

    /**
     * Sets the metrics file.
     *
     * @param theMetricsFile the file, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metricsFile(final Path theMetricsFile) {
      metricsFile = Objects.requireNonNull(theMetricsFile,
          "metricsFile must not be null");
      return this;
    }

    /**
     * Sets how far before startup the initial watermark is placed.
     *
     * @param theGrace the grace window, never null or negative
     *
     * @return this builder for chaining, never null
     */
    public Builder watermarkGrace(final Duration theGrace) {
      Objects.requireNonNull(theGrace, "watermarkGrace must not be null");
      if (theGrace.isNegative()) {
        throw new IllegalArgumentException(
            "watermarkGrace must not be negative");
      }
      watermarkGrace = theGrace;
      return this;
    }

    /**
     * Sets the maximum time to wait for in-flight notifications on shutdown.
     *
     * @param theDrainTimeout the timeout, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder drainTimeout(final Duration theDrainTimeout) {
      drainTimeout = requirePositive(theDrainTimeout, "drainTimeout");
      return this;
    }

    /**
     * Builds the monitor.
     *
     * @return a new monitor, never null
     *
     * @throws IllegalStateException if a required component is missing
     */
    public SwiperMonitor build() {
      if (connectionManager == null) {
        throw new IllegalStateException("connectionManager is required");
      }
      if (eventFetcher == null) {
        throw new IllegalStateException("eventFetcher is required");
      }
      if (dispatcher == null) {
        throw new IllegalStateException("dispatcher is required");
      }
      if (context == null) {
        context = MonitorContext.create();
      }
      if (healthChecker == null) {
        healthChecker = new HealthChecker(connectionManager, context);
      }
      if (formatter == null) {
        formatter = new NotificationFormatter();
      }
      return new SwiperMonitor(this);
    }

    /**
     * Validates a positive duration.
     *
     * @param value the duration
     * @param name  the setting name for the error message
     *
     * @return the duration, never null
     */
    private static Duration requirePositive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(name + " must be positive, got: "
            + value);
      }
      return value;
    }
  }
}
