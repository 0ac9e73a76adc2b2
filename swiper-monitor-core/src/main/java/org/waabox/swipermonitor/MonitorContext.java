package org.waabox.swipermonitor;

import java.time.Clock;
import java.util.Objects;

import org.waabox.swipermonitor.metrics.MonitorMetrics;

/**
 * The state shared by every monitor component: the metrics counters, the
 * shutdown signal, and the clock used for timestamps.
 *
 * <p>One context is created per monitor instance and handed to each
 * component at construction time, so several monitors can live in the same
 * process and each component can be tested in isolation.
 *
 * @param metrics  the metrics counters, never null
 * @param shutdown the shutdown signal, never null
 * @param clock    the clock for "now", never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MonitorContext(MonitorMetrics metrics, ShutdownSignal shutdown,
    Clock clock) {

  /**
   * Creates a new context.
   *
   * @param metrics  the metrics counters, never null
   * @param shutdown the shutdown signal, never null
   * @param clock    the clock for "now", never null
   */
  public MonitorContext {
    Objects.requireNonNull(metrics, "metrics must not be null");
    Objects.requireNonNull(shutdown, "shutdown must not be null");
    Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Creates a context with fresh counters, an untriggered signal and the
   * system default clock.
   *
   * @return a new context, never null
   */
  public static MonitorContext create() {
    return create(Clock.systemDefaultZone());
  }

  /**
   * Creates a context with fresh counters and an untriggered signal.
   *
   * @param clock the clock for "now", never null
   *
   * @return a new context, never null
   */
  public static MonitorContext create(final Clock clock) {
    return new MonitorContext(new MonitorMetrics(clock), new ShutdownSignal(),
        clock);
  }
}
