package org.waabox.swipermonitor.store;

/**
 * The SQL contract between the monitor and the event store.
 *
 * <p>The statement takes exactly one parameter, the watermark timestamp,
 * and must return the columns {@code device_description},
 * {@code user_name}, {@code comment}, {@code occurred_at} and
 * {@code days_offline}.
 *
 * <p>Implementations must keep only the newest offline entry per device
 * (rank by event time descending, keep rank 1) before applying the
 * {@code occurred_at > ?} filter, and must order the result by
 * {@code device_description}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface EventQuery {

  /**
   * Returns the SQL statement to execute.
   *
   * @return the SQL, with a single {@code ?} placeholder, never null
   */
  String sql();
}
