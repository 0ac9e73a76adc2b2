package org.waabox.swipermonitor.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.metrics.MonitorMetrics;

/**
 * Validates event store connectivity with a trivial round-trip query.
 *
 * <p>Each check opens its own connection through the
 * {@link ConnectionManager}, runs {@value #VALIDATION_QUERY}, and closes the
 * connection before returning. Failures are logged and reported as
 * {@code false}; they never propagate.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HealthChecker {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HealthChecker.class);

  /** The round-trip query. */
  static final String VALIDATION_QUERY = "SELECT 1";

  /** The connection manager, never null. */
  private final ConnectionManager connectionManager;

  /** The metrics counters, never null. */
  private final MonitorMetrics metrics;

  /**
   * Creates a new health checker.
   *
   * @param theConnectionManager the connection manager, never null
   * @param context              the monitor context, never null
   */
  public HealthChecker(final ConnectionManager theConnectionManager,
      final MonitorContext context) {
    connectionManager = Objects.requireNonNull(theConnectionManager,
        "connectionManager cannot be null");
    metrics = Objects.requireNonNull(context, "context cannot be null")
        .metrics();
  }

  /**
   * Runs the health check.
   *
   * <p>On success, records the check time in the metrics.
   *
   * @return true if the store answered the validation query
   */
  public boolean check() {
    try (Connection conn = connectionManager.connect();
         Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(VALIDATION_QUERY)) {

      if (!rs.next()) {
        log.error("Health check failed: validation query returned no row");
        return false;
      }
      metrics.healthCheckSucceeded();
      return true;

    } catch (final ConnectionExhaustedException e) {
      log.error("Health check failed: {}", e.getMessage());
      return false;
    } catch (final SQLException | RuntimeException e) {
      log.error("Health check failed: {}", e.getMessage(), e);
      return false;
    }
  }
}
