package org.waabox.swipermonitor.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.BoundedRetry;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryExhaustedException;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.metrics.MonitorMetrics;

/**
 * Opens connections to the event store with bounded retry.
 *
 * <p>Every attempt increments the connection attempt counter; a call that
 * exhausts its attempts increments the connection failure counter once and
 * throws {@link ConnectionExhaustedException}. Calls are independent of
 * each other.
 *
 * <p>The returned connection belongs to the caller, who must close it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionManager {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ConnectionManager.class);

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The retry policy for connection attempts, never null. */
  private final RetryPolicy retryPolicy;

  /** The metrics counters, never null. */
  private final MonitorMetrics metrics;

  /**
   * Creates a new connection manager.
   *
   * @param theDataSource  the data source to open connections from,
   *                       never null
   * @param theRetryPolicy the retry policy, never null
   * @param context        the monitor context, never null
   */
  public ConnectionManager(final DataSource theDataSource,
      final RetryPolicy theRetryPolicy, final MonitorContext context) {
    dataSource = Objects.requireNonNull(theDataSource,
        "dataSource cannot be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy cannot be null");
    metrics = Objects.requireNonNull(context, "context cannot be null")
        .metrics();
  }

  /**
   * Opens a connection.
   *
   * @return an open connection, never null
   *
   * @throws ConnectionExhaustedException if every attempt failed
   */
  public Connection connect() {
    try {
      final Connection connection = BoundedRetry.execute(retryPolicy,
          "Database connection", this::attempt);
      log.info("Connected to the database successfully.");
      return connection;
    } catch (final RetryExhaustedException e) {
      metrics.connectionFailed();
      log.error("Failed to connect after {} attempts: {}", e.attempts(),
          e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
      throw new ConnectionExhaustedException(e.attempts(), e.getCause());
    }
  }

  /**
   * Makes a single connection attempt.
   *
   * @return the connection, never null
   *
   * @throws SQLException if the data source fails or returns no connection
   */
  private Connection attempt() throws SQLException {
    metrics.connectionAttempted();
    final Connection connection = dataSource.getConnection();
    if (connection == null) {
      throw new SQLException("DataSource returned no connection");
    }
    return connection;
  }
}
