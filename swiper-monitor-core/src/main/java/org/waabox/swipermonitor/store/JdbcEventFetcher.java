package org.waabox.swipermonitor.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.Watermark;

/**
 * An {@link EventFetcher} that runs an {@link EventQuery} through plain
 * JDBC.
 *
 * <p>The watermark is bound as a {@link Timestamp}; each row is mapped to an
 * {@link OfflineEvent} in the order returned by the query. A NULL text
 * column is rendered as {@value #MISSING_VALUE} so the event is still
 * notified; a row without {@code occurred_at} cannot be placed against the
 * watermark and is skipped with a warning. Neither case affects the other
 * rows of the batch.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcEventFetcher implements EventFetcher {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcEventFetcher.class);

  /** Text used for a NULL text column. */
  static final String MISSING_VALUE = "None";

  /** The query to run, never null. */
  private final EventQuery query;

  /**
   * Creates a new fetcher.
   *
   * @param theQuery the query contract implementation, never null
   */
  public JdbcEventFetcher(final EventQuery theQuery) {
    query = Objects.requireNonNull(theQuery, "query cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public List<OfflineEvent> fetch(final Connection connection,
      final Watermark watermark) {
    Objects.requireNonNull(connection, "connection cannot be null");
    Objects.requireNonNull(watermark, "watermark cannot be null");

    try (PreparedStatement ps = connection.prepareStatement(query.sql())) {

      ps.setTimestamp(1, Timestamp.valueOf(watermark.value()));

      try (ResultSet rs = ps.executeQuery()) {
        final List<OfflineEvent> events = new ArrayList<>();
        while (rs.next()) {
          final OfflineEvent event = map(rs);
          if (event != null) {
            events.add(event);
          }
        }
        log.debug("Fetched {} offline event(s) after {}", events.size(),
            watermark.value());
        return events;
      }

    } catch (final SQLException e) {
      log.error("Error executing offline event query: {}", e.getMessage(), e);
      return Collections.emptyList();
    }
  }

  /**
   * Maps the current row.
   *
   * @param rs the result set positioned on a row, never null
   *
   * @return the event, or null if the row has no {@code occurred_at}
   *
   * @throws SQLException if a column cannot be read
   */
  private OfflineEvent map(final ResultSet rs) throws SQLException {
    final String device = text(rs, "device_description");
    final Timestamp occurredAt = rs.getTimestamp("occurred_at");
    if (occurredAt == null) {
      log.warn("Skipping offline event for '{}': occurred_at is NULL",
          device);
      return null;
    }
    return new OfflineEvent(
        device,
        text(rs, "user_name"),
        text(rs, "comment"),
        occurredAt.toLocalDateTime(),
        rs.getInt("days_offline"));
  }

  /**
   * Reads a text column of the current row.
   *
   * @param rs     the result set positioned on a row, never null
   * @param column the column label, never null
   *
   * @return the value, or {@value #MISSING_VALUE} if the column is NULL
   *
   * @throws SQLException if the column cannot be read
   */
  private static String text(final ResultSet rs, final String column)
      throws SQLException {
    final String value = rs.getString(column);
    if (value == null) {
      log.warn("Offline event column '{}' is NULL, using '{}'", column,
          MISSING_VALUE);
      return MISSING_VALUE;
    }
    return value;
  }
}
