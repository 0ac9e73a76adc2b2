package org.waabox.swipermonitor.store;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.metrics.MetricsSnapshot;

/**
 * Tests for {@link HealthChecker}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HealthCheckerTest {

  private static final Clock CLOCK = Clock.fixed(
      Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

  private static final RetryPolicy POLICY = RetryPolicy.of(2, Duration.ZERO);

  @Test
  void whenChecking_givenReachableStore_shouldRecordSuccessfulCheck() {
    final MonitorContext context = MonitorContext.create(CLOCK);
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:health_" + System.nanoTime());
    ds.setUser("sa");
    ds.setPassword("");

    final HealthChecker checker = new HealthChecker(
        new ConnectionManager(ds, POLICY, context), context);

    assertTrue(checker.check());

    final MetricsSnapshot snapshot = context.metrics().snapshot();
    assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0),
        snapshot.lastSuccessfulCheck());
    assertEquals(1, snapshot.connectionAttempts());
  }

  @Test
  void whenChecking_givenUnreachableStore_shouldReturnFalse()
      throws Exception {
    final MonitorContext context = MonitorContext.create(CLOCK);
    final DataSource ds = createMock(DataSource.class);
    expect(ds.getConnection()).andThrow(new SQLException("down")).times(2);
    replay(ds);

    final HealthChecker checker = new HealthChecker(
        new ConnectionManager(ds, POLICY, context), context);

    assertFalse(checker.check());

    final MetricsSnapshot snapshot = context.metrics().snapshot();
    assertTrue(snapshot.lastSuccessfulCheckTime().isEmpty());
    assertEquals(2, snapshot.connectionAttempts());
    assertEquals(1, snapshot.connectionFailures());
  }
}
