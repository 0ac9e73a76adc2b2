package org.waabox.swipermonitor.store;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.metrics.MetricsSnapshot;

/**
 * Tests for {@link ConnectionManager}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConnectionManagerTest {

  private static final RetryPolicy POLICY = RetryPolicy.of(3, Duration.ZERO);

  private MonitorContext context;

  private DataSource dataSource;

  @BeforeEach
  void setUp() {
    context = MonitorContext.create();
    dataSource = createMock(DataSource.class);
  }

  @Test
  void whenConnecting_givenAvailableStore_shouldCountOneAttempt()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    expect(dataSource.getConnection()).andReturn(connection);
    replay(dataSource, connection);

    final ConnectionManager manager =
        new ConnectionManager(dataSource, POLICY, context);

    assertSame(connection, manager.connect());

    final MetricsSnapshot snapshot = context.metrics().snapshot();
    assertEquals(1, snapshot.connectionAttempts());
    assertEquals(0, snapshot.connectionFailures());
    verify(dataSource);
  }

  @Test
  void whenConnecting_givenTransientFailure_shouldCountEveryAttempt()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    expect(dataSource.getConnection())
        .andThrow(new SQLException("login timeout"))
        .andReturn(connection);
    replay(dataSource, connection);

    final ConnectionManager manager =
        new ConnectionManager(dataSource, POLICY, context);

    assertSame(connection, manager.connect());

    final MetricsSnapshot snapshot = context.metrics().snapshot();
    assertEquals(2, snapshot.connectionAttempts());
    assertEquals(0, snapshot.connectionFailures());
    verify(dataSource);
  }

  @Test
  void whenConnecting_givenStoreDown_shouldThrowAfterMaxAttempts()
      throws Exception {
    final SQLException last = new SQLException("still down");
    expect(dataSource.getConnection())
        .andThrow(new SQLException("down")).times(2)
        .andThrow(last);
    replay(dataSource);

    final ConnectionManager manager =
        new ConnectionManager(dataSource, POLICY, context);

    final ConnectionExhaustedException e = assertThrows(
        ConnectionExhaustedException.class, manager::connect);

    assertEquals(3, e.attempts());
    assertSame(last, e.getCause());

    final MetricsSnapshot snapshot = context.metrics().snapshot();
    assertEquals(3, snapshot.connectionAttempts());
    assertEquals(1, snapshot.connectionFailures());
    verify(dataSource);
  }

  @Test
  void whenConnecting_givenDataSourceReturnsNull_shouldTreatAsFailure()
      throws Exception {
    expect(dataSource.getConnection()).andReturn(null).times(3);
    replay(dataSource);

    final ConnectionManager manager =
        new ConnectionManager(dataSource, POLICY, context);

    assertThrows(ConnectionExhaustedException.class, manager::connect);
    assertEquals(1, context.metrics().snapshot().connectionFailures());
    verify(dataSource);
  }
}
