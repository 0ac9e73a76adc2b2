package org.waabox.swipermonitor.app.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.swipermonitor.MonitorState;
import org.waabox.swipermonitor.StartupException;
import org.waabox.swipermonitor.SwiperMonitor;
import org.waabox.swipermonitor.notify.NotificationFormatter;
import org.waabox.swipermonitor.notify.NotificationSender;
import org.waabox.swipermonitor.store.EventQuery;

/** Tests for {@link SwiperMonitorConfiguration}.
 *
 * <p>Boots the full wiring against an H2 event store, replacing the ECS
 * query and the Slack transport with test beans.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SwiperMonitorConfigurationTest {

  /** Notifications received by the test transport. */
  static final List<String> SENT = new CopyOnWriteArrayList<>();

  @TempDir
  Path tempDir;

  private String url;

  @BeforeEach
  void setUp() throws SQLException {
    SENT.clear();
    url = "jdbc:h2:mem:app_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1";

    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(url);
    ds.setUser("sa");
    ds.setPassword("");
    try (Connection conn = ds.getConnection()) {
      try (Statement st = conn.createStatement()) {
        st.execute("CREATE TABLE swiper_log ("
            + " device_description VARCHAR(100) NOT NULL,"
            + " user_name VARCHAR(100) NOT NULL,"
            + " comment VARCHAR(4000) NOT NULL,"
            + " occurred_at TIMESTAMP NOT NULL,"
            + " days_offline INT NOT NULL)");
      }
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO swiper_log VALUES (?, ?, ?, ?, ?)")) {
        ps.setString(1, "Dragon Slots");
        ps.setString(2, "jdoe");
        ps.setString(3, "Swiper placed Offline");
        ps.setTimestamp(4, Timestamp.valueOf(LocalDateTime.now()));
        ps.setInt(5, 0);
        ps.executeUpdate();
      }
    }
  }

  @Test
  void whenContextRuns_givenNewEvent_shouldNotifyAndSaveMetricsOnClose() {
    final Path metricsFile = tempDir.resolve("monitor_metrics.json");

    runner(url, metricsFile).run(context -> {
      assertNotNull(context.getBean(SwiperMonitor.class));
      waitFor(() -> !SENT.isEmpty());
    });

    assertEquals(List.of("Dragon Slots"), SENT);
    assertTrue(Files.exists(metricsFile));
  }

  @Test
  void whenContextCloses_shouldStopMonitor() {
    final Path metricsFile = tempDir.resolve("monitor_metrics.json");
    final SwiperMonitor[] monitor = new SwiperMonitor[1];

    runner(url, metricsFile).run(context ->
        monitor[0] = context.getBean(SwiperMonitor.class));

    assertEquals(MonitorState.STOPPED, monitor[0].state());
    assertEquals("shutdown hook",
        monitor[0].context().shutdown().reason().orElse(null));
  }

  @Test
  void whenContextRuns_givenUnreachableStore_shouldFailStartup() {
    final String missing = "jdbc:h2:file:"
        + tempDir.resolve("missing").toAbsolutePath() + ";IFEXISTS=TRUE";

    runner(missing, tempDir.resolve("metrics.json")).run(context -> {
      assertNotNull(context.getStartupFailure());
      assertTrue(SwiperMonitorPropertiesTest.hasCause(
          context.getStartupFailure(), StartupException.class));
    });
  }

  private ApplicationContextRunner runner(final String jdbcUrl,
      final Path metricsFile) {
    return new ApplicationContextRunner()
        .withUserConfiguration(TestOverrides.class,
            SwiperMonitorConfiguration.class)
        .withPropertyValues(
            "swiper-monitor.database.driver=org.h2.Driver",
            "swiper-monitor.database.url=" + jdbcUrl,
            "swiper-monitor.database.host=localhost",
            "swiper-monitor.database.name=test",
            "swiper-monitor.database.username=sa",
            "swiper-monitor.database.password=",
            "swiper-monitor.slack.bot-token=xoxb-test",
            "swiper-monitor.slack.channel=#alerts",
            "swiper-monitor.poll-interval=50ms",
            "swiper-monitor.retry.max-attempts=2",
            "swiper-monitor.retry.delay=0ms",
            "swiper-monitor.dispatch.workers=1",
            "swiper-monitor.metrics-file=" + metricsFile.toAbsolutePath());
  }

  private static void waitFor(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.nanoTime() + 10_000_000_000L;
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10 seconds");
      }
      Thread.sleep(20);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class TestOverrides {

    @Bean
    EventQuery testEventQuery() {
      return () -> "SELECT device_description, user_name, comment,"
          + " occurred_at, days_offline FROM ("
          + "   SELECT l.*, ROW_NUMBER() OVER ("
          + "     PARTITION BY device_description"
          + "     ORDER BY occurred_at DESC) rn"
          + "   FROM swiper_log l) ranked"
          + " WHERE rn = 1 AND occurred_at > ?"
          + " ORDER BY device_description";
    }

    @Bean
    NotificationSender testNotificationSender() {
      return payload -> SENT.add(
          payload.fieldValue(NotificationFormatter.GAME));
    }
  }
}
