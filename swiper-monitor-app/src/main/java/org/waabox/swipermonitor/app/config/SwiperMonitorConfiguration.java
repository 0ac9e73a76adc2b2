package org.waabox.swipermonitor.app.config;

import java.nio.file.Path;
import java.sql.Driver;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.util.ClassUtils;

import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.SwiperMonitor;
import org.waabox.swipermonitor.app.store.EcsOfflineEventQuery;
import org.waabox.swipermonitor.notify.NotificationDispatcher;
import org.waabox.swipermonitor.notify.NotificationFormatter;
import org.waabox.swipermonitor.notify.NotificationSender;
import org.waabox.swipermonitor.notify.slack.SlackNotificationSender;
import org.waabox.swipermonitor.store.ConnectionManager;
import org.waabox.swipermonitor.store.EventQuery;
import org.waabox.swipermonitor.store.JdbcEventFetcher;

/** Wires the {@link SwiperMonitor} from {@link SwiperMonitorProperties} and
 * ties its lifecycle to the Spring context.
 *
 * <p>The monitor starts once the context is refreshed and is stopped, with
 * the reason {@code shutdown hook}, when the context closes (SIGTERM and
 * SIGINT close it through Spring Boot's shutdown hook).
 *
 * <p>An {@link EventQuery} or {@link NotificationSender} bean defined
 * elsewhere replaces the ECS query or the Slack transport.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(SwiperMonitorProperties.class)
public class SwiperMonitorConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SwiperMonitorConfiguration.class);

  /** The reason recorded when the context closes the monitor. */
  static final String SHUTDOWN_REASON = "shutdown hook";

  @Bean
  MonitorContext monitorContext() {
    return MonitorContext.create();
  }

  @Bean
  RetryPolicy monitorRetryPolicy(final SwiperMonitorProperties properties) {
    return RetryPolicy.of(properties.getRetry().getMaxAttempts(),
        properties.getRetry().getDelay());
  }

  /** Creates the event store data source; every call opens a fresh
   * connection.
   *
   * @param properties the monitor properties, never null
   *
   * @return the data source, never null
   */
  @Bean
  DataSource swiperDataSource(final SwiperMonitorProperties properties) {
    final SwiperMonitorProperties.Database database =
        properties.getDatabase();

    final Class<?> driverClass;
    try {
      driverClass = ClassUtils.forName(database.getDriver(),
          ClassUtils.getDefaultClassLoader());
    } catch (final ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found: "
          + database.getDriver(), e);
    }
    final Driver driver = BeanUtils.instantiateClass(driverClass,
        Driver.class);

    log.info("Event store at {} using {}", database.jdbcUrl(),
        driverClass.getSimpleName());

    return new SimpleDriverDataSource(driver, database.jdbcUrl(),
        database.getUsername(), database.getPassword());
  }

  @Bean
  ConnectionManager connectionManager(final DataSource swiperDataSource,
      final RetryPolicy monitorRetryPolicy, final MonitorContext context) {
    return new ConnectionManager(swiperDataSource, monitorRetryPolicy,
        context);
  }

  /** Creates the dispatcher; the monitor drains it when it stops.
   *
   * @param properties         the monitor properties, never null
   * @param senderProvider     an optional replacement transport
   * @param monitorRetryPolicy the per-notification retry policy
   * @param context            the monitor context
   *
   * @return the dispatcher, never null
   */
  @Bean
  NotificationDispatcher notificationDispatcher(
      final SwiperMonitorProperties properties,
      final ObjectProvider<NotificationSender> senderProvider,
      final RetryPolicy monitorRetryPolicy, final MonitorContext context) {

    final NotificationSender sender = senderProvider.getIfAvailable(() ->
        new SlackNotificationSender(properties.getSlack().toSlackConfig()));
    log.info("Notifications go through {} with {} worker(s)",
        sender.getClass().getSimpleName(),
        properties.getDispatch().getWorkers());

    return new NotificationDispatcher(sender, monitorRetryPolicy,
        properties.getDispatch().getWorkers(), context);
  }

  @Bean
  SwiperMonitor swiperMonitor(final SwiperMonitorProperties properties,
      final MonitorContext context,
      final ConnectionManager connectionManager,
      final NotificationDispatcher notificationDispatcher,
      final ObjectProvider<EventQuery> queryProvider) {

    final EventQuery query =
        queryProvider.getIfAvailable(EcsOfflineEventQuery::new);

    return SwiperMonitor.builder()
        .context(context)
        .connectionManager(connectionManager)
        .eventFetcher(new JdbcEventFetcher(query))
        .formatter(new NotificationFormatter(properties.getAlertHeader()))
        .dispatcher(notificationDispatcher)
        .pollInterval(properties.getPollInterval())
        .metricsFile(Path.of(properties.getMetricsFile()))
        .watermarkGrace(properties.getWatermarkGrace())
        .build();
  }

  @Bean
  SmartLifecycle swiperMonitorLifecycle(final SwiperMonitor monitor) {
    return new SmartLifecycle() {

      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting swiper monitor lifecycle...");
        monitor.start();
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping swiper monitor lifecycle...");
        monitor.stop(SHUTDOWN_REASON);
        running = false;
        log.info("Swiper monitor lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
