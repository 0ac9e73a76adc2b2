package org.waabox.swipermonitor.app.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import org.waabox.swipermonitor.notify.NotificationFormatter;
import org.waabox.swipermonitor.notify.slack.SlackConfig;

/** Configuration properties for the swiper monitor.
 *
 * <p>Bound from the {@code swiper-monitor} prefix. A missing or blank
 * required value fails the context refresh before anything connects.
 *
 * <pre>
 * swiper-monitor:
 *   database:
 *     host: sql01
 *     port: 1433
 *     name: ecs7
 *     username: monitor
 *     password: secret
 *     tds-version: "8.0"
 *   slack:
 *     bot-token: xoxb-...
 *     channel: "#alerts"
 *   poll-interval: 60s
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Validated
@ConfigurationProperties(prefix = "swiper-monitor")
public class SwiperMonitorProperties {

  /** The event store connection settings. */
  @Valid
  private final Database database = new Database();

  /** The Slack channel settings. */
  @Valid
  private final Slack slack = new Slack();

  /** The retry settings shared by connections and sends. */
  @Valid
  private final Retry retry = new Retry();

  /** The dispatch pool settings. */
  @Valid
  private final Dispatch dispatch = new Dispatch();

  /** The time between two polls. */
  @NotNull
  private Duration pollInterval = Duration.ofSeconds(60);

  /** The metrics JSON file, overwritten on every persist. */
  @NotBlank
  private String metricsFile = "monitor_metrics.json";

  /** How far before startup the first poll looks back. */
  @NotNull
  private Duration watermarkGrace = Duration.ofMinutes(1);

  /** The header of every notification. */
  @NotBlank
  private String alertHeader = NotificationFormatter.DEFAULT_HEADER;

  public Database getDatabase() {
    return database;
  }

  public Slack getSlack() {
    return slack;
  }

  public Retry getRetry() {
    return retry;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(final Duration thePollInterval) {
    pollInterval = thePollInterval;
  }

  public String getMetricsFile() {
    return metricsFile;
  }

  public void setMetricsFile(final String theMetricsFile) {
    metricsFile = theMetricsFile;
  }

  public Duration getWatermarkGrace() {
    return watermarkGrace;
  }

  public void setWatermarkGrace(final Duration theWatermarkGrace) {
    watermarkGrace = theWatermarkGrace;
  }

  public String getAlertHeader() {
    return alertHeader;
  }

  public void setAlertHeader(final String theAlertHeader) {
    alertHeader = theAlertHeader;
  }

  /** Event store connection settings.
   *
   * <p>The JDBC URL is built for the jTDS driver from host, port, name and
   * TDS version unless {@code url} is set, in which case it is used as is.
   */
  public static class Database {

    /** The jTDS driver class. */
    public static final String JTDS_DRIVER = "net.sourceforge.jtds.jdbc.Driver";

    @NotBlank
    private String driver = JTDS_DRIVER;

    private String url;

    @NotBlank
    private String host;

    @Min(1)
    @Max(65535)
    private int port = 1433;

    @NotBlank
    private String name;

    @NotBlank
    private String username;

    @NotNull
    private String password;

    @NotBlank
    private String tdsVersion = "8.0";

    /** Returns the JDBC URL to connect with.
     *
     * @return the explicit url when set, otherwise
     *     {@code jdbc:jtds:sqlserver://host:port/name;tds=version}
     */
    public String jdbcUrl() {
      if (url != null && !url.isBlank()) {
        return url;
      }
      return "jdbc:jtds:sqlserver://" + host + ":" + port + "/" + name
          + ";tds=" + tdsVersion;
    }

    public String getDriver() {
      return driver;
    }

    public void setDriver(final String theDriver) {
      driver = theDriver;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(final String theUrl) {
      url = theUrl;
    }

    public String getHost() {
      return host;
    }

    public void setHost(final String theHost) {
      host = theHost;
    }

    public int getPort() {
      return port;
    }

    public void setPort(final int thePort) {
      port = thePort;
    }

    public String getName() {
      return name;
    }

    public void setName(final String theName) {
      name = theName;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(final String theUsername) {
      username = theUsername;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(final String thePassword) {
      password = thePassword;
    }

    public String getTdsVersion() {
      return tdsVersion;
    }

    public void setTdsVersion(final String theTdsVersion) {
      tdsVersion = theTdsVersion;
    }
  }

  /** Slack channel settings. */
  public static class Slack {

    @NotBlank
    private String botToken;

    @NotBlank
    private String channel;

    @NotBlank
    private String baseUrl = SlackConfig.DEFAULT_BASE_URL;

    @NotNull
    private Duration timeout = SlackConfig.DEFAULT_TIMEOUT;

    /** Creates the transport configuration.
     *
     * @return the Slack configuration, never null
     */
    public SlackConfig toSlackConfig() {
      return SlackConfig.create(botToken, channel, baseUrl, timeout);
    }

    public String getBotToken() {
      return botToken;
    }

    public void setBotToken(final String theBotToken) {
      botToken = theBotToken;
    }

    public String getChannel() {
      return channel;
    }

    public void setChannel(final String theChannel) {
      channel = theChannel;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(final Duration theTimeout) {
      timeout = theTimeout;
    }
  }

  /** Retry settings. */
  public static class Retry {

    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration delay = Duration.ofSeconds(5);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int theMaxAttempts) {
      maxAttempts = theMaxAttempts;
    }

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(final Duration theDelay) {
      delay = theDelay;
    }
  }

  /** Dispatch pool settings. */
  public static class Dispatch {

    @Min(1)
    private int workers = 3;

    public int getWorkers() {
      return workers;
    }

    public void setWorkers(final int theWorkers) {
      workers = theWorkers;
    }
  }
}
