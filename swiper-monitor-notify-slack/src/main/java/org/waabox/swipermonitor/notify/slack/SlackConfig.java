package org.waabox.swipermonitor.notify.slack;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the Slack notification transport.
 *
 * <p>Holds the bot token, the target channel, the Web API base URL and the
 * per-request timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SlackConfig {

  /** The default Slack Web API base URL. */
  public static final String DEFAULT_BASE_URL = "https://slack.com/api";

  /** The default request timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  /** The bot token sent as a Bearer credential. */
  private final String botToken;

  /** The channel id or name the messages are posted to. */
  private final String channel;

  /** The Web API base URL, without a trailing slash. */
  private final String baseUrl;

  /** The connect and request timeout. */
  private final Duration timeout;

  /** Private constructor; use the static factory methods instead. */
  private SlackConfig(final String botToken, final String channel,
      final String baseUrl, final Duration timeout) {
    this.botToken = requireText(botToken, "botToken");
    this.channel = requireText(channel, "channel");
    this.baseUrl = stripTrailingSlash(requireText(baseUrl, "baseUrl"));
    this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive, got: "
          + timeout);
    }
  }

  /**
   * Creates a new configuration using the default base URL
   * ({@value #DEFAULT_BASE_URL}) and a 10 second timeout.
   *
   * @param botToken the bot token, never null or blank
   * @param channel  the target channel, never null or blank
   * @return a new {@link SlackConfig} instance, never null
   */
  public static SlackConfig create(final String botToken,
      final String channel) {
    return new SlackConfig(botToken, channel, DEFAULT_BASE_URL,
        DEFAULT_TIMEOUT);
  }

  /**
   * Creates a new configuration.
   *
   * @param botToken the bot token, never null or blank
   * @param channel  the target channel, never null or blank
   * @param baseUrl  the Web API base URL, never null or blank
   * @param timeout  the request timeout, never null, positive
   * @return a new {@link SlackConfig} instance, never null
   */
  public static SlackConfig create(final String botToken,
      final String channel, final String baseUrl, final Duration timeout) {
    return new SlackConfig(botToken, channel, baseUrl, timeout);
  }

  /**
   * Returns the bot token.
   *
   * @return the token, never null
   */
  public String botToken() {
    return botToken;
  }

  /**
   * Returns the target channel.
   *
   * @return the channel, never null
   */
  public String channel() {
    return channel;
  }

  /**
   * Returns the Web API base URL.
   *
   * @return the base URL without trailing slash, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the request timeout.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the {@code chat.postMessage} endpoint.
   *
   * @return the endpoint URI, never null
   */
  public URI postMessageUri() {
    return URI.create(baseUrl + "/chat.postMessage");
  }

  /** Omits the bot token. */
  @Override
  public String toString() {
    return "SlackConfig[channel=" + channel + ", baseUrl=" + baseUrl
        + ", timeout=" + timeout + "]";
  }

  private static String requireText(final String value, final String name) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
    return value;
  }

  private static String stripTrailingSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
