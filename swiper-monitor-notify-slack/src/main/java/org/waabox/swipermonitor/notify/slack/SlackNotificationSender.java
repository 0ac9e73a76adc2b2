package org.waabox.swipermonitor.notify.slack;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.swipermonitor.notify.NotificationException;
import org.waabox.swipermonitor.notify.NotificationPayload;
import org.waabox.swipermonitor.notify.NotificationSender;

/**
 * A {@link NotificationSender} that posts to a Slack channel through the
 * Web API {@code chat.postMessage} method.
 *
 * <p>Each call is one synchronous HTTP request authenticated with the bot
 * token. A non-200 status, a response with {@code "ok": false}, an I/O
 * error or a timeout fail the attempt with a {@link NotificationException};
 * retrying is left to the dispatcher.
 *
 * <p>Thread safety: this class is thread-safe; the underlying
 * {@link HttpClient} is shared by all dispatch workers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SlackNotificationSender implements NotificationSender {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SlackNotificationSender.class);

  /** HTTP status code for OK. */
  private static final int HTTP_OK = 200;

  /** The Slack configuration. */
  private final SlackConfig config;

  /** The shared HTTP client. */
  private final HttpClient client;

  /**
   * Creates a new sender.
   *
   * @param config the Slack configuration, never null
   */
  public SlackNotificationSender(final SlackConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    client = HttpClient.newBuilder()
        .connectTimeout(config.timeout())
        .build();
  }

  @Override
  public void send(final NotificationPayload payload) {
    Objects.requireNonNull(payload, "payload cannot be null");

    final HttpRequest request = HttpRequest.newBuilder()
        .uri(config.postMessageUri())
        .timeout(config.timeout())
        .header("Authorization", "Bearer " + config.botToken())
        .header("Content-Type", "application/json; charset=utf-8")
        .POST(HttpRequest.BodyPublishers.ofString(
            SlackMessageCodec.serialize(config.channel(), payload),
            StandardCharsets.UTF_8))
        .build();

    final HttpResponse<String> response;
    try {
      response = client.send(request,
          HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new NotificationException("Slack request failed: "
          + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotificationException("Interrupted while posting to Slack",
          e);
    }

    if (response.statusCode() != HTTP_OK) {
      throw new NotificationException("Slack responded with status "
          + response.statusCode());
    }

    final Optional<String> error;
    try {
      error = SlackMessageCodec.readError(response.body());
    } catch (final IllegalArgumentException e) {
      throw new NotificationException(e.getMessage(), e);
    }
    if (error.isPresent()) {
      throw new NotificationException("Slack API error: " + error.get());
    }

    log.debug("Posted '{}' to Slack channel {}", payload.header(),
        config.channel());
  }
}
