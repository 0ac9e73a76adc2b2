package org.waabox.swipermonitor.notify.slack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.swipermonitor.MonitorContext;
import org.waabox.swipermonitor.RetryPolicy;
import org.waabox.swipermonitor.notify.NotificationDispatcher;
import org.waabox.swipermonitor.notify.NotificationException;
import org.waabox.swipermonitor.notify.NotificationFormatter;
import org.waabox.swipermonitor.notify.NotificationPayload;
import org.waabox.swipermonitor.store.OfflineEvent;

/**
 * Integration tests for {@link SlackNotificationSender}.
 *
 * <p>Starts a JDK HTTP server on an ephemeral port that plays the Slack
 * Web API.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SlackNotificationSenderTest {

  private static final NotificationPayload PAYLOAD =
      new NotificationFormatter().format(new OfflineEvent("Dragon Slots",
          "jdoe", "Swiper placed Offline", LocalDateTime.of(2024, 3, 1,
              9, 5, 7), 4));

  private HttpServer server;

  private final AtomicReference<String> authorization =
      new AtomicReference<>();

  private final AtomicReference<String> body = new AtomicReference<>();

  private final AtomicInteger requests = new AtomicInteger();

  /** The status and body the fake API answers with, per request number. */
  private volatile Responder responder;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/api/chat.postMessage", this::handle);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void whenSending_givenOkResponse_shouldPostBlocksWithBearerToken() {
    responder = n -> new Reply(200, "{\"ok\":true}");

    sender().send(PAYLOAD);

    assertEquals(1, requests.get());
    assertEquals("Bearer xoxb-test", authorization.get());
    assertTrue(body.get().contains("\"channel\":\"#alerts\""));
    assertTrue(body.get().contains("*Game:*\\nDragon Slots"));
  }

  @Test
  void whenSending_givenSlackError_shouldFailAttempt() {
    responder = n -> new Reply(200,
        "{\"ok\":false,\"error\":\"not_in_channel\"}");

    final NotificationException e = assertThrows(
        NotificationException.class, () -> sender().send(PAYLOAD));

    assertTrue(e.getMessage().contains("not_in_channel"));
  }

  @Test
  void whenSending_givenServerError_shouldFailAttempt() {
    responder = n -> new Reply(500, "oops");

    final NotificationException e = assertThrows(
        NotificationException.class, () -> sender().send(PAYLOAD));

    assertTrue(e.getMessage().contains("500"));
  }

  @Test
  void whenSending_givenUnreachableApi_shouldFailAttempt() {
    final int port = server.getAddress().getPort();
    server.stop(0);

    final SlackNotificationSender unreachable = new SlackNotificationSender(
        SlackConfig.create("xoxb-test", "#alerts",
            "http://localhost:" + port + "/api", Duration.ofSeconds(2)));

    assertThrows(NotificationException.class, () ->
        unreachable.send(PAYLOAD));
  }

  @Test
  void whenDispatching_givenRateLimitedOnce_shouldDeliverOnRetry()
      throws Exception {
    responder = n -> n == 1
        ? new Reply(200, "{\"ok\":false,\"error\":\"ratelimited\"}")
        : new Reply(200, "{\"ok\":true}");

    final MonitorContext context = MonitorContext.create();
    try (NotificationDispatcher dispatcher = new NotificationDispatcher(
        sender(), RetryPolicy.of(3, Duration.ofMillis(10)), context)) {

      assertTrue(dispatcher.dispatch(PAYLOAD).get(10, TimeUnit.SECONDS));
    }

    assertEquals(2, requests.get());
    assertEquals(1, context.metrics().snapshot().notificationsSent());
  }

  private SlackNotificationSender sender() {
    return new SlackNotificationSender(SlackConfig.create("xoxb-test",
        "#alerts", "http://localhost:" + server.getAddress().getPort()
            + "/api", Duration.ofSeconds(5)));
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final int n = requests.incrementAndGet();
    authorization.set(exchange.getRequestHeaders()
        .getFirst("Authorization"));
    try (InputStream is = exchange.getRequestBody()) {
      body.set(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }
    final Reply reply = responder.reply(n);
    final byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(reply.status(), bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @FunctionalInterface
  private interface Responder {
    Reply reply(int requestNumber);
  }

  private record Reply(int status, String body) {
  }
}
