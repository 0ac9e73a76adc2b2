package org.waabox.swipermonitor.notify.slack;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.swipermonitor.notify.NotificationPayload;

/**
 * Static utility class that renders a {@link NotificationPayload} as a
 * Slack {@code chat.postMessage} request and reads the Web API response.
 *
 * <p>The request carries three Block Kit blocks: a {@code header} block
 * with the payload header, a {@code section} block with one {@code mrkdwn}
 * field per payload field ({@code *Label:*\nvalue}), and a {@code section}
 * block with the comment. The header is also sent as the plain
 * {@code text} fallback used by notifications and screen readers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SlackMessageCodec {

  /** Shared ObjectMapper; thread-safe once configured. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private SlackMessageCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a payload into a {@code chat.postMessage} request body.
   *
   * @param channel the target channel, never null
   * @param payload the notification, never null
   * @return the JSON request body, never null
   */
  public static String serialize(final String channel,
      final NotificationPayload payload) {
    Objects.requireNonNull(channel, "channel cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");

    final ObjectNode root = MAPPER.createObjectNode();
    root.put("channel", channel);
    root.put("text", payload.header());

    final ArrayNode blocks = root.putArray("blocks");

    final ObjectNode header = blocks.addObject();
    header.put("type", "header");
    text(header.putObject("text"), "plain_text", payload.header());

    final ObjectNode fieldsSection = blocks.addObject();
    fieldsSection.put("type", "section");
    final ArrayNode fields = fieldsSection.putArray("fields");
    for (final NotificationPayload.Field field : payload.fields()) {
      text(fields.addObject(), "mrkdwn",
          "*" + field.label() + ":*\n" + field.value());
    }

    final ObjectNode comment = blocks.addObject();
    comment.put("type", "section");
    text(comment.putObject("text"), "mrkdwn",
        "*Comment:*\n" + payload.comment());

    try {
      return MAPPER.writeValueAsString(root);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize Slack message", e);
    }
  }

  /**
   * Reads a Web API response body.
   *
   * @param json the response body, never null
   * @return the Slack error code when {@code ok} is not true, empty when
   *     the message was accepted
   * @throws IllegalArgumentException if the body is not a JSON object
   */
  public static Optional<String> readError(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed Slack response", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Malformed Slack response: " + json);
    }
    if (root.path("ok").asBoolean(false)) {
      return Optional.empty();
    }
    return Optional.of(root.path("error").asText("unknown_error"));
  }

  private static void text(final ObjectNode node, final String type,
      final String value) {
    node.put("type", type);
    node.put("text", value);
  }
}
