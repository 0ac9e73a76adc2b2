package org.waabox.swipermonitor.metrics;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class that renders a {@link MetricsSnapshot} as the JSON
 * document written to the metrics file.
 *
 * <p>Uses Jackson's tree model so the key names are fixed here and not
 * derived from Java property names. Timestamps are ISO-8601 local date
 * times that always carry the seconds, with a fraction only when it is not
 * zero; {@code last_successful_check} is {@code null} until a health check
 * passes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MetricsSnapshotCodec {

  /** Shared ObjectMapper, indenting output for operators reading the file. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** Renders timestamps as {@code 2024-03-01T12:00:00[.ffffff]}. */
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      new DateTimeFormatterBuilder()
          .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
          .appendFraction(ChronoField.MICRO_OF_SECOND, 0, 6, true)
          .toFormatter();

  /** Private constructor to prevent instantiation. */
  private MetricsSnapshotCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a snapshot into the metrics file JSON document.
   *
   * <p>The document contains exactly six keys:
   * {@code notifications_sent}, {@code failed_notifications},
   * {@code db_connection_attempts}, {@code db_connection_failures},
   * {@code last_successful_check} and {@code timestamp}.
   *
   * @param snapshot the snapshot to serialize, never null.
   * @return the JSON document, never null.
   */
  public static String serialize(final MetricsSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("notifications_sent", snapshot.notificationsSent());
    node.put("failed_notifications", snapshot.failedNotifications());
    node.put("db_connection_attempts", snapshot.connectionAttempts());
    node.put("db_connection_failures", snapshot.connectionFailures());
    node.put("last_successful_check", snapshot.lastSuccessfulCheckTime()
        .map(MetricsSnapshotCodec::formatTimestamp)
        .orElse(null));
    node.put("timestamp", formatTimestamp(snapshot.capturedAt()));

    try {
      return MAPPER.writeValueAsString(node);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize metrics", e);
    }
  }

  /**
   * Formats a timestamp for the metrics file.
   *
   * @param time the time to format, never null.
   * @return the ISO-8601 text, never null.
   */
  static String formatTimestamp(final LocalDateTime time) {
    return TIMESTAMP_FORMAT.format(time);
  }
}
