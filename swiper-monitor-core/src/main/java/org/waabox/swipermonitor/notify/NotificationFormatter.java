package org.waabox.swipermonitor.notify;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

import org.waabox.swipermonitor.store.OfflineEvent;

/**
 * Maps an {@link OfflineEvent} to its {@link NotificationPayload}.
 *
 * <p>The payload always has the fields {@value #GAME}, {@value #USER},
 * {@value #DAYS_OFFLINE} and {@value #LOG_TIME}, in that order, followed by
 * the event comment. Formatting has no I/O and no recoverable failure: a
 * null event fails fast.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationFormatter {

  /** The default header text. */
  public static final String DEFAULT_HEADER =
      "🚨 Embed Swiper Offline Alert!";

  /** Label of the device description field. */
  public static final String GAME = "Game";

  /** Label of the user name field. */
  public static final String USER = "User";

  /** Label of the days offline field. */
  public static final String DAYS_OFFLINE = "Days Offline";

  /** Label of the log time field. */
  public static final String LOG_TIME = "Log Time";

  /** Format of the log time field. */
  private static final DateTimeFormatter LOG_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /** The header text, never null. */
  private final String header;

  /** Creates a formatter using {@link #DEFAULT_HEADER}. */
  public NotificationFormatter() {
    this(DEFAULT_HEADER);
  }

  /**
   * Creates a formatter with a custom header.
   *
   * @param theHeader the header text, never null or blank
   */
  public NotificationFormatter(final String theHeader) {
    Objects.requireNonNull(theHeader, "header cannot be null");
    if (theHeader.isBlank()) {
      throw new IllegalArgumentException("header cannot be blank");
    }
    header = theHeader;
  }

  /**
   * Formats an event.
   *
   * @param event the event, never null
   *
   * @return the payload, never null
   */
  public NotificationPayload format(final OfflineEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final List<NotificationPayload.Field> fields = List.of(
        new NotificationPayload.Field(GAME, event.deviceDescription()),
        new NotificationPayload.Field(USER, event.userName()),
        new NotificationPayload.Field(DAYS_OFFLINE,
            String.valueOf(event.daysOffline())),
        new NotificationPayload.Field(LOG_TIME,
            LOG_TIME_FORMAT.format(event.occurredAt())));

    return new NotificationPayload(header, fields, event.comment());
  }
}
