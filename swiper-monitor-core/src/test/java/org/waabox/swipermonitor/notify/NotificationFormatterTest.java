package org.waabox.swipermonitor.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.swipermonitor.store.OfflineEvent;

/**
 * Tests for {@link NotificationFormatter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotificationFormatterTest {

  private static final OfflineEvent EVENT = new OfflineEvent("Dragon Slots",
      "jdoe", "Swiper placed Offline: card reader fault",
      LocalDateTime.of(2024, 3, 1, 9, 5, 7, 123_000_000), 4);

  @Test
  void whenFormatting_shouldProduceFieldsInDisplayOrder() {
    final NotificationPayload payload = new NotificationFormatter()
        .format(EVENT);

    assertEquals(NotificationFormatter.DEFAULT_HEADER, payload.header());
    assertEquals(List.of(
        new NotificationPayload.Field("Game", "Dragon Slots"),
        new NotificationPayload.Field("User", "jdoe"),
        new NotificationPayload.Field("Days Offline", "4"),
        new NotificationPayload.Field("Log Time", "2024-03-01 09:05:07")),
        payload.fields());
    assertEquals("Swiper placed Offline: card reader fault",
        payload.comment());
  }

  @Test
  void whenFormatting_givenCustomHeader_shouldUseIt() {
    final NotificationPayload payload =
        new NotificationFormatter("Swiper down").format(EVENT);

    assertEquals("Swiper down", payload.header());
  }

  @Test
  void whenCreating_givenBlankHeader_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new NotificationFormatter("  "));
  }

  @Test
  void whenFormatting_givenNullEvent_shouldFailFast() {
    assertThrows(NullPointerException.class, () ->
        new NotificationFormatter().format(null));
  }

  @Test
  void whenLookingUpField_givenUnknownLabel_shouldReturnNull() {
    final NotificationPayload payload = new NotificationFormatter()
        .format(EVENT);

    assertEquals("jdoe", payload.fieldValue(NotificationFormatter.USER));
    assertNull(payload.fieldValue("Location"));
  }
}
