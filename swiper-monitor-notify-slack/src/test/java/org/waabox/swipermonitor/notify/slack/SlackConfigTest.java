package org.waabox.swipermonitor.notify.slack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SlackConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SlackConfigTest {

  @Test
  void whenCreating_givenTokenAndChannel_shouldUseDefaults() {
    final SlackConfig config = SlackConfig.create("xoxb-1", "#alerts");

    assertEquals(URI.create("https://slack.com/api/chat.postMessage"),
        config.postMessageUri());
    assertEquals(Duration.ofSeconds(10), config.timeout());
  }

  @Test
  void whenCreating_givenTrailingSlash_shouldStripIt() {
    final SlackConfig config = SlackConfig.create("xoxb-1", "#alerts",
        "http://localhost:8080/api/", Duration.ofSeconds(1));

    assertEquals(URI.create("http://localhost:8080/api/chat.postMessage"),
        config.postMessageUri());
  }

  @Test
  void whenCreating_givenBlankToken_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SlackConfig.create(" ", "#alerts"));
  }

  @Test
  void whenCreating_givenZeroTimeout_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SlackConfig.create("xoxb-1", "#alerts", "http://localhost",
            Duration.ZERO));
  }

  @Test
  void whenPrinting_shouldNotLeakToken() {
    assertFalse(SlackConfig.create("xoxb-secret", "#alerts").toString()
        .contains("xoxb-secret"));
  }
}
