package org.waabox.courier.source.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HttpEventSourceConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpEventSourceConfigTest {

  @Test
  void whenCreating_givenTrailingSlashes_shouldStripThem() {
    final HttpEventSourceConfig config = HttpEventSourceConfig.create(
        "https://api.example.com/trpc//", "bot_abc");

    assertEquals("https://api.example.com/trpc", config.apiUrl());
    assertEquals(Duration.ofSeconds(30), config.requestTimeout());
  }

  @Test
  void whenCreating_givenNonHttpScheme_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpEventSourceConfig.create("ftp://api.example.com",
            "bot_abc"));
  }

  @Test
  void whenCreating_givenBlankToken_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpEventSourceConfig.create("http://localhost", " "));
  }

  @Test
  void whenCreating_givenZeroTimeout_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpEventSourceConfig.create("http://localhost", "bot_abc",
            Duration.ZERO));
  }

  @Test
  void whenPrinting_shouldNotRevealTheToken() {
    final HttpEventSourceConfig config = HttpEventSourceConfig.create(
        "http://localhost", "bot_secret");

    assertFalse(config.toString().contains("bot_secret"));
  }
}
