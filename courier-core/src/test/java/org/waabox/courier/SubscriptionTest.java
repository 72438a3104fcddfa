package org.waabox.courier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.EventSource;
import org.waabox.courier.event.EventSourceException;
import org.waabox.courier.event.RecordingConsumer;

/**
 * Tests for {@link Subscription}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SubscriptionTest {

  private final EventSource source = new EventSource() {
    @Override
    public ConnectionTicket requestConnectionCredential() {
      throw new EventSourceException("unused", -1);
    }

    @Override
    public EventPage listEvents(final Cursor cursor) {
      return EventPage.empty();
    }
  };

  @Test
  void whenCreating_givenPlainName_shouldKeepIt() {
    final Subscription subscription = new Subscription("team.main-1",
        source, new RecordingConsumer());

    assertEquals("team.main-1", subscription.accountId());
  }

  @Test
  void whenCreating_givenPathLikeName_shouldThrow() {
    final RecordingConsumer consumer = new RecordingConsumer();

    assertThrows(IllegalArgumentException.class,
        () -> new Subscription("a/b", source, consumer));
    assertThrows(IllegalArgumentException.class,
        () -> new Subscription("a\\b", source, consumer));
    assertThrows(IllegalArgumentException.class,
        () -> new Subscription("..", source, consumer));
    assertThrows(IllegalArgumentException.class,
        () -> new Subscription(".", source, consumer));
    assertThrows(IllegalArgumentException.class,
        () -> new Subscription(" ", source, consumer));
  }
}
