package org.waabox.courier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.cursor.InMemoryCursorStore;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.EventSource;
import org.waabox.courier.event.EventSourceException;
import org.waabox.courier.event.RecordingConsumer;
import org.waabox.courier.event.TestEvents;
import org.waabox.courier.push.FakeHintChannel;

/**
 * Tests for {@link Courier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CourierTest {

  @Test
  void whenBuilding_givenNoCursorStore_shouldThrow() {
    assertThrows(IllegalStateException.class, () -> Courier.builder()
        .hintChannel(new FakeHintChannel())
        .build());
  }

  @Test
  void whenBuilding_givenNoHintChannel_shouldThrow() {
    assertThrows(IllegalStateException.class, () -> Courier.builder()
        .cursorStore(new InMemoryCursorStore())
        .build());
  }

  @Test
  void whenSubscribing_givenDuplicateAccount_shouldThrow() {
    final Courier courier = courier(new InMemoryCursorStore());
    courier.subscribe(subscription("main", unreachable()));

    assertThrows(IllegalArgumentException.class,
        () -> courier.subscribe(subscription("main", unreachable())));
  }

  @Test
  void whenAskingStatus_givenNotStarted_shouldReportIdleAccounts() {
    final Courier courier = courier(new InMemoryCursorStore());
    courier.subscribe(subscription("zeta", unreachable()));
    courier.subscribe(subscription("alpha", unreachable()));

    final List<AccountSnapshot> status = courier.status();

    assertEquals(2, status.size());
    assertEquals("alpha", status.get(0).accountId());
    assertFalse(status.get(0).running());
    assertNull(status.get(0).mode());
    assertFalse(courier.isRunning());
  }

  @Test
  void whenStarted_shouldServeAccountsUntilStopped() throws Exception {
    final InMemoryCursorStore store = new InMemoryCursorStore();
    store.put("main", Cursor.token("c0"));
    final RecordingConsumer consumer = new RecordingConsumer();
    final EventSource source = new EventSource() {
      @Override
      public ConnectionTicket requestConnectionCredential() {
        throw new EventSourceException("Service unavailable", 503);
      }

      @Override
      public EventPage listEvents(final Cursor cursor) {
        if (cursor.equals(Cursor.token("c0"))) {
          return new EventPage(List.of(TestEvents.external("e1")), "c1",
              false);
        }
        return new EventPage(List.of(), null, false);
      }
    };
    final Courier courier = courier(store);
    courier.subscribe(new Subscription("main", source, consumer));

    courier.start();

    awaitDelivery(consumer);
    assertTrue(courier.isRunning());
    assertEquals(TransportMode.PULL, courier.status().get(0).mode());
    assertThrows(IllegalStateException.class, courier::start);
    assertThrows(IllegalStateException.class,
        () -> courier.subscribe(subscription("late", unreachable())));

    courier.stop();
    courier.stop();

    assertFalse(courier.isRunning());
    assertFalse(courier.status().get(0).running());
    assertEquals(Cursor.token("c1"), store.load("main"));
    assertEquals(1, courier.health().summary("main").orElseThrow()
        .delivered());
  }

  private static Courier courier(final InMemoryCursorStore store) {
    return Courier.builder()
        .cursorStore(store)
        .hintChannel(new FakeHintChannel())
        .backoffPolicy(BackoffPolicy.of(Duration.ofMillis(5), 1.0,
            Duration.ofMillis(5)))
        .supervisorConfig(SupervisorConfig.create(2, Duration.ofMillis(5)))
        .healthSummaryInterval(Duration.ofSeconds(1))
        .build();
  }

  private static Subscription subscription(final String accountId,
      final EventSource source) {
    return new Subscription(accountId, source, new RecordingConsumer());
  }

  private static EventSource unreachable() {
    return new EventSource() {
      @Override
      public ConnectionTicket requestConnectionCredential() {
        throw new EventSourceException("unreachable", -1);
      }

      @Override
      public EventPage listEvents(final Cursor cursor) {
        throw new EventSourceException("unreachable", -1);
      }
    };
  }

  private static void awaitDelivery(final RecordingConsumer consumer)
      throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (consumer.delivered().isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    assertEquals(List.of("e1"), consumer.delivered());
  }
}
