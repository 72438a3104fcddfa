package org.waabox.courier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AbortSignal}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AbortSignalTest {

  @Test
  void whenSleeping_givenNoAbort_shouldReturnTrue() {
    final AbortSignal signal = new AbortSignal();

    assertTrue(signal.sleep(Duration.ofMillis(10)));
    assertFalse(signal.isAborted());
  }

  @Test
  void whenAborting_givenSleepingThread_shouldWakeItUp() throws Exception {
    final AbortSignal signal = new AbortSignal();
    final long start = System.nanoTime();

    final CompletableFuture<Boolean> sleeper = CompletableFuture.supplyAsync(
        () -> signal.sleep(Duration.ofMinutes(5)));
    Thread.sleep(50);
    signal.abort();

    assertFalse(sleeper.get(5, TimeUnit.SECONDS));
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  void whenAborting_shouldRunCallbacksOnce() {
    final AbortSignal signal = new AbortSignal();
    final AtomicInteger calls = new AtomicInteger();
    signal.onAbort(calls::incrementAndGet);

    signal.abort();
    signal.abort();

    assertTrue(signal.isAborted());
    assertEquals(1, calls.get());
  }

  @Test
  void whenRegistering_givenAlreadyAborted_shouldRunImmediately() {
    final AbortSignal signal = new AbortSignal();
    signal.abort();
    final AtomicInteger calls = new AtomicInteger();

    signal.onAbort(calls::incrementAndGet);

    assertEquals(1, calls.get());
  }

  @Test
  void whenUnregistering_shouldNotRunCallback() {
    final AbortSignal signal = new AbortSignal();
    final AtomicInteger calls = new AtomicInteger();
    final Runnable unregister = signal.onAbort(calls::incrementAndGet);

    unregister.run();
    signal.abort();

    assertEquals(0, calls.get());
  }

  @Test
  void whenAborting_givenFailingCallback_shouldStillRunTheOthers() {
    final AbortSignal signal = new AbortSignal();
    final AtomicInteger calls = new AtomicInteger();
    signal.onAbort(() -> {
      throw new IllegalStateException("boom");
    });
    signal.onAbort(calls::incrementAndGet);

    signal.abort();

    assertEquals(1, calls.get());
  }
}
