package org.waabox.courier.poll;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PollSerializer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PollSerializerTest {

  /** The serializer under test. */
  private final PollSerializer serializer = new PollSerializer();

  @AfterEach
  void tearDown() {
    serializer.close();
  }

  @Test
  void whenSubmitting_givenSameAccount_shouldRunOneAtATimeInOrder()
      throws Exception {
    final List<Integer> order = new CopyOnWriteArrayList<>();
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();

    final List<CompletableFuture<Integer>> futures =
        new CopyOnWriteArrayList<>();
    for (int i = 0; i < 10; i++) {
      final int task = i;
      futures.add(serializer.submit("main", () -> {
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        Thread.sleep(5);
        order.add(task);
        inFlight.decrementAndGet();
        return task;
      }));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .get(5, TimeUnit.SECONDS);

    assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), order);
    assertEquals(1, maxInFlight.get());
  }

  @Test
  void whenSubmitting_givenBlockedAccount_shouldNotBlockOtherAccounts()
      throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final CompletableFuture<String> blocked = serializer.submit("main",
        () -> {
          release.await(5, TimeUnit.SECONDS);
          return "main";
        });

    final String other = serializer.submit("other", () -> "other")
        .get(5, TimeUnit.SECONDS);

    assertEquals("other", other);
    release.countDown();
    assertEquals("main", blocked.get(5, TimeUnit.SECONDS));
  }

  @Test
  void whenSubmitting_givenFailingTask_shouldKeepRunningLaterTasks()
      throws Exception {
    final CompletableFuture<String> failing = serializer.submit("main",
        () -> {
          throw new IOException("disk gone");
        });
    final CompletableFuture<String> next = serializer.submit("main",
        () -> "next");

    final ExecutionException error = assertThrows(ExecutionException.class,
        () -> failing.get(5, TimeUnit.SECONDS));
    assertTrue(error.getCause() instanceof IOException);
    assertEquals("next", next.get(5, TimeUnit.SECONDS));
  }

  @Test
  void whenSubmitting_givenClosedSerializer_shouldFail() {
    serializer.close();

    final CompletableFuture<String> future = serializer.submit("main",
        () -> "late");

    final ExecutionException error = assertThrows(ExecutionException.class,
        () -> future.get(5, TimeUnit.SECONDS));
    assertTrue(error.getCause() instanceof RejectedExecutionException);
  }
}
