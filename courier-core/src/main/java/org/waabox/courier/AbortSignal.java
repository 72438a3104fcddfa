package org.waabox.courier;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A one-shot cancellation signal shared by every layer of one account.
 *
 * <p>Once {@link #abort()} is called the signal stays set: pending and
 * future {@link #sleep(Duration)} calls return immediately and every
 * registered callback runs exactly once.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AbortSignal {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      AbortSignal.class);

  /** Released once on abort. */
  private final CountDownLatch latch = new CountDownLatch(1);

  /** Callbacks to run on abort. */
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /** Sets the signal and runs every registered callback. */
  public void abort() {
    synchronized (latch) {
      if (latch.getCount() == 0) {
        return;
      }
      latch.countDown();
    }
    for (final Runnable callback : callbacks) {
      if (callbacks.remove(callback)) {
        runQuietly(callback);
      }
    }
  }

  /**
   * Whether the signal was set.
   *
   * @return true after {@link #abort()}
   */
  public boolean isAborted() {
    return latch.getCount() == 0;
  }

  /**
   * Sleeps for the given duration, waking up early on abort.
   *
   * <p>Thread interruption is treated as an abort request: the interrupt
   * flag is restored and the method returns.
   *
   * @param duration the time to sleep, never null
   *
   * @return true if the full duration elapsed, false if woken by abort
   */
  public boolean sleep(final Duration duration) {
    Objects.requireNonNull(duration, "duration must not be null");
    try {
      return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Registers a callback to run on abort.
   *
   * <p>If the signal is already set, the callback runs immediately on the
   * calling thread.
   *
   * @param callback the callback, never null
   *
   * @return a handle that unregisters the callback, never null
   */
  public Runnable onAbort(final Runnable callback) {
    Objects.requireNonNull(callback, "callback must not be null");
    callbacks.add(callback);
    if (isAborted() && callbacks.remove(callback)) {
      runQuietly(callback);
    }
    return () -> callbacks.remove(callback);
  }

  /**
   * Runs a callback, logging any failure.
   *
   * @param callback the callback, never null
   */
  private static void runQuietly(final Runnable callback) {
    try {
      callback.run();
    } catch (final Exception e) {
      log.warn("Abort callback failed: {}", e.getMessage(), e);
    }
  }
}
