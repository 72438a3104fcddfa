package org.waabox.courier.poll;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs poll tasks one at a time per account.
 *
 * <p>Each account key gets its own FIFO queue drained by a single thread:
 * a task only starts once every task submitted before it for the same key
 * has settled, successfully or not. Tasks of different keys run
 * independently and never block each other.
 *
 * <p>Tasks should read any shared state (the current cursor) when they
 * run, not when they are submitted, so that two queued triggers never work
 * on the same stale position.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PollSerializer implements AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PollSerializer.class);

  /** How long {@link #close()} waits for running tasks. */
  private static final long CLOSE_TIMEOUT_SECONDS = 5;

  /** The queues, keyed by account. */
  private final Map<String, ExecutorService> queues =
      new ConcurrentHashMap<>();

  /** Whether this serializer was closed. */
  private volatile boolean closed = false;

  /**
   * Appends a task to the queue of the given account.
   *
   * @param accountId the account key, never null
   * @param task      the task, never null
   * @param <T>       the task result type
   *
   * @return a future completed with the task outcome, never null; failed
   *         with {@link RejectedExecutionException} after {@link #close()}
   */
  public <T> CompletableFuture<T> submit(final String accountId,
      final Callable<T> task) {
    Objects.requireNonNull(accountId, "accountId must not be null");
    Objects.requireNonNull(task, "task must not be null");

    if (closed) {
      return CompletableFuture.failedFuture(new RejectedExecutionException(
          "PollSerializer is closed"));
    }

    final ExecutorService queue = queues.computeIfAbsent(accountId,
        PollSerializer::newQueue);
    try {
      return CompletableFuture.supplyAsync(() -> {
        try {
          return task.call();
        } catch (final RuntimeException e) {
          throw e;
        } catch (final Exception e) {
          throw new CompletionException(e);
        }
      }, queue);
    } catch (final RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Discards the queue of one account, letting its running task finish.
   *
   * @param accountId the account key, never null
   */
  public void release(final String accountId) {
    final ExecutorService queue = queues.remove(accountId);
    if (queue != null) {
      queue.shutdown();
    }
  }

  /** Stops every queue, waiting briefly for running tasks. */
  @Override
  public void close() {
    closed = true;
    for (final Map.Entry<String, ExecutorService> entry : queues.entrySet()) {
      final ExecutorService queue = entry.getValue();
      queue.shutdown();
      try {
        if (!queue.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Poll queue of account '{}' did not drain, interrupting",
              entry.getKey());
          queue.shutdownNow();
        }
      } catch (final InterruptedException e) {
        queue.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    queues.clear();
  }

  /**
   * Creates the single-thread queue of one account.
   *
   * @param accountId the account key, never null
   *
   * @return the executor, never null
   */
  private static ExecutorService newQueue(final String accountId) {
    return Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "courier-poll-" + accountId);
      thread.setDaemon(true);
      return thread;
    });
  }
}
