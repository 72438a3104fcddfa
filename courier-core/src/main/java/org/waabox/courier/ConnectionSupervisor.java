package org.waabox.courier;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.cursor.CursorStore;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventSource;
import org.waabox.courier.event.EventSourceException;
import org.waabox.courier.health.HealthTracker;
import org.waabox.courier.poll.PollExecutor;
import org.waabox.courier.poll.PollSerializer;
import org.waabox.courier.push.HintChannel;
import org.waabox.courier.push.PushSessionConfig;
import org.waabox.courier.push.PushTransport;
import org.waabox.courier.push.SessionListener;

/**
 * Keeps one account connected until aborted.
 *
 * <p>Each round requests a connection credential. With a credential it runs
 * a push session to completion; without one it switches to interval
 * polling for {@link SupervisorConfig#fallbackCycles()} cycles. Either way
 * the round ends with a reconnect delay taken from the
 * {@link BackoffPolicy}, reset after each credential obtained. No failure
 * ends the loop: only the {@link AbortSignal} does.
 *
 * <p>All polls of the account, whether triggered by the push session or by
 * the fallback, go through the shared {@link PollSerializer} and read the
 * current cursor when they run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionSupervisor {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConnectionSupervisor.class);

  /** The supervised account, never null. */
  private final String accountId;

  /** The remote source, never null. */
  private final EventSource source;

  /** The durable cursor storage, never null. */
  private final CursorStore cursorStore;

  /** Runs the poll cycles, never null. */
  private final PollExecutor executor;

  /** Orders the poll cycles, never null. */
  private final PollSerializer serializer;

  /** Runs the push sessions, never null. */
  private final PushTransport transport;

  /** The reconnect delays, never null. */
  private final Backoff backoff;

  /** The fallback settings, never null. */
  private final SupervisorConfig config;

  /** The health counters, never null. */
  private final HealthTracker health;

  /** The connection state, never null. */
  private final AccountConnection connection;

  /** The latest known cursor, absent until loaded. */
  private final AtomicReference<Cursor> cursor =
      new AtomicReference<>(Cursor.absent());

  /**
   * Creates a new supervisor.
   *
   * @param theSubscription the account binding, never null
   * @param theCursorStore  the cursor storage, never null
   * @param theSerializer   the poll serializer, never null
   * @param theChannel      opens push connections, never null
   * @param thePushConfig   the push session timings, never null
   * @param thePolicy       the reconnect delays, never null
   * @param theConfig       the fallback settings, never null
   * @param theHealth       the health counters, never null
   * @param theClock        gives the state timestamps, never null
   */
  public ConnectionSupervisor(final Subscription theSubscription,
      final CursorStore theCursorStore, final PollSerializer theSerializer,
      final HintChannel theChannel, final PushSessionConfig thePushConfig,
      final BackoffPolicy thePolicy, final SupervisorConfig theConfig,
      final HealthTracker theHealth, final Clock theClock) {
    Objects.requireNonNull(theSubscription, "subscription must not be null");
    Objects.requireNonNull(thePolicy, "policy must not be null");
    accountId = theSubscription.accountId();
    source = theSubscription.source();
    cursorStore = Objects.requireNonNull(theCursorStore,
        "cursorStore must not be null");
    serializer = Objects.requireNonNull(theSerializer,
        "serializer must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
    health = Objects.requireNonNull(theHealth, "health must not be null");
    executor = new PollExecutor(accountId, source,
        theSubscription.consumer(), cursorStore, health);
    transport = new PushTransport(accountId, theChannel, thePushConfig);
    backoff = thePolicy.start();
    connection = new AccountConnection(accountId, theClock);
  }

  /**
   * Runs the supervision loop on the calling thread until the signal is
   * aborted.
   *
   * @param abortSignal the signal ending the loop, never null
   */
  public void run(final AbortSignal abortSignal) {
    Objects.requireNonNull(abortSignal, "abortSignal must not be null");

    cursor.set(loadCursor());
    log.info("Account '{}': supervisor started at {}", accountId,
        cursor.get());

    final SessionListener sessionListener = new SessionListener() {
      @Override
      public void onRunning() {
        connection.markRunning();
      }

      @Override
      public void onStopped(final String error) {
        connection.markStopped(error);
      }
    };

    int reconnects = 0;
    while (!abortSignal.isAborted()) {
      try {
        final ConnectionTicket ticket = requestTicket();
        if (abortSignal.isAborted()) {
          break;
        }

        if (ticket != null) {
          backoff.reset();
          connection.switchTo(TransportMode.PUSH);
          transport.runSession(ticket, cursor::get, this::triggerPoll,
              sessionListener, abortSignal);
        } else {
          runFallback(abortSignal);
        }
      } catch (final RuntimeException e) {
        log.error("Account '{}': connection round failed", accountId, e);
        connection.markStopped("connection round failed: " + e);
      }

      if (abortSignal.isAborted()) {
        break;
      }
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Account '{}': supervisor interrupted", accountId);
        break;
      }

      reconnects++;
      health.recordReconnect(accountId);
      final Duration delay = backoff.next();
      log.info("Account '{}': reconnecting in {} ms (attempt {})",
          accountId, delay.toMillis(), backoff.attempt());
      abortSignal.sleep(delay);
    }

    connection.markStopped(null);
    log.info("Account '{}': supervisor stopped after {} reconnect(s)",
        accountId, reconnects);
  }

  /**
   * Requests a poll cycle for this account.
   *
   * <p>The cycle is queued behind any cycle already pending for the
   * account and reads the cursor when it starts.
   *
   * @return a future with the new cursor, empty when unchanged
   */
  CompletableFuture<Optional<Cursor>> requestPoll() {
    return serializer.submit(accountId, () -> {
      final Optional<Cursor> next = executor.poll(cursor.get());
      next.ifPresent(cursor::set);
      return next;
    });
  }

  /**
   * Returns the state of this account.
   *
   * @return the snapshot, never null
   */
  public AccountSnapshot snapshot() {
    return connection.snapshot();
  }

  /**
   * Returns the latest known cursor.
   *
   * @return the cursor, never null
   */
  public Cursor cursor() {
    return cursor.get();
  }

  /**
   * Returns the account served by this supervisor.
   *
   * @return the account id, never null
   */
  public String accountId() {
    return accountId;
  }

  /**
   * Loads the persisted cursor, starting from scratch when the store
   * fails.
   *
   * @return the cursor, never null
   */
  private Cursor loadCursor() {
    try {
      return cursorStore.load(accountId);
    } catch (final RuntimeException e) {
      log.warn("Account '{}': failed to load cursor, starting unsynchronized:"
          + " {}", accountId, e.getMessage());
      return Cursor.absent();
    }
  }

  /** Requests a poll without waiting for it, as push hints do. */
  private void triggerPoll() {
    requestPoll().whenComplete((next, error) -> {
      if (error != null) {
        log.debug("Account '{}': poll not run: {}", accountId,
            error.getMessage());
      }
    });
  }

  /**
   * Requests a connection credential.
   *
   * @return the credential, null when the request failed
   */
  private ConnectionTicket requestTicket() {
    try {
      return source.requestConnectionCredential();
    } catch (final EventSourceException e) {
      if (e.isAuthenticationFailure()) {
        log.error("Account '{}': connection credential rejected: {}",
            accountId, e.getMessage());
      } else {
        log.warn("Account '{}': connection credential request failed: {}",
            accountId, e.getMessage());
      }
      connection.recordError(e.getMessage());
    } catch (final RuntimeException e) {
      log.warn("Account '{}': connection credential request failed: {}",
          accountId, e.getMessage(), e);
      connection.recordError(e.getMessage());
    }
    return null;
  }

  /**
   * Polls on an interval while push is unavailable.
   *
   * @param abortSignal the signal ending the fallback early, never null
   */
  private void runFallback(final AbortSignal abortSignal) {
    connection.switchTo(TransportMode.PULL);
    connection.markRunning();
    log.warn("Account '{}': push unavailable, polling every {} s for {}"
        + " cycle(s)", accountId, config.fallbackInterval().toSeconds(),
        config.fallbackCycles());

    for (int cycle = 1; cycle <= config.fallbackCycles(); cycle++) {
      if (abortSignal.isAborted()) {
        break;
      }
      awaitPoll();
      if (cycle < config.fallbackCycles()
          && !abortSignal.sleep(config.fallbackInterval())) {
        break;
      }
    }
    connection.markStopped(null);
  }

  /** Runs a poll cycle and waits for it to settle. */
  private void awaitPoll() {
    try {
      requestPoll().join();
    } catch (final CompletionException | CancellationException e) {
      log.warn("Account '{}': fallback poll did not run: {}", accountId,
          e.getMessage());
    }
  }
}
