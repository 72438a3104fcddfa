package org.waabox.courier.push;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.courier.AbortSignal;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.event.ConnectionTicket;

/**
 * Runs push sessions for one account.
 *
 * <p>A session moves through {@link SessionState#CONNECTING},
 * {@link SessionState#OPEN}, {@link SessionState#CLOSING} and
 * {@link SessionState#CLOSED}. Once open it requests an immediate catch-up
 * poll, sends a keepalive every {@link PushSessionConfig#pingInterval()}
 * and requests a poll for each {@link NotificationHint#CHANGE} received. A
 * keepalive left unanswered for {@link PushSessionConfig#pongTimeout()}
 * closes the connection with code {@value #PING_TIMEOUT_CODE}.
 *
 * <p>Every exit path (close, error, keepalive timeout, abort) goes through
 * one idempotent finish step that cancels the timers, notifies the
 * {@link SessionListener} once and releases the caller of
 * {@link #runSession}.
 *
 * <p>The transport never fetches events itself; hints are turned into poll
 * requests that the caller serializes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PushTransport {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PushTransport.class);

  /** Close code of a stalled connection. */
  public static final int PING_TIMEOUT_CODE = 4000;

  /** Close code of a normal closure. */
  public static final int NORMAL_CLOSURE = 1000;

  /** Close code of an endpoint going away. */
  public static final int GOING_AWAY = 1001;

  /** The account the sessions belong to, never null. */
  private final String accountId;

  /** Opens the connections, never null. */
  private final HintChannel channel;

  /** The session timings, never null. */
  private final PushSessionConfig config;

  /**
   * Creates a new push transport.
   *
   * @param theAccountId the account, never null
   * @param theChannel   the channel opening connections, never null
   * @param theConfig    the session timings, never null
   */
  public PushTransport(final String theAccountId,
      final HintChannel theChannel, final PushSessionConfig theConfig) {
    accountId = Objects.requireNonNull(theAccountId,
        "accountId must not be null");
    channel = Objects.requireNonNull(theChannel, "channel must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
  }

  /**
   * Runs one push session, blocking until it ends.
   *
   * @param ticket      the connection credential, never null
   * @param cursor      gives the latest cursor known to the caller, never
   *                    null
   * @param onPoll      requests a poll; must not block, never null
   * @param listener    observes the session lifecycle, never null
   * @param abortSignal ends the session when aborted, never null
   *
   * @return the latest cursor known to the caller once the session ended,
   *         never null
   */
  public Cursor runSession(final ConnectionTicket ticket,
      final Supplier<Cursor> cursor, final Runnable onPoll,
      final SessionListener listener, final AbortSignal abortSignal) {
    Objects.requireNonNull(ticket, "ticket must not be null");
    Objects.requireNonNull(cursor, "cursor must not be null");
    Objects.requireNonNull(onPoll, "onPoll must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    Objects.requireNonNull(abortSignal, "abortSignal must not be null");

    final Session session = new Session(onPoll, listener);
    final Runnable unregister = abortSignal.onAbort(session::abort);
    try {
      session.connect(ticket);
      session.await();
    } finally {
      unregister.run();
    }
    return cursor.get();
  }

  /**
   * Describes a failure without its stack trace.
   *
   * @param error the failure, never null
   *
   * @return the description, never null
   */
  private static String describe(final Throwable error) {
    Throwable cause = error;
    if (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    final String message = cause.getMessage();
    return message == null ? cause.getClass().getSimpleName() : message;
  }

  /** One connection attempt and its timers. */
  private final class Session implements HintListener {

    /** Requests a poll, never null. */
    private final Runnable onPoll;

    /** Observes the lifecycle, never null. */
    private final SessionListener listener;

    /** Runs the keepalive and its timeout, never null. */
    private final ScheduledExecutorService timers;

    /** Guards the finish step. */
    private final AtomicBoolean finished = new AtomicBoolean(false);

    /** Released once the session finished. */
    private final CountDownLatch closed = new CountDownLatch(1);

    /** The current state, guarded by this. */
    private SessionState state = SessionState.CONNECTING;

    /** The open connection, null until open; guarded by this. */
    private HintConnection connection;

    /** The armed keepalive timeout, null when disarmed; guarded by this. */
    private ScheduledFuture<?> pongTimer;

    /**
     * Creates a new session.
     *
     * @param theOnPoll   requests a poll, never null
     * @param theListener observes the lifecycle, never null
     */
    private Session(final Runnable theOnPoll,
        final SessionListener theListener) {
      onPoll = theOnPoll;
      listener = theListener;
      timers = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread thread = new Thread(r, "courier-push-" + accountId);
        thread.setDaemon(true);
        return thread;
      });
    }

    /**
     * Starts opening the connection.
     *
     * @param ticket the connection credential, never null
     */
    private void connect(final ConnectionTicket ticket) {
      synchronized (this) {
        if (state != SessionState.CONNECTING) {
          return;
        }
      }
      log.info("Account '{}': opening push session to {}", accountId,
          ticket.endpoint());

      final CompletableFuture<HintConnection> opening;
      try {
        opening = channel.connect(ticket.connectUri(), this);
      } catch (final RuntimeException e) {
        connectFailed(e);
        return;
      }
      opening.orTimeout(config.connectTimeout().toMillis(),
          TimeUnit.MILLISECONDS).whenComplete((opened, error) -> {
            if (error != null) {
              connectFailed(error);
            } else {
              opened(opened);
            }
          });
    }

    /**
     * Handles a connection that could not be opened.
     *
     * @param error the failure, never null
     */
    private void connectFailed(final Throwable error) {
      if (finished.get()) {
        return;
      }
      log.warn("Account '{}': push connection failed: {}", accountId,
          describe(error));
      finish("push connection failed: " + describe(error));
    }

    /**
     * Moves the session to open.
     *
     * @param opened the new connection, never null
     */
    private void opened(final HintConnection opened) {
      synchronized (this) {
        if (state != SessionState.CONNECTING) {
          opened.abort();
          return;
        }
        connection = opened;
        state = SessionState.OPEN;
        final long interval = config.pingInterval().toMillis();
        try {
          timers.scheduleAtFixedRate(this::ping, interval, interval,
              TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
          opened.abort();
          return;
        }
      }
      log.info("Account '{}': push session open", accountId);
      try {
        listener.onRunning();
      } catch (final RuntimeException e) {
        log.warn("Account '{}': session listener failed: {}", accountId,
            e.getMessage(), e);
      }
      requestPoll("catch-up");
    }

    /** Sends a keepalive and arms its timeout. */
    private synchronized void ping() {
      if (state != SessionState.OPEN) {
        return;
      }
      if (pongTimer == null) {
        pongTimer = timers.schedule(this::pongTimedOut,
            config.pongTimeout().toMillis(), TimeUnit.MILLISECONDS);
      }
      try {
        connection.sendText(HintCodec.pingFrame());
        connection.sendPing();
      } catch (final RuntimeException e) {
        log.warn("Account '{}': keepalive failed: {}", accountId,
            e.getMessage());
      }
    }

    /** Closes a connection whose keepalive went unanswered. */
    private void pongTimedOut() {
      synchronized (this) {
        if (state != SessionState.OPEN) {
          return;
        }
        pongTimer = null;
        state = SessionState.CLOSING;
        log.warn("Account '{}': no keepalive answer within {}, closing"
            + " stalled connection", accountId, config.pongTimeout());
        connection.close(PING_TIMEOUT_CODE, "ping timeout");
      }
      finish("stalled connection: ping timeout");
    }

    /** Cancels the armed keepalive timeout, if any. */
    private synchronized void disarm() {
      if (pongTimer != null) {
        pongTimer.cancel(false);
        pongTimer = null;
      }
    }

    /** Closes the session on behalf of the caller. */
    private void abort() {
      synchronized (this) {
        if (state == SessionState.CLOSING || state == SessionState.CLOSED) {
          return;
        }
        state = SessionState.CLOSING;
        if (connection != null) {
          connection.close(NORMAL_CLOSURE, "shutdown");
        }
      }
      log.info("Account '{}': push session aborted", accountId);
      finish(null);
    }

    /** {@inheritDoc} */
    @Override
    public void onText(final String frame) {
      final Optional<NotificationHint> hint;
      try {
        hint = HintCodec.decode(frame);
      } catch (final IllegalArgumentException e) {
        log.warn("Account '{}': ignoring undecodable push frame: {}",
            accountId, e.getMessage());
        return;
      }
      if (hint.isEmpty()) {
        log.debug("Account '{}': ignoring push frame {}", accountId, frame);
        return;
      }
      switch (hint.get()) {
        case CHANGE:
          requestPoll("change hint");
          break;
        case KEEPALIVE_ACK:
          disarm();
          break;
        default:
          break;
      }
    }

    /** {@inheritDoc} */
    @Override
    public void onPong() {
      disarm();
    }

    /** {@inheritDoc} */
    @Override
    public void onClose(final int code, final String reason) {
      if (finished.get()) {
        return;
      }
      if (code == NORMAL_CLOSURE || code == GOING_AWAY) {
        log.info("Account '{}': push session closed ({} {})", accountId,
            code, reason);
        finish(null);
      } else {
        log.warn("Account '{}': push session closed abnormally ({} {})",
            accountId, code, reason);
        finish("push session closed abnormally: " + code + " " + reason);
      }
    }

    /** {@inheritDoc} */
    @Override
    public void onError(final Throwable error) {
      if (finished.get()) {
        return;
      }
      log.warn("Account '{}': push session error: {}", accountId,
          describe(error));
      finish("push session error: " + describe(error));
    }

    /**
     * Asks the caller for a poll.
     *
     * @param reason what triggered the poll, for the logs
     */
    private void requestPoll(final String reason) {
      log.debug("Account '{}': requesting poll ({})", accountId, reason);
      try {
        onPoll.run();
      } catch (final RuntimeException e) {
        log.warn("Account '{}': poll request failed: {}", accountId,
            e.getMessage(), e);
      }
    }

    /**
     * Ends the session; only the first call has any effect.
     *
     * @param error the failure description, null for a clean end
     */
    private void finish(final String error) {
      if (!finished.compareAndSet(false, true)) {
        return;
      }
      synchronized (this) {
        state = SessionState.CLOSED;
        if (pongTimer != null) {
          pongTimer.cancel(false);
          pongTimer = null;
        }
      }
      try {
        listener.onStopped(error);
      } catch (final RuntimeException e) {
        log.warn("Account '{}': session listener failed: {}", accountId,
            e.getMessage(), e);
      }
      closed.countDown();
      timers.shutdownNow();
    }

    /** Blocks until the session finished. */
    private void await() {
      try {
        closed.await();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        abort();
      }
    }
  }
}
