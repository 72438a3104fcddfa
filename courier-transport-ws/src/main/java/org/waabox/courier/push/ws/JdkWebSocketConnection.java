package org.waabox.courier.push.ws;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.push.HintConnection;

/**
 * {@link HintConnection} over an open JDK {@link WebSocket}.
 *
 * <p>Text frames are queued so that a new send starts only after the
 * previous one completed. Send failures are logged; the socket reports
 * the broken connection through its listener. A closed connection is
 * aborted when the peer does not answer the close frame in time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdkWebSocketConnection implements HintConnection {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdkWebSocketConnection.class);

  /** How long the closing handshake may take before aborting. */
  static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  /** The open socket, never null. */
  private final WebSocket socket;

  /** Runs the check that releases a socket whose peer never closes. */
  private final Executor closeWatchdog;

  /** The tail of the text send queue, guarded by {@code this}. */
  private CompletableFuture<?> lastText =
      CompletableFuture.completedFuture(null);

  /**
   * Creates a new connection.
   *
   * @param theSocket the open socket, never null
   */
  JdkWebSocketConnection(final WebSocket theSocket) {
    this(theSocket, CompletableFuture.delayedExecutor(
        CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Creates a new connection with a custom close watchdog.
   *
   * @param theSocket        the open socket, never null
   * @param theCloseWatchdog runs the release check once the close frame
   *                         was sent, never null
   */
  JdkWebSocketConnection(final WebSocket theSocket,
      final Executor theCloseWatchdog) {
    socket = Objects.requireNonNull(theSocket, "socket cannot be null");
    closeWatchdog = Objects.requireNonNull(theCloseWatchdog,
        "closeWatchdog cannot be null");
  }

  @Override
  public synchronized void sendText(final String text) {
    Objects.requireNonNull(text, "text cannot be null");
    lastText = lastText
        .handle((ignored, error) -> null)
        .thenCompose(ignored -> socket.sendText(text, true))
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.debug("Failed to send text frame: {}", error.getMessage());
          }
        });
  }

  @Override
  public void sendPing() {
    socket.sendPing(ByteBuffer.allocate(0))
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.debug("Failed to send ping: {}", error.getMessage());
          }
        });
  }

  @Override
  public void close(final int code, final String reason) {
    final CompletableFuture<WebSocket> closing;
    try {
      closing = socket.sendClose(code, reason == null ? "" : reason);
    } catch (final RuntimeException e) {
      log.debug("Close handshake rejected, aborting: {}", e.getMessage());
      socket.abort();
      return;
    }
    closing
        .orTimeout(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.debug("Close handshake failed, aborting: {}",
                error.getMessage());
            socket.abort();
            return;
          }
          closeWatchdog.execute(this::releaseIfPeerSilent);
        });
  }

  /** Aborts the socket when the peer did not answer the close frame. */
  private void releaseIfPeerSilent() {
    if (!socket.isInputClosed()) {
      log.debug("Peer did not answer the close frame, aborting");
      socket.abort();
    }
  }

  @Override
  public void abort() {
    socket.abort();
  }
}
