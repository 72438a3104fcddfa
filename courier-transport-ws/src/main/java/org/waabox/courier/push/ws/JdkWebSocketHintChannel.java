package org.waabox.courier.push.ws;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.push.HintChannel;
import org.waabox.courier.push.HintConnection;
import org.waabox.courier.push.HintListener;

/**
 * {@link HintChannel} over Java's built-in {@link WebSocket} client.
 *
 * <p>The returned future is owned by this channel: when the caller
 * completes it first (for example through {@code orTimeout}), a socket
 * that opens afterwards is aborted instead of leaking.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class JdkWebSocketHintChannel implements HintChannel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdkWebSocketHintChannel.class);

  /** The HTTP client that builds the sockets, never null. */
  private final HttpClient client;

  /** The opening handshake timeout, never null. */
  private final Duration connectTimeout;

  /**
   * Creates a channel with its own HTTP client.
   *
   * @param theConnectTimeout the opening handshake timeout, never null
   */
  public JdkWebSocketHintChannel(final Duration theConnectTimeout) {
    this(HttpClient.newHttpClient(), theConnectTimeout);
  }

  /**
   * Creates a channel that builds its sockets from the given client.
   *
   * @param theClient         the HTTP client, never null
   * @param theConnectTimeout the opening handshake timeout, never null
   */
  public JdkWebSocketHintChannel(final HttpClient theClient,
      final Duration theConnectTimeout) {
    client = Objects.requireNonNull(theClient, "client cannot be null");
    connectTimeout = Objects.requireNonNull(theConnectTimeout,
        "connectTimeout cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<HintConnection> connect(final URI uri,
      final HintListener listener) {
    Objects.requireNonNull(uri, "uri cannot be null");
    Objects.requireNonNull(listener, "listener cannot be null");

    final CompletableFuture<HintConnection> result = new CompletableFuture<>();
    final CompletableFuture<WebSocket> opening;
    try {
      opening = client.newWebSocketBuilder()
          .connectTimeout(connectTimeout)
          .buildAsync(uri, new HintSocketListener(listener));
    } catch (final RuntimeException e) {
      result.completeExceptionally(e);
      return result;
    }

    opening.whenComplete((socket, error) -> {
      if (error != null) {
        result.completeExceptionally(unwrap(error));
        return;
      }
      final JdkWebSocketConnection connection =
          new JdkWebSocketConnection(socket);
      if (!result.complete(connection)) {
        log.debug("Socket to {} opened after the caller gave up, aborting",
            uri.getHost());
        connection.abort();
      }
    });
    return result;
  }

  private static Throwable unwrap(final Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
