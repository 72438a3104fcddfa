package org.waabox.courier.push.ws;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

import org.waabox.courier.push.HintListener;

/**
 * Adapts {@link WebSocket.Listener} callbacks to a {@link HintListener}.
 *
 * <p>Text messages arriving in several fragments are reassembled before
 * being forwarded. Binary frames are ignored. Pings are answered by the
 * JDK socket itself.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HintSocketListener implements WebSocket.Listener {

  /** The listener receiving the adapted callbacks, never null. */
  private final HintListener delegate;

  /** Accumulates the fragments of the current text message. */
  private final StringBuilder text = new StringBuilder();

  /**
   * Creates a new adapter.
   *
   * @param theDelegate the hint listener, never null
   */
  HintSocketListener(final HintListener theDelegate) {
    delegate = Objects.requireNonNull(theDelegate, "delegate cannot be null");
  }

  @Override
  public void onOpen(final WebSocket webSocket) {
    webSocket.request(1);
  }

  @Override
  public CompletionStage<?> onText(final WebSocket webSocket,
      final CharSequence data, final boolean last) {
    text.append(data);
    if (last) {
      final String frame = text.toString();
      text.setLength(0);
      try {
        delegate.onText(frame);
      } finally {
        webSocket.request(1);
      }
    } else {
      webSocket.request(1);
    }
    return null;
  }

  @Override
  public CompletionStage<?> onBinary(final WebSocket webSocket,
      final ByteBuffer data, final boolean last) {
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onPing(final WebSocket webSocket,
      final ByteBuffer message) {
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onPong(final WebSocket webSocket,
      final ByteBuffer message) {
    try {
      delegate.onPong();
    } finally {
      webSocket.request(1);
    }
    return null;
  }

  @Override
  public CompletionStage<?> onClose(final WebSocket webSocket,
      final int statusCode, final String reason) {
    delegate.onClose(statusCode, reason);
    return null;
  }

  @Override
  public void onError(final WebSocket webSocket, final Throwable error) {
    delegate.onError(error);
  }
}
