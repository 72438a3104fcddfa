package org.waabox.courier.push;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens push connections.
 *
 * <p>Implementations own the wire protocol (for instance a WebSocket
 * client) and report what they receive through a {@link HintListener}.
 * They never interpret frames themselves.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface HintChannel {

  /**
   * Starts opening a connection.
   *
   * @param uri      the endpoint, including the connection credential,
   *                 never null
   * @param listener the receiver of the connection callbacks, never null
   *
   * @return a future completed with the open connection, or completed
   *         exceptionally when the connection could not be established
   */
  CompletableFuture<HintConnection> connect(URI uri, HintListener listener);
}
