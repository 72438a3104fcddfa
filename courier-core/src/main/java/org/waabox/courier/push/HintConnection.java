package org.waabox.courier.push;

/**
 * An open push connection.
 *
 * <p>All methods are asynchronous and must not throw for an already closed
 * connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface HintConnection {

  /**
   * Sends a text frame.
   *
   * @param text the frame, never null
   */
  void sendText(String text);

  /** Sends a protocol-level ping. */
  void sendPing();

  /**
   * Starts a close handshake.
   *
   * @param code   the close code
   * @param reason the close reason, never null
   */
  void close(int code, String reason);

  /** Drops the connection without handshake. */
  void abort();
}
