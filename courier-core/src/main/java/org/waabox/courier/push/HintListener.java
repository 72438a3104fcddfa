package org.waabox.courier.push;

/**
 * Receives the callbacks of a {@link HintConnection}.
 *
 * <p>Callbacks may arrive on any thread but never concurrently for the
 * same connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface HintListener {

  /**
   * Called for each complete text frame.
   *
   * @param frame the frame text, never null
   */
  void onText(String frame);

  /** Called when a protocol-level pong arrives. */
  void onPong();

  /**
   * Called once the connection is closed.
   *
   * @param code   the close code
   * @param reason the close reason, may be empty
   */
  void onClose(int code, String reason);

  /**
   * Called when the connection failed.
   *
   * @param error the failure, never null
   */
  void onError(Throwable error);
}
