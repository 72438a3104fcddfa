package org.waabox.courier.push;

/**
 * Observes the lifecycle of a push session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SessionListener {

  /** Called once the connection is open. */
  void onRunning();

  /**
   * Called once when the session ends, whether or not it was opened.
   *
   * @param error the failure description, null for a clean close
   */
  void onStopped(String error);
}
