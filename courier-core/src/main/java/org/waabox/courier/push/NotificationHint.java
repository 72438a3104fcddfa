package org.waabox.courier.push;

/**
 * A thin signal received over a push session.
 *
 * <p>Hints never carry content: a {@link #CHANGE} only means new events may
 * be available through the pull path.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum NotificationHint {

  /** Something changed on the remote side; a poll should follow. */
  CHANGE,

  /** The remote side answered a keepalive ping. */
  KEEPALIVE_ACK
}
