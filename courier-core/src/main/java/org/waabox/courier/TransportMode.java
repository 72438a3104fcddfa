package org.waabox.courier;

/**
 * How an account currently learns about new events.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum TransportMode {

  /** A push session carries change hints. */
  PUSH,

  /** Push is unavailable; events are polled on an interval. */
  PULL
}
