package org.waabox.courier.push;

/**
 * The states of a push session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SessionState {

  /** The connection is being opened. */
  CONNECTING,

  /** The connection is open and hints are flowing. */
  OPEN,

  /** A close was requested locally. */
  CLOSING,

  /** The session ended; terminal. */
  CLOSED
}
