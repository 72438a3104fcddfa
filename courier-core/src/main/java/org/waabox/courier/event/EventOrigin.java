package org.waabox.courier.event;

/**
 * Who authored a {@link RemoteEvent}, relative to the subscribed account.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventOrigin {

  /** Authored by the subscriber itself, an echo of its own output. */
  SUBSCRIBER,

  /** Authored by anybody else. */
  EXTERNAL
}
