package org.waabox.courier.event;

import org.waabox.courier.cursor.Cursor;

/**
 * The narrow RPC contract of the remote event source.
 *
 * <p>Implementations are called from the supervisor thread and from the
 * poll thread of a single account; they must be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface EventSource {

  /**
   * Requests a one-time credential to open a push session.
   *
   * @return the ticket and the endpoint to connect to, never null
   *
   * @throws EventSourceException if the request fails for any reason
   */
  ConnectionTicket requestConnectionCredential();

  /**
   * Lists the events recorded after the given cursor.
   *
   * <p>An absent or seeded cursor is sent as "no cursor", which makes the
   * source answer from the start of the stream.
   *
   * @param cursor the current cursor, never null
   *
   * @return the page of events, never null
   *
   * @throws EventSourceException if the request fails for any reason
   */
  EventPage listEvents(Cursor cursor);
}
