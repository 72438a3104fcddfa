package org.waabox.courier.event;

import java.util.OptionalInt;

/**
 * Raised by an {@link EventSource} when a remote call fails.
 *
 * <p>Covers authentication failures, network errors, timeouts and
 * unexpected responses. The HTTP status is carried when the remote side
 * answered at all.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class EventSourceException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The HTTP status of the failed call, -1 when unknown. */
  private final int status;

  /** Creates a new exception without status.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public EventSourceException(final String message, final Throwable cause) {
    super(message, cause);
    status = -1;
  }

  /** Creates a new exception for a remote error response.
   *
   * @param message the detail message, cannot be null.
   * @param theStatus the HTTP status returned by the source.
   */
  public EventSourceException(final String message, final int theStatus) {
    super(message);
    status = theStatus;
  }

  /** Returns the HTTP status of the failed call.
   *
   * @return the status, empty when the remote side never answered.
   */
  public OptionalInt status() {
    return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
  }

  /** Whether the source rejected the credentials.
   *
   * @return true for 401 and 403 responses.
   */
  public boolean isAuthenticationFailure() {
    return status == 401 || status == 403;
  }
}
