package org.waabox.courier;

/**
 * Base exception for Courier infrastructure errors.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure and
 * configuration failures that cannot be meaningfully recovered from at
 * the call site. Failures on the delivery path itself are never surfaced
 * this way: the supervisor logs them and reconnects.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CourierException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public CourierException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CourierException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
