package org.waabox.courier.metrics;

/**
 * A no-operation implementation of {@link CourierMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCourierMetrics implements CourierMetrics {

  /** {@inheritDoc} */
  @Override
  public void eventDelivered(final String accountId) {
  }

  /** {@inheritDoc} */
  @Override
  public void deliveryFailed(final String accountId, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void pollFailed(final String accountId, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconnected(final String accountId) {
  }
}
