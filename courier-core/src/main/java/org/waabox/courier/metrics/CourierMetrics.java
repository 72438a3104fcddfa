package org.waabox.courier.metrics;

/**
 * An abstraction for recording operational metrics of the delivery
 * gateway.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCourierMetrics}
 * when metrics collection is not required.
 *
 * <p>Implementations are called from supervisor and poll threads and must
 * be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CourierMetrics {

  /**
   * Records an event handed to the consumer.
   *
   * @param accountId the account, never null
   */
  void eventDelivered(String accountId);

  /**
   * Records an event the consumer failed to handle.
   *
   * @param accountId the account, never null
   * @param cause     the failure, never null
   */
  void deliveryFailed(String accountId, Throwable cause);

  /**
   * Records a poll cycle that could not fetch its page.
   *
   * @param accountId the account, never null
   * @param cause     the failure, never null
   */
  void pollFailed(String accountId, Throwable cause);

  /**
   * Records a reconnect of the supervisor loop.
   *
   * @param accountId the account, never null
   */
  void reconnected(String accountId);
}
