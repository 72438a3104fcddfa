package org.waabox.courier.event;

/**
 * The downstream consumer of delivered events.
 *
 * <p>{@link #deliver(RemoteEvent)} is called once per event not authored by
 * the subscriber, in stream order, and never concurrently for the same
 * account. Delivery is at-least-once: after a crash between delivery and
 * cursor persistence the same event id may be delivered again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface EventConsumer {

  /**
   * Handles one event.
   *
   * @param event the event, never null
   *
   * @throws Exception if the event could not be handled; the failure is
   *                   logged and the remaining events are still delivered
   */
  void deliver(RemoteEvent event) throws Exception;

  /**
   * Called once when an account synchronizes for the first time.
   *
   * <p>Events present before this point are never delivered. The default
   * implementation does nothing.
   *
   * @param accountId the synchronized account, never null
   */
  default void onSynchronized(final String accountId) {
  }
}
