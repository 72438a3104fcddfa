package org.waabox.courier;

import java.util.Objects;

import org.waabox.courier.event.EventConsumer;
import org.waabox.courier.event.EventSource;

/**
 * Binds an account to the source its events come from and the consumer
 * they go to.
 *
 * @param accountId the account, never null or blank; it names the
 *                  account's state directory, so it cannot contain path
 *                  separators nor be {@code .} or {@code ..}
 * @param source    the remote source, never null
 * @param consumer  the consumer, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Subscription(
    String accountId,
    EventSource source,
    EventConsumer consumer
) {

  /** Validates the components. */
  public Subscription {
    Objects.requireNonNull(accountId, "accountId must not be null");
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(consumer, "consumer must not be null");
    if (accountId.isBlank()) {
      throw new IllegalArgumentException("accountId must not be blank");
    }
    if (accountId.contains("/") || accountId.contains("\\")
        || accountId.equals(".") || accountId.equals("..")) {
      throw new IllegalArgumentException(
          "accountId must be a plain name, got: " + accountId);
    }
  }
}
