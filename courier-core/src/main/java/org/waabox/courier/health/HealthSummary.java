package org.waabox.courier.health;

import java.time.Duration;

/**
 * A point-in-time view of the counters of one account.
 *
 * @param accountId        the account, never null
 * @param uptime           the time since the account was registered,
 *                         never null
 * @param reconnects       the number of supervisor reconnects
 * @param delivered        the number of events handed to the consumer
 * @param failedDeliveries the number of events the consumer rejected
 * @param failedPolls      the number of poll cycles that failed to fetch
 * @param synchronizedOnce whether the account completed its first
 *                         synchronization
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HealthSummary(
    String accountId,
    Duration uptime,
    long reconnects,
    long delivered,
    long failedDeliveries,
    long failedPolls,
    boolean synchronizedOnce
) {
}
