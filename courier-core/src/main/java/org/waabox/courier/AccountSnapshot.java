package org.waabox.courier;

import java.time.Instant;
import java.util.Objects;

import org.waabox.courier.health.ProbeResult;

/**
 * An immutable view of the connection state of one account.
 *
 * @param accountId   the account, never null
 * @param enabled     whether the account is enabled
 * @param configured  whether the account has complete credentials
 * @param mode        the current transport mode, null before the first
 *                    connection attempt
 * @param running     whether a session or the polling fallback is active
 * @param lastStartAt when the account last became running, may be null
 * @param lastStopAt  when the account last stopped running, may be null
 * @param lastError   the last failure description, may be null
 * @param probe       the last reachability check, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AccountSnapshot(
    String accountId,
    boolean enabled,
    boolean configured,
    TransportMode mode,
    boolean running,
    Instant lastStartAt,
    Instant lastStopAt,
    String lastError,
    ProbeResult probe
) {

  /** Validates the account id. */
  public AccountSnapshot {
    Objects.requireNonNull(accountId, "accountId must not be null");
  }

  /**
   * Creates the snapshot of an account that is not served by a running
   * supervisor.
   *
   * @param accountId  the account, never null
   * @param enabled    whether the account is enabled
   * @param configured whether the account has complete credentials
   *
   * @return the snapshot, never null
   */
  public static AccountSnapshot idle(final String accountId,
      final boolean enabled, final boolean configured) {
    return new AccountSnapshot(accountId, enabled, configured, null, false,
        null, null, null, null);
  }

  /**
   * Returns a copy carrying the given probe result.
   *
   * @param theProbe the probe result, may be null
   *
   * @return the copy, never null
   */
  public AccountSnapshot withProbe(final ProbeResult theProbe) {
    return new AccountSnapshot(accountId, enabled, configured, mode, running,
        lastStartAt, lastStopAt, lastError, theProbe);
  }
}
