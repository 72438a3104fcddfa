package org.waabox.courier;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * The mutable connection state of one account.
 *
 * <p>Only the owning {@link ConnectionSupervisor} changes it; everybody
 * else reads it through {@link #snapshot()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class AccountConnection {

  /** The account, never null. */
  private final String accountId;

  /** Gives the transition timestamps, never null. */
  private final Clock clock;

  /** The current mode, null before the first attempt. */
  private TransportMode mode;

  /** Whether a session or the fallback is active. */
  private boolean running;

  /** When it last became running, may be null. */
  private Instant lastStartAt;

  /** When it last stopped running, may be null. */
  private Instant lastStopAt;

  /** The last failure, may be null. */
  private String lastError;

  /**
   * Creates the state of an account that never connected.
   *
   * @param theAccountId the account, never null
   * @param theClock     the clock, never null
   */
  AccountConnection(final String theAccountId, final Clock theClock) {
    accountId = Objects.requireNonNull(theAccountId,
        "accountId must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  synchronized void switchTo(final TransportMode theMode) {
    mode = theMode;
  }

  synchronized void markRunning() {
    running = true;
    lastStartAt = clock.instant();
  }

  /**
   * Marks the account as no longer running.
   *
   * @param error the failure that stopped it, null for a clean stop
   */
  synchronized void markStopped(final String error) {
    if (running) {
      lastStopAt = clock.instant();
    }
    running = false;
    if (error != null) {
      lastError = error;
    }
  }

  synchronized void recordError(final String error) {
    lastError = error;
  }

  synchronized AccountSnapshot snapshot() {
    return new AccountSnapshot(accountId, true, true, mode, running,
        lastStartAt, lastStopAt, lastError, null);
  }
}
