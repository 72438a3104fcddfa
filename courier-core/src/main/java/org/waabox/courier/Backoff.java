package org.waabox.courier;

import java.time.Duration;
import java.util.Objects;

/**
 * The attempt counter of one supervisor loop.
 *
 * <p>Not thread-safe: owned by a single supervisor thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Backoff {

  /** The policy computing the delays, never null. */
  private final BackoffPolicy policy;

  /** The number of delays handed out since the last reset. */
  private int attempt;

  /**
   * Creates a backoff at attempt zero.
   *
   * @param thePolicy the policy, never null
   */
  Backoff(final BackoffPolicy thePolicy) {
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
  }

  /**
   * Returns the delay of the current attempt and advances the counter.
   *
   * @return the delay to wait before reconnecting, never null
   */
  public Duration next() {
    final Duration delay = policy.delay(attempt);
    if (attempt < Integer.MAX_VALUE) {
      attempt++;
    }
    return delay;
  }

  /** Resets the counter after a successful connection. */
  public void reset() {
    attempt = 0;
  }

  /**
   * Returns the current attempt number.
   *
   * @return the number of delays handed out since the last reset
   */
  public int attempt() {
    return attempt;
  }
}
