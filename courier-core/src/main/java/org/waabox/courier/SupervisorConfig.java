package org.waabox.courier;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the polling fallback a supervisor runs when no push
 * connection can be obtained.
 *
 * <p>Defaults: 10 poll cycles, 30 seconds apart, before the connection
 * credential is requested again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SupervisorConfig {

  /** The default number of fallback cycles. */
  private static final int DEFAULT_FALLBACK_CYCLES = 10;

  /** The default time between fallback cycles. */
  private static final Duration DEFAULT_FALLBACK_INTERVAL =
      Duration.ofSeconds(30);

  /** The number of poll cycles per fallback round, positive. */
  private final int fallbackCycles;

  /** The time between fallback cycles, never null. */
  private final Duration fallbackInterval;

  /**
   * Creates a new config.
   *
   * @param theFallbackCycles   the cycles per round
   * @param theFallbackInterval the time between cycles
   */
  private SupervisorConfig(final int theFallbackCycles,
      final Duration theFallbackInterval) {
    fallbackCycles = theFallbackCycles;
    fallbackInterval = theFallbackInterval;
  }

  /**
   * Creates a config with the default settings.
   *
   * @return the config, never null
   */
  public static SupervisorConfig create() {
    return new SupervisorConfig(DEFAULT_FALLBACK_CYCLES,
        DEFAULT_FALLBACK_INTERVAL);
  }

  /**
   * Creates a config.
   *
   * @param fallbackCycles   the poll cycles per fallback round, positive
   * @param fallbackInterval the time between cycles, not negative
   *
   * @return the config, never null
   *
   * @throws IllegalArgumentException if a setting is out of range
   */
  public static SupervisorConfig create(final int fallbackCycles,
      final Duration fallbackInterval) {
    Objects.requireNonNull(fallbackInterval,
        "fallbackInterval must not be null");
    if (fallbackCycles < 1) {
      throw new IllegalArgumentException(
          "fallbackCycles must be positive, got: " + fallbackCycles);
    }
    if (fallbackInterval.isNegative()) {
      throw new IllegalArgumentException(
          "fallbackInterval must not be negative");
    }
    return new SupervisorConfig(fallbackCycles, fallbackInterval);
  }

  public int fallbackCycles() {
    return fallbackCycles;
  }

  public Duration fallbackInterval() {
    return fallbackInterval;
  }

  @Override
  public String toString() {
    return "SupervisorConfig{fallbackCycles=" + fallbackCycles
        + ", fallbackInterval=" + fallbackInterval + "}";
  }
}
