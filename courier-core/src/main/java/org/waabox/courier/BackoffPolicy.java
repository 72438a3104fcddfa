package org.waabox.courier;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Defines the reconnect delay of a supervisor loop: an exponential backoff
 * with a ceiling and a random jitter.
 *
 * <p>For attempt {@code n} the base delay is
 * {@code min(initial * factor^n, cap)}. The effective delay adds a uniform
 * jitter of up to 25% of the base delay.
 *
 * <p>Instances are created through static factory methods. The default
 * policy starts at 2 seconds, grows by a factor of 1.8 and is capped at
 * 30 seconds.
 *
 * <p>This class is immutable and thread-safe. The attempt counter lives in
 * {@link Backoff}, created per supervisor loop through {@link #start()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default initial delay. */
  private static final Duration DEFAULT_INITIAL = Duration.ofSeconds(2);

  /** The default growth factor. */
  private static final double DEFAULT_FACTOR = 1.8;

  /** The default delay ceiling. */
  private static final Duration DEFAULT_CAP = Duration.ofSeconds(30);

  /** The share of the base delay added at most as jitter. */
  private static final double JITTER_RATIO = 0.25;

  /** The delay of the first attempt. */
  private final Duration initial;

  /** The growth factor between attempts. */
  private final double factor;

  /** The maximum base delay. */
  private final Duration cap;

  /** Source of uniform random values in [0, 1). */
  private final DoubleSupplier random;

  /**
   * Creates a new backoff policy.
   *
   * @param theInitial the initial delay, never null
   * @param theFactor  the growth factor, at least 1
   * @param theCap     the delay ceiling, never null
   * @param theRandom  the jitter source, never null
   */
  private BackoffPolicy(final Duration theInitial, final double theFactor,
      final Duration theCap, final DoubleSupplier theRandom) {
    initial = theInitial;
    factor = theFactor;
    cap = theCap;
    random = theRandom;
  }

  /**
   * Creates a backoff policy with the given parameters.
   *
   * @param initial the delay of the first attempt, must be positive
   * @param factor  the growth factor, must be at least 1
   * @param cap     the delay ceiling, must not be lower than initial
   *
   * @return a new backoff policy, never null
   *
   * @throws NullPointerException     if initial or cap is null
   * @throws IllegalArgumentException if any value is out of range
   */
  public static BackoffPolicy of(final Duration initial, final double factor,
      final Duration cap) {
    return of(initial, factor, cap,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a backoff policy with a custom jitter source.
   *
   * @param initial the delay of the first attempt, must be positive
   * @param factor  the growth factor, must be at least 1
   * @param cap     the delay ceiling, must not be lower than initial
   * @param random  supplies uniform values in [0, 1), never null
   *
   * @return a new backoff policy, never null
   *
   * @throws NullPointerException     if any reference argument is null
   * @throws IllegalArgumentException if any value is out of range
   */
  public static BackoffPolicy of(final Duration initial, final double factor,
      final Duration cap, final DoubleSupplier random) {
    Objects.requireNonNull(initial, "initial must not be null");
    Objects.requireNonNull(cap, "cap must not be null");
    Objects.requireNonNull(random, "random must not be null");
    if (initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException(
          "initial must be positive, got: " + initial);
    }
    if (factor < 1.0 || Double.isNaN(factor)) {
      throw new IllegalArgumentException(
          "factor must be at least 1, got: " + factor);
    }
    if (cap.compareTo(initial) < 0) {
      throw new IllegalArgumentException(
          "cap must not be lower than initial, got: " + cap);
    }
    return new BackoffPolicy(initial, factor, cap, random);
  }

  /**
   * Creates a backoff policy with sensible defaults: 2 seconds initial,
   * factor 1.8, capped at 30 seconds.
   *
   * @return the default backoff policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return of(DEFAULT_INITIAL, DEFAULT_FACTOR, DEFAULT_CAP);
  }

  /**
   * Returns the delay of the given attempt without jitter.
   *
   * @param attempt the zero-based attempt number, never negative
   *
   * @return the base delay, between initial and cap, never null
   */
  public Duration baseDelay(final int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException(
          "attempt must not be negative, got: " + attempt);
    }
    final double millis = initial.toMillis() * Math.pow(factor, attempt);
    if (Double.isInfinite(millis) || millis >= cap.toMillis()) {
      return cap;
    }
    return Duration.ofMillis(Math.round(millis));
  }

  /**
   * Returns the delay of the given attempt including jitter.
   *
   * @param attempt the zero-based attempt number, never negative
   *
   * @return the delay, at most 25% above the base delay, never null
   */
  public Duration delay(final int attempt) {
    final Duration base = baseDelay(attempt);
    final double sample = Math.min(Math.max(random.getAsDouble(), 0.0), 1.0);
    final long jitter = (long) (base.toMillis() * JITTER_RATIO * sample);
    return base.plusMillis(jitter);
  }

  /**
   * Starts a new attempt counter bound to this policy.
   *
   * @return a fresh backoff at attempt zero, never null
   */
  public Backoff start() {
    return new Backoff(this);
  }

  /**
   * Returns the delay of the first attempt.
   *
   * @return the initial delay, never null
   */
  public Duration initial() {
    return initial;
  }

  /**
   * Returns the growth factor.
   *
   * @return the factor, at least 1
   */
  public double factor() {
    return factor;
  }

  /**
   * Returns the delay ceiling.
   *
   * @return the cap, never null
   */
  public Duration cap() {
    return cap;
  }
}
