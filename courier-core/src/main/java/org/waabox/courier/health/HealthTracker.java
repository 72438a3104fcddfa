package org.waabox.courier.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.courier.metrics.CourierMetrics;
import org.waabox.courier.metrics.NoopCourierMetrics;

/**
 * Aggregates per-account delivery counters and periodically logs a summary.
 *
 * <p>Every observation is also forwarded to the configured
 * {@link CourierMetrics}. The tracker has no effect on control flow: none
 * of its methods throw, failures of the metrics hook are logged and
 * dropped.
 *
 * <p>One instance is owned by a {@link org.waabox.courier.Courier} and
 * passed to each of its supervisors; counters are keyed by account.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HealthTracker {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HealthTracker.class);

  /** The metrics hook, never null. */
  private final CourierMetrics metrics;

  /** The clock used for uptime, never null. */
  private final Clock clock;

  /** The counters, keyed by account. */
  private final Map<String, Counters> counters = new ConcurrentHashMap<>();

  /** Whether the periodic summary is scheduled. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** The scheduler emitting summaries, null until started. */
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a tracker without metrics hook using the system clock.
   */
  public HealthTracker() {
    this(new NoopCourierMetrics(), Clock.systemUTC());
  }

  /**
   * Creates a tracker.
   *
   * @param theMetrics the metrics hook, never null
   * @param theClock   the clock used for uptime, never null
   */
  public HealthTracker(final CourierMetrics theMetrics, final Clock theClock) {
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Starts tracking an account, resetting its uptime.
   *
   * @param accountId the account, never null
   */
  public void register(final String accountId) {
    counters.put(accountId, new Counters(clock.instant()));
  }

  /**
   * Records a reconnect of the supervisor loop.
   *
   * @param accountId the account, never null
   */
  public void recordReconnect(final String accountId) {
    counters(accountId).reconnects.incrementAndGet();
    forward(() -> metrics.reconnected(accountId));
  }

  /**
   * Records an event handed to the consumer.
   *
   * @param accountId the account, never null
   */
  public void recordDelivered(final String accountId) {
    counters(accountId).delivered.incrementAndGet();
    forward(() -> metrics.eventDelivered(accountId));
  }

  /**
   * Records an event the consumer failed to handle.
   *
   * @param accountId the account, never null
   * @param cause     the failure, never null
   */
  public void recordDeliveryFailure(final String accountId,
      final Throwable cause) {
    counters(accountId).failedDeliveries.incrementAndGet();
    forward(() -> metrics.deliveryFailed(accountId, cause));
  }

  /**
   * Records a poll cycle that failed to fetch its page.
   *
   * @param accountId the account, never null
   * @param cause     the failure, never null
   */
  public void recordPollFailure(final String accountId,
      final Throwable cause) {
    counters(accountId).failedPolls.incrementAndGet();
    forward(() -> metrics.pollFailed(accountId, cause));
  }

  /**
   * Records the first synchronization of an account.
   *
   * @param accountId the account, never null
   */
  public void recordSynchronized(final String accountId) {
    counters(accountId).synchronizedOnce.set(true);
  }

  /**
   * Returns the current summary of an account.
   *
   * @param accountId the account, never null
   *
   * @return the summary, empty if the account was never registered
   */
  public Optional<HealthSummary> summary(final String accountId) {
    final Counters c = counters.get(accountId);
    if (c == null) {
      return Optional.empty();
    }
    return Optional.of(c.toSummary(accountId, clock.instant()));
  }

  /**
   * Returns the summaries of every tracked account.
   *
   * @return the summaries ordered by account, never null
   */
  public List<HealthSummary> summaries() {
    final Instant now = clock.instant();
    return counters.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .map(e -> e.getValue().toSummary(e.getKey(), now))
        .collect(Collectors.toList());
  }

  /**
   * Starts logging a summary of every account at a fixed interval.
   *
   * <p>Calling this method more than once has no effect.
   *
   * @param interval the summary interval, never null and positive
   */
  public void start(final Duration interval) {
    Objects.requireNonNull(interval, "interval must not be null");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException(
          "interval must be positive, got: " + interval);
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    final ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(r -> {
          final Thread thread = new Thread(r, "courier-health");
          thread.setDaemon(true);
          return thread;
        });
    executor.scheduleAtFixedRate(this::logSummaries, interval.toMillis(),
        interval.toMillis(), TimeUnit.MILLISECONDS);
    scheduler = executor;
  }

  /** Stops the periodic summary. */
  public void stop() {
    final ScheduledExecutorService executor = scheduler;
    if (executor != null) {
      executor.shutdownNow();
      scheduler = null;
    }
    started.set(false);
  }

  /** Logs one summary line per account. */
  void logSummaries() {
    try {
      for (final HealthSummary s : summaries()) {
        log.info("Account '{}': up {}s, {} delivered, {} failed deliveries,"
            + " {} failed polls, {} reconnects", s.accountId(),
            s.uptime().toSeconds(), s.delivered(), s.failedDeliveries(),
            s.failedPolls(), s.reconnects());
      }
    } catch (final Exception e) {
      log.warn("Failed to log health summary: {}", e.getMessage(), e);
    }
  }

  /**
   * Returns the counters of an account, registering it if needed.
   *
   * @param accountId the account, never null
   *
   * @return the counters, never null
   */
  private Counters counters(final String accountId) {
    return counters.computeIfAbsent(accountId,
        id -> new Counters(clock.instant()));
  }

  /**
   * Calls the metrics hook, logging any failure.
   *
   * @param call the hook invocation, never null
   */
  private static void forward(final Runnable call) {
    try {
      call.run();
    } catch (final Exception e) {
      log.warn("Metrics hook failed: {}", e.getMessage(), e);
    }
  }

  /** The mutable counters of one account. */
  private static final class Counters {

    /** When tracking started. */
    private final Instant startedAt;

    /** Reconnect count. */
    private final AtomicLong reconnects = new AtomicLong();

    /** Delivered event count. */
    private final AtomicLong delivered = new AtomicLong();

    /** Failed delivery count. */
    private final AtomicLong failedDeliveries = new AtomicLong();

    /** Failed poll count. */
    private final AtomicLong failedPolls = new AtomicLong();

    /** First synchronization flag. */
    private final AtomicBoolean synchronizedOnce = new AtomicBoolean();

    /**
     * Creates zeroed counters.
     *
     * @param theStartedAt the tracking start, never null
     */
    private Counters(final Instant theStartedAt) {
      startedAt = theStartedAt;
    }

    /**
     * Takes a snapshot of the counters.
     *
     * @param accountId the account, never null
     * @param now       the reference instant, never null
     *
     * @return the summary, never null
     */
    private HealthSummary toSummary(final String accountId,
        final Instant now) {
      return new HealthSummary(accountId, Duration.between(startedAt, now),
          reconnects.get(), delivered.get(), failedDeliveries.get(),
          failedPolls.get(), synchronizedOnce.get());
    }
  }
}
