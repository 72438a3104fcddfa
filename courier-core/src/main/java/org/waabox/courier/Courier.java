package org.waabox.courier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.courier.cursor.CursorStore;
import org.waabox.courier.health.HealthTracker;
import org.waabox.courier.metrics.CourierMetrics;
import org.waabox.courier.metrics.NoopCourierMetrics;
import org.waabox.courier.poll.PollSerializer;
import org.waabox.courier.push.HintChannel;
import org.waabox.courier.push.PushSessionConfig;

/**
 * The main entry point of the Courier delivery gateway.
 *
 * <p>Courier keeps every subscribed account connected to its remote source
 * and hands new events to the account consumer, at least once and in
 * stream order. Each account runs its own {@link ConnectionSupervisor} on a
 * dedicated daemon thread; accounts never block each other.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Courier courier = Courier.builder()
 *     .cursorStore(new FileSystemCursorStore(stateDir))
 *     .hintChannel(new JdkWebSocketHintChannel(httpClient))
 *     .backoffPolicy(BackoffPolicy.defaultPolicy())
 *     .build();
 *
 * courier.subscribe(new Subscription("main", httpEventSource, consumer));
 * courier.start();
 * ...
 * courier.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Courier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Courier.class);

  /** How long {@link #stop()} waits for each supervisor thread. */
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

  /** The durable cursor storage. */
  private final CursorStore cursorStore;

  /** Opens the push connections. */
  private final HintChannel hintChannel;

  /** The push session timings. */
  private final PushSessionConfig pushConfig;

  /** The reconnect delays. */
  private final BackoffPolicy backoffPolicy;

  /** The polling fallback settings. */
  private final SupervisorConfig supervisorConfig;

  /** The time between health summaries. */
  private final Duration healthInterval;

  /** The clock for the state timestamps. */
  private final Clock clock;

  /** The health counters shared by all supervisors. */
  private final HealthTracker health;

  /** Orders the poll cycles of every account. */
  private final PollSerializer serializer = new PollSerializer();

  /** The subscriptions, keyed by account. */
  private final Map<String, Subscription> subscriptions =
      new ConcurrentHashMap<>();

  /** The running supervisors, keyed by account. */
  private final Map<String, Worker> workers = new ConcurrentHashMap<>();

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new Courier instance.
   *
   * @param theCursorStore      the cursor storage, never null
   * @param theHintChannel      opens push connections, never null
   * @param thePushConfig       the push timings, never null
   * @param theBackoffPolicy    the reconnect delays, never null
   * @param theSupervisorConfig the fallback settings, never null
   * @param theHealthInterval   the time between summaries, never null
   * @param theMetrics          the metrics hook, never null
   * @param theClock            the clock, never null
   */
  private Courier(final CursorStore theCursorStore,
      final HintChannel theHintChannel,
      final PushSessionConfig thePushConfig,
      final BackoffPolicy theBackoffPolicy,
      final SupervisorConfig theSupervisorConfig,
      final Duration theHealthInterval,
      final CourierMetrics theMetrics,
      final Clock theClock) {
    cursorStore = theCursorStore;
    hintChannel = theHintChannel;
    pushConfig = thePushConfig;
    backoffPolicy = theBackoffPolicy;
    supervisorConfig = theSupervisorConfig;
    healthInterval = theHealthInterval;
    clock = theClock;
    health = new HealthTracker(theMetrics, theClock);
  }

  /**
   * Creates a new builder for constructing a Courier instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes an account.
   *
   * @param subscription the account binding, never null
   *
   * @throws IllegalStateException    if this instance was already started
   * @throws IllegalArgumentException if the account is already subscribed
   */
  public void subscribe(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription must not be null");

    if (started.get()) {
      throw new IllegalStateException(
          "Cannot subscribe accounts after start() has been called");
    }

    final String accountId = subscription.accountId();
    final Subscription existing = subscriptions.putIfAbsent(accountId,
        subscription);
    if (existing != null) {
      throw new IllegalArgumentException(
          "Account '" + accountId + "' is already subscribed");
    }
  }

  /**
   * Starts one supervisor thread per subscribed account and the periodic
   * health summary.
   *
   * @throws IllegalStateException if this instance was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Courier has already been started");
    }

    for (final Subscription subscription : subscriptions.values()) {
      final String accountId = subscription.accountId();
      health.register(accountId);

      final ConnectionSupervisor supervisor = new ConnectionSupervisor(
          subscription, cursorStore, serializer, hintChannel, pushConfig,
          backoffPolicy, supervisorConfig, health, clock);
      final AbortSignal abortSignal = new AbortSignal();

      final Thread thread = new Thread(() -> supervise(supervisor,
          abortSignal), "courier-supervisor-" + accountId);
      thread.setDaemon(true);

      workers.put(accountId, new Worker(supervisor, abortSignal, thread));
      thread.start();
    }

    health.start(healthInterval);
    log.info("Courier started with {} account(s)", subscriptions.size());
  }

  /**
   * Stops every supervisor and waits for them to exit.
   *
   * <p>Calling this method more than once has no effect.
   */
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }

    for (final Worker worker : workers.values()) {
      worker.abortSignal().abort();
    }
    for (final Map.Entry<String, Worker> entry : workers.entrySet()) {
      final Thread thread = entry.getValue().thread();
      try {
        thread.join(STOP_TIMEOUT.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while stopping account '{}'", entry.getKey());
        break;
      }
      if (thread.isAlive()) {
        log.warn("Account '{}': supervisor did not stop within {}",
            entry.getKey(), STOP_TIMEOUT);
      }
    }

    serializer.close();
    health.stop();
    log.info("Courier stopped");
  }

  /**
   * Returns whether this instance was started and not yet stopped.
   *
   * @return true while running
   */
  public boolean isRunning() {
    return started.get() && !stopped.get();
  }

  /**
   * Returns the state of every subscribed account, ordered by account.
   *
   * @return the snapshots, never null
   */
  public List<AccountSnapshot> status() {
    final List<AccountSnapshot> result = new ArrayList<>();
    for (final Subscription subscription : subscriptions.values()) {
      final Worker worker = workers.get(subscription.accountId());
      result.add(worker != null
          ? worker.supervisor().snapshot()
          : AccountSnapshot.idle(subscription.accountId(), true, true));
    }
    result.sort(Comparator.comparing(AccountSnapshot::accountId));
    return List.copyOf(result);
  }

  /**
   * Returns the health counters of every account.
   *
   * @return the tracker, never null
   */
  public HealthTracker health() {
    return health;
  }

  /**
   * Runs a supervisor, logging anything escaping its loop.
   *
   * @param supervisor  the supervisor, never null
   * @param abortSignal its abort signal, never null
   */
  private static void supervise(final ConnectionSupervisor supervisor,
      final AbortSignal abortSignal) {
    try {
      supervisor.run(abortSignal);
    } catch (final RuntimeException e) {
      log.error("Account '{}': supervisor failed: {}",
          supervisor.accountId(), e.getMessage(), e);
    }
  }

  /** A running supervisor with its thread and abort signal. */
  private record Worker(
      ConnectionSupervisor supervisor,
      AbortSignal abortSignal,
      Thread thread) {
  }

  /**
   * Fluent builder for creating {@link Courier} instances.
   *
   * <p>A cursor store and a hint channel are required. Defaults:
   * <ul>
   *   <li>pushSessionConfig: {@link PushSessionConfig#create()}</li>
   *   <li>backoffPolicy: {@link BackoffPolicy#defaultPolicy()}</li>
   *   <li>supervisorConfig: {@link SupervisorConfig#create()}</li>
   *   <li>healthSummaryInterval: 5 minutes</li>
   *   <li>metrics: {@link NoopCourierMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The default time between health summaries. */
    private static final Duration DEFAULT_HEALTH_INTERVAL =
        Duration.ofMinutes(5);

    /** The cursor storage. */
    private CursorStore cursorStore;

    /** The push channel. */
    private HintChannel hintChannel;

    /** The optional push timings. */
    private PushSessionConfig pushSessionConfig;

    /** The optional reconnect delays. */
    private BackoffPolicy backoffPolicy;

    /** The optional fallback settings. */
    private SupervisorConfig supervisorConfig;

    /** The optional summary interval. */
    private Duration healthSummaryInterval;

    /** The optional metrics hook. */
    private CourierMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the storage of the account cursors.
     *
     * @param theCursorStore the cursor store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder cursorStore(final CursorStore theCursorStore) {
      Objects.requireNonNull(theCursorStore, "cursorStore must not be null");
      this.cursorStore = theCursorStore;
      return this;
    }

    /**
     * Sets the channel opening the push connections.
     *
     * @param theHintChannel the channel, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder hintChannel(final HintChannel theHintChannel) {
      Objects.requireNonNull(theHintChannel, "hintChannel must not be null");
      this.hintChannel = theHintChannel;
      return this;
    }

    /**
     * Sets the push session timings.
     *
     * @param theConfig the timings, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pushSessionConfig(final PushSessionConfig theConfig) {
      Objects.requireNonNull(theConfig, "pushSessionConfig must not be null");
      this.pushSessionConfig = theConfig;
      return this;
    }

    /**
     * Sets the reconnect delays.
     *
     * @param thePolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder backoffPolicy(final BackoffPolicy thePolicy) {
      Objects.requireNonNull(thePolicy, "backoffPolicy must not be null");
      this.backoffPolicy = thePolicy;
      return this;
    }

    /**
     * Sets the polling fallback settings.
     *
     * @param theConfig the settings, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder supervisorConfig(final SupervisorConfig theConfig) {
      Objects.requireNonNull(theConfig, "supervisorConfig must not be null");
      this.supervisorConfig = theConfig;
      return this;
    }

    /**
     * Sets the time between periodic health summaries.
     *
     * @param theInterval the interval, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder healthSummaryInterval(final Duration theInterval) {
      Objects.requireNonNull(theInterval,
          "healthSummaryInterval must not be null");
      if (theInterval.isNegative() || theInterval.isZero()) {
        throw new IllegalArgumentException(
            "healthSummaryInterval must be positive");
      }
      this.healthSummaryInterval = theInterval;
      return this;
    }

    /**
     * Sets the metrics hook.
     *
     * @param theMetrics the hook, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final CourierMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the clock of the state timestamps and uptime.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Builds the Courier instance with the configured settings.
     *
     * @return a new Courier instance, never null
     *
     * @throws IllegalStateException if the cursor store or the hint
     *                               channel is missing
     */
    public Courier build() {
      if (cursorStore == null) {
        throw new IllegalStateException("cursorStore must be set");
      }
      if (hintChannel == null) {
        throw new IllegalStateException("hintChannel must be set");
      }
      return new Courier(
          cursorStore,
          hintChannel,
          pushSessionConfig != null
              ? pushSessionConfig : PushSessionConfig.create(),
          backoffPolicy != null
              ? backoffPolicy : BackoffPolicy.defaultPolicy(),
          supervisorConfig != null
              ? supervisorConfig : SupervisorConfig.create(),
          healthSummaryInterval != null
              ? healthSummaryInterval : DEFAULT_HEALTH_INTERVAL,
          metrics != null ? metrics : new NoopCourierMetrics(),
          clock != null ? clock : Clock.systemUTC());
    }
  }
}
