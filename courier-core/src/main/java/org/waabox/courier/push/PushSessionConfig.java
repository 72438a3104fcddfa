package org.waabox.courier.push;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing settings of a push session.
 *
 * <p>Defaults: 10 seconds to connect, a keepalive every 5 minutes (half the
 * remote idle timeout) and 30 seconds to receive its answer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PushSessionConfig {

  /** The default connect timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The default keepalive interval. */
  private static final Duration DEFAULT_PING_INTERVAL = Duration.ofMinutes(5);

  /** The default keepalive answer timeout. */
  private static final Duration DEFAULT_PONG_TIMEOUT = Duration.ofSeconds(30);

  /** How long opening a connection may take, never null. */
  private final Duration connectTimeout;

  /** The time between keepalive pings, never null. */
  private final Duration pingInterval;

  /** How long to wait for a keepalive answer, never null. */
  private final Duration pongTimeout;

  /**
   * Creates a new config.
   *
   * @param theConnectTimeout the connect timeout, never null
   * @param thePingInterval   the keepalive interval, never null
   * @param thePongTimeout    the keepalive answer timeout, never null
   */
  private PushSessionConfig(final Duration theConnectTimeout,
      final Duration thePingInterval, final Duration thePongTimeout) {
    connectTimeout = theConnectTimeout;
    pingInterval = thePingInterval;
    pongTimeout = thePongTimeout;
  }

  /**
   * Creates a config with the default timings.
   *
   * @return the config, never null
   */
  public static PushSessionConfig create() {
    return new PushSessionConfig(DEFAULT_CONNECT_TIMEOUT,
        DEFAULT_PING_INTERVAL, DEFAULT_PONG_TIMEOUT);
  }

  /**
   * Creates a config.
   *
   * @param connectTimeout the connect timeout, positive
   * @param pingInterval   the keepalive interval, positive
   * @param pongTimeout    the keepalive answer timeout, positive
   *
   * @return the config, never null
   *
   * @throws IllegalArgumentException if a duration is not positive
   */
  public static PushSessionConfig create(final Duration connectTimeout,
      final Duration pingInterval, final Duration pongTimeout) {
    return new PushSessionConfig(
        positive(connectTimeout, "connectTimeout"),
        positive(pingInterval, "pingInterval"),
        positive(pongTimeout, "pongTimeout"));
  }

  /**
   * Checks that a duration is positive.
   *
   * @param value the duration
   * @param name  the setting name, for the message
   *
   * @return the duration
   */
  private static Duration positive(final Duration value, final String name) {
    Objects.requireNonNull(value, name + " must not be null");
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration pingInterval() {
    return pingInterval;
  }

  public Duration pongTimeout() {
    return pongTimeout;
  }

  @Override
  public String toString() {
    return "PushSessionConfig{connectTimeout=" + connectTimeout
        + ", pingInterval=" + pingInterval
        + ", pongTimeout=" + pongTimeout + "}";
  }
}
