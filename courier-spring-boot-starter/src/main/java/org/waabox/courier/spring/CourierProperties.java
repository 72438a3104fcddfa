package org.waabox.courier.spring;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Courier, mapped from the {@code courier.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code courier.state-dir} - where the per-account cursors are
 *       kept.</li>
 *   <li>{@code courier.accounts.<id>.token}, {@code .api-url} and
 *       {@code .enabled} - one entry per bot account.</li>
 *   <li>{@code courier.backoff.*}, {@code courier.push.*} and
 *       {@code courier.fallback.*} - reconnection tunables.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

  /** The prefix every bot token carries. */
  static final String TOKEN_PREFIX = "bot_";

  /** The directory holding the cursor files. */
  private String stateDir = ".courier/state";

  /** The per-request timeout against the API. */
  private Duration requestTimeout = Duration.ofSeconds(30);

  /** How long a status probe may take. */
  private Duration probeTimeout = Duration.ofSeconds(5);

  /** The time between periodic health summaries. */
  private Duration healthSummaryInterval = Duration.ofMinutes(5);

  /** The accounts, keyed by account id. */
  private Map<String, Account> accounts = new LinkedHashMap<>();

  /** Reconnection backoff settings. */
  private final Backoff backoff = new Backoff();

  /** Push session settings. */
  private final Push push = new Push();

  /** Polling fallback settings. */
  private final Fallback fallback = new Fallback();

  public String getStateDir() {
    return stateDir;
  }

  public void setStateDir(final String stateDir) {
    this.stateDir = stateDir;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(final Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public Duration getProbeTimeout() {
    return probeTimeout;
  }

  public void setProbeTimeout(final Duration probeTimeout) {
    this.probeTimeout = probeTimeout;
  }

  public Duration getHealthSummaryInterval() {
    return healthSummaryInterval;
  }

  public void setHealthSummaryInterval(final Duration interval) {
    this.healthSummaryInterval = interval;
  }

  public Map<String, Account> getAccounts() {
    return accounts;
  }

  public void setAccounts(final Map<String, Account> accounts) {
    this.accounts = accounts;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public Push getPush() {
    return push;
  }

  public Fallback getFallback() {
    return fallback;
  }

  /**
   * Checks the settings of every enabled and configured account.
   *
   * <p>Accounts that are disabled or lack credentials are not checked;
   * they are reported as status issues instead.
   *
   * @return the problems found, empty when everything is valid
   */
  public List<String> validate() {
    final List<String> problems = new ArrayList<>();
    accounts.forEach((id, account) -> {
      if (!account.isEnabled() || !account.isConfigured()) {
        return;
      }
      if (!account.getToken().startsWith(TOKEN_PREFIX)) {
        problems.add("courier.accounts." + id
            + ".token must start with " + TOKEN_PREFIX);
      }
      if (!isHttpUrl(account.getApiUrl())) {
        problems.add("courier.accounts." + id
            + ".api-url must be an http or https URL");
      }
    });
    return problems;
  }

  private static boolean isHttpUrl(final String value) {
    try {
      final URI uri = URI.create(value);
      return ("http".equalsIgnoreCase(uri.getScheme())
          || "https".equalsIgnoreCase(uri.getScheme()))
          && uri.getHost() != null;
    } catch (final IllegalArgumentException e) {
      return false;
    }
  }

  /** One bot account. */
  public static class Account {

    /** The bot token, {@code bot_...}. */
    private String token;

    /** The API base URL. */
    private String apiUrl;

    /** Whether the account is served. */
    private boolean enabled = true;

    public String getToken() {
      return token;
    }

    public void setToken(final String token) {
      this.token = token;
    }

    public String getApiUrl() {
      return apiUrl;
    }

    public void setApiUrl(final String apiUrl) {
      this.apiUrl = apiUrl;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(final boolean enabled) {
      this.enabled = enabled;
    }

    /**
     * Whether both the token and the API URL are set.
     *
     * @return true if the account has complete credentials
     */
    public boolean isConfigured() {
      return token != null && !token.isBlank()
          && apiUrl != null && !apiUrl.isBlank();
    }
  }

  /** Reconnection backoff settings. */
  public static class Backoff {

    private Duration initial = Duration.ofSeconds(2);

    private double factor = 1.8;

    private Duration cap = Duration.ofSeconds(30);

    public Duration getInitial() {
      return initial;
    }

    public void setInitial(final Duration initial) {
      this.initial = initial;
    }

    public double getFactor() {
      return factor;
    }

    public void setFactor(final double factor) {
      this.factor = factor;
    }

    public Duration getCap() {
      return cap;
    }

    public void setCap(final Duration cap) {
      this.cap = cap;
    }
  }

  /** Push session settings. */
  public static class Push {

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration pingInterval = Duration.ofMinutes(5);

    private Duration pongTimeout = Duration.ofSeconds(30);

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getPingInterval() {
      return pingInterval;
    }

    public void setPingInterval(final Duration pingInterval) {
      this.pingInterval = pingInterval;
    }

    public Duration getPongTimeout() {
      return pongTimeout;
    }

    public void setPongTimeout(final Duration pongTimeout) {
      this.pongTimeout = pongTimeout;
    }
  }

  /** Polling fallback settings. */
  public static class Fallback {

    private int cycles = 10;

    private Duration interval = Duration.ofSeconds(30);

    public int getCycles() {
      return cycles;
    }

    public void setCycles(final int cycles) {
      this.cycles = cycles;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(final Duration interval) {
      this.interval = interval;
    }
  }
}
