package org.waabox.courier.source.http;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for {@link HttpEventSource}.
 *
 * <p>Holds the base URL of the remote RPC API, the bot token sent with
 * every request and the per-request timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpEventSourceConfig {

  /** The default per-request timeout. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(30);

  /** The API base URL without trailing slash. */
  private final String apiUrl;

  /** The bot token. */
  private final String botToken;

  /** The per-request timeout. */
  private final Duration requestTimeout;

  /**
   * Private constructor; use the static factory methods.
   *
   * @param theApiUrl         the API base URL, never null
   * @param theBotToken       the bot token, never null
   * @param theRequestTimeout the per-request timeout, never null
   */
  private HttpEventSourceConfig(final String theApiUrl,
      final String theBotToken, final Duration theRequestTimeout) {
    apiUrl = theApiUrl;
    botToken = theBotToken;
    requestTimeout = theRequestTimeout;
  }

  /**
   * Creates a configuration with the default request timeout of 30 seconds.
   *
   * @param apiUrl   the API base URL, http or https, never null
   * @param botToken the bot token, never null or blank
   *
   * @return a new configuration, never null
   */
  public static HttpEventSourceConfig create(final String apiUrl,
      final String botToken) {
    return create(apiUrl, botToken, DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * Creates a configuration.
   *
   * @param apiUrl         the API base URL, http or https, never null
   * @param botToken       the bot token, never null or blank
   * @param requestTimeout the per-request timeout, positive
   *
   * @return a new configuration, never null
   *
   * @throws IllegalArgumentException if a value is invalid
   */
  public static HttpEventSourceConfig create(final String apiUrl,
      final String botToken, final Duration requestTimeout) {
    Objects.requireNonNull(apiUrl, "apiUrl cannot be null");
    Objects.requireNonNull(botToken, "botToken cannot be null");
    Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");

    final String scheme = URI.create(apiUrl).getScheme();
    if (!"http".equalsIgnoreCase(scheme)
        && !"https".equalsIgnoreCase(scheme)) {
      throw new IllegalArgumentException(
          "apiUrl must use http or https, got: " + apiUrl);
    }
    if (botToken.isBlank()) {
      throw new IllegalArgumentException("botToken cannot be blank");
    }
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }

    String normalized = apiUrl;
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return new HttpEventSourceConfig(normalized, botToken, requestTimeout);
  }

  public String apiUrl() {
    return apiUrl;
  }

  public String botToken() {
    return botToken;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  @Override
  public String toString() {
    return "HttpEventSourceConfig{apiUrl=" + apiUrl
        + ", requestTimeout=" + requestTimeout + "}";
  }
}
