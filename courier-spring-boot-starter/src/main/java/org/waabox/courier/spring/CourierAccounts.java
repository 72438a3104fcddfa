package org.waabox.courier.spring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.source.http.HttpEventSource;
import org.waabox.courier.source.http.HttpEventSourceConfig;

/**
 * The HTTP event sources of the served accounts.
 *
 * <p>An account is served when it is enabled and has both a token and an
 * API URL. Applications use {@link #sendMessage} to answer the events
 * they receive.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CourierAccounts {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CourierAccounts.class);

  /** The sources of the served accounts, keyed by account id. */
  private final Map<String, HttpEventSource> sources;

  /**
   * Creates the sources of every served account.
   *
   * @param properties the validated properties, never null
   */
  public CourierAccounts(final CourierProperties properties) {
    Objects.requireNonNull(properties, "properties must not be null");

    final Map<String, HttpEventSource> served = new LinkedHashMap<>();
    properties.getAccounts().forEach((id, account) -> {
      if (!account.isEnabled()) {
        log.info("Courier account {} is disabled", id);
        return;
      }
      if (!account.isConfigured()) {
        log.warn("Courier account {} has no token or api-url, skipping", id);
        return;
      }
      served.put(id, new HttpEventSource(HttpEventSourceConfig.create(
          account.getApiUrl(), account.getToken(),
          properties.getRequestTimeout())));
    });
    sources = Collections.unmodifiableMap(served);
  }

  /**
   * Returns the sources of the served accounts.
   *
   * @return the sources keyed by account id, never null
   */
  public Map<String, HttpEventSource> sources() {
    return sources;
  }

  /**
   * Returns the source of one account.
   *
   * @param accountId the account, never null
   *
   * @return the source, empty if the account is not served
   */
  public Optional<HttpEventSource> source(final String accountId) {
    return Optional.ofNullable(sources.get(accountId));
  }

  /**
   * Sends a message as the bot of the given account.
   *
   * @param accountId the account, never null
   * @param userId    the addressed user, may be null
   * @param content   the text, never null
   * @param threadKey the task to attach to, may be null
   *
   * @throws IllegalArgumentException if the account is not served
   */
  public void sendMessage(final String accountId, final String userId,
      final String content, final String threadKey) {
    source(accountId)
        .orElseThrow(() -> new IllegalArgumentException(
            "Courier account is not served: " + accountId))
        .sendMessage(userId, content, threadKey);
  }
}
