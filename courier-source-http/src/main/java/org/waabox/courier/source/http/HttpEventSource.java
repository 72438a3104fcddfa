package org.waabox.courier.source.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.EventSource;
import org.waabox.courier.event.EventSourceException;
import org.waabox.courier.health.ProbeResult;

/**
 * {@link EventSource} backed by the remote RPC API over HTTP.
 *
 * <p>Queries are sent as {@code GET {apiUrl}/{procedure}?input={json}},
 * mutations as {@code POST {apiUrl}/{procedure}} with a JSON body. Every
 * request carries {@code Authorization: Bot <token>}. Uses Java's built-in
 * {@code java.net.http.HttpClient}; one client is shared by every call.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpEventSource source = new HttpEventSource(
 *     HttpEventSourceConfig.create("https://api.example.com/trpc",
 *         "bot_abc"));
 * EventPage page = source.listEvents(Cursor.absent());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpEventSource implements EventSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpEventSource.class);

  /** Lists messages after a cursor. */
  static final String LIST_PROCEDURE = "messages.list";

  /** Issues a push connection ticket. */
  static final String TICKET_PROCEDURE = "messages.wsTicket";

  /** Sends a message as the bot. */
  static final String SEND_PROCEDURE = "messages.send";

  /** Cheap authenticated query used to probe credentials. */
  static final String PROBE_PROCEDURE = "projects.list";

  /** The configuration, never null. */
  private final HttpEventSourceConfig config;

  /** The shared HTTP client, never null. */
  private final HttpClient client;

  /** Whether the unencrypted push endpoint warning was already logged. */
  private final AtomicBoolean insecureWarned = new AtomicBoolean();

  /**
   * Creates a new source with its own HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public HttpEventSource(final HttpEventSourceConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(theConfig.requestTimeout())
        .build());
  }

  /**
   * Creates a new source using the given HTTP client.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   */
  public HttpEventSource(final HttpEventSourceConfig theConfig,
      final HttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    client = Objects.requireNonNull(theClient, "client cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public ConnectionTicket requestConnectionCredential() {
    final JsonNode data = mutation(TICKET_PROCEDURE, MessageCodec.object());
    final ConnectionTicket ticket;
    try {
      ticket = MessageCodec.parseTicket(data);
    } catch (final IllegalArgumentException e) {
      throw new EventSourceException(
          "Malformed response from " + TICKET_PROCEDURE, e);
    }
    if (ticket.endpoint().startsWith("ws://")
        && insecureWarned.compareAndSet(false, true)) {
      log.warn("Push endpoint {} is not encrypted, prefer wss://",
          ticket.endpoint());
    }
    return ticket;
  }

  /** {@inheritDoc} */
  @Override
  public EventPage listEvents(final Cursor cursor) {
    Objects.requireNonNull(cursor, "cursor cannot be null");

    final ObjectNode input = MessageCodec.object();
    input.put("cursor", cursor.token().orElse(null));

    final JsonNode data = query(LIST_PROCEDURE, input,
        config.requestTimeout());
    try {
      return MessageCodec.parsePage(data);
    } catch (final IllegalArgumentException e) {
      throw new EventSourceException(
          "Malformed response from " + LIST_PROCEDURE, e);
    }
  }

  /**
   * Sends a message to a user as the bot.
   *
   * @param userId    the addressed user, may be null to let the API pick
   *                  the default conversation
   * @param content   the message text, never null
   * @param threadKey the task to attach the message to, may be null
   *
   * @throws EventSourceException if the request fails
   */
  public void sendMessage(final String userId, final String content,
      final String threadKey) {
    Objects.requireNonNull(content, "content cannot be null");

    final ObjectNode body = MessageCodec.object();
    if (userId != null) {
      body.put("userId", userId);
    }
    body.put("content", content);
    if (threadKey != null) {
      body.put("taskId", threadKey);
    }
    mutation(SEND_PROCEDURE, body);
  }

  /**
   * Checks that the API is reachable and accepts the bot token.
   *
   * <p>Never throws; every failure becomes a failed result.
   *
   * @param timeout how long to wait for the answer, never null
   *
   * @return the probe outcome, never null
   */
  public ProbeResult probe(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    try {
      final HttpResponse<String> response = client.send(
          queryRequest(PROBE_PROCEDURE, MessageCodec.object(), timeout),
          HttpResponse.BodyHandlers.ofString());
      if (!isSuccess(response.statusCode())) {
        return ProbeResult.failure("HTTP " + response.statusCode());
      }
      return ProbeResult.success();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return ProbeResult.failure("probe interrupted");
    } catch (final IOException | RuntimeException e) {
      log.debug("Probe against {} failed", config.apiUrl(), e);
      return ProbeResult.failure(describe(e));
    }
  }

  /**
   * Runs a GET query and returns its {@code result.data} node.
   *
   * @param procedure the procedure name, never null
   * @param input     the input object, never null
   * @param timeout   the request timeout, never null
   *
   * @return the data node, never null
   */
  private JsonNode query(final String procedure, final ObjectNode input,
      final Duration timeout) {
    return execute(procedure, queryRequest(procedure, input, timeout),
        timeout);
  }

  /**
   * Runs a POST mutation and returns its {@code result.data} node.
   *
   * @param procedure the procedure name, never null
   * @param body      the JSON body, never null
   *
   * @return the data node, never null
   */
  private JsonNode mutation(final String procedure, final ObjectNode body) {
    final HttpRequest request = authorized(procedure,
        URI.create(config.apiUrl() + "/" + procedure),
        config.requestTimeout())
        .POST(HttpRequest.BodyPublishers.ofString(body.toString(),
            StandardCharsets.UTF_8))
        .build();
    return execute(procedure, request, config.requestTimeout());
  }

  private HttpRequest queryRequest(final String procedure,
      final ObjectNode input, final Duration timeout) {
    final String encoded = URLEncoder.encode(input.toString(),
        StandardCharsets.UTF_8);
    return authorized(procedure,
        URI.create(config.apiUrl() + "/" + procedure + "?input=" + encoded),
        timeout)
        .GET()
        .build();
  }

  private HttpRequest.Builder authorized(final String procedure,
      final URI uri, final Duration timeout) {
    return HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Authorization", "Bot " + config.botToken())
        .header("Content-Type", "application/json");
  }

  /**
   * Sends the request and unwraps the response.
   *
   * @param procedure the procedure name, for error messages
   * @param request   the request, never null
   * @param timeout   the timeout used, for error messages
   *
   * @return the {@code result.data} node, never null
   *
   * @throws EventSourceException on transport failure, non-2xx status or
   *         an unparseable body
   */
  private JsonNode execute(final String procedure, final HttpRequest request,
      final Duration timeout) {
    final HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final HttpTimeoutException e) {
      throw new EventSourceException("API timeout: " + procedure
          + " did not respond within " + timeout.toMillis() + "ms", e);
    } catch (final IOException e) {
      throw new EventSourceException("API request " + procedure
          + " failed: " + describe(e), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EventSourceException("API request " + procedure
          + " interrupted", e);
    }

    final int status = response.statusCode();
    if (!isSuccess(status)) {
      log.debug("{} answered HTTP {}: {}", procedure, status,
          response.body());
      throw new EventSourceException("API error: " + status + " on "
          + procedure + ": " + response.body(), status);
    }

    try {
      return MessageCodec.unwrap(response.body());
    } catch (final IllegalArgumentException e) {
      throw new EventSourceException(
          "Malformed response from " + procedure, e);
    }
  }

  private static boolean isSuccess(final int status) {
    return status >= 200 && status < 300;
  }

  private static String describe(final Throwable e) {
    return e.getMessage() != null ? e.getMessage()
        : e.getClass().getSimpleName();
  }
}
