package org.waabox.courier.source.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventOrigin;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.EventSourceException;
import org.waabox.courier.event.RemoteEvent;
import org.waabox.courier.health.ProbeResult;

/**
 * Tests for {@link HttpEventSource} against a real local HTTP server.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpEventSourceTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String PAGE = "{\"result\":{\"data\":{"
      + "\"items\":["
      + "{\"messageId\":\"m1\",\"botId\":\"b1\",\"userId\":\"u1\","
      + "\"authorType\":\"user\",\"content\":\"hello\","
      + "\"attachments\":[{\"name\":\"a.png\",\"contentType\":\"image/png\","
      + "\"size\":12,\"url\":\"https://files/a.png\"}],"
      + "\"taskId\":\"t9\",\"createdAt\":\"2024-01-01T10:00:00Z\","
      + "\"userName\":\"Ana\",\"botName\":\"Helper\"},"
      + "{\"messageId\":\"m2\",\"botId\":\"b1\",\"userId\":\"u1\","
      + "\"authorType\":\"bot\",\"content\":\"hi\",\"attachments\":[],"
      + "\"createdAt\":\"2024-01-01T10:00:01Z\",\"botName\":\"Helper\"}"
      + "],\"cursor\":\"c2\",\"hasMore\":true}}}";

  private HttpServer server;

  private final List<Recorded> requests = new CopyOnWriteArrayList<>();

  private volatile int status = 200;

  private volatile String body = PAGE;

  private volatile long delayMillis = 0;

  private String apiUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/trpc", this::handle);
    server.start();
    apiUrl = "http://localhost:" + server.getAddress().getPort() + "/trpc/";
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void whenListingEvents_givenTokenCursor_shouldSendItAndMapThePage()
      throws Exception {
    final EventPage page = source().listEvents(Cursor.token("c1"));

    final Recorded request = requests.get(0);
    assertEquals("GET", request.method());
    assertEquals("/trpc/messages.list", request.path());
    assertEquals("Bot bot_abc", request.authorization());
    assertEquals("c1", input(request).get("cursor").asText());

    assertEquals("c2", page.nextCursor());
    assertTrue(page.hasMore());
    assertEquals(2, page.items().size());

    final RemoteEvent user = page.items().get(0);
    assertEquals("m1", user.id());
    assertEquals(EventOrigin.EXTERNAL, user.origin());
    assertEquals("u1", user.authorId());
    assertEquals("Ana", user.authorName());
    assertEquals("b1", user.recipientId());
    assertEquals("t9", user.threadKey());
    assertEquals(Instant.parse("2024-01-01T10:00:00Z"), user.createdAt());
    assertEquals("https://files/a.png", user.attachments().get(0).url());
    assertEquals(12, user.attachments().get(0).size());

    final RemoteEvent bot = page.items().get(1);
    assertEquals(EventOrigin.SUBSCRIBER, bot.origin());
    assertEquals("b1", bot.authorId());
    assertTrue(bot.isSelfAuthored());
    assertNull(bot.threadKey());
  }

  @Test
  void whenListingEvents_givenSeededCursor_shouldSendNoCursor()
      throws Exception {
    source().listEvents(Cursor.seeded());

    assertTrue(input(requests.get(0)).get("cursor").isNull());
  }

  @Test
  void whenListingEvents_givenNullPageCursor_shouldReportNone() {
    body = "{\"result\":{\"data\":{\"items\":[],\"cursor\":null,"
        + "\"hasMore\":false}}}";

    final EventPage page = source().listEvents(Cursor.absent());

    assertTrue(page.items().isEmpty());
    assertFalse(page.cursor().isPresent());
  }

  @Test
  void whenListingEvents_givenUnreadableItems_shouldSkipThemAndKeepCursor() {
    body = "{\"result\":{\"data\":{\"items\":["
        + "{\"messageId\":\"bad1\",\"userId\":\"u1\","
        + "\"authorType\":\"user\",\"content\":\"no date\"},"
        + "{\"messageId\":\"bad2\",\"userId\":\"u1\","
        + "\"authorType\":\"user\",\"content\":\"x\","
        + "\"createdAt\":\"2024-01-01T10:00:00Z\","
        + "\"attachments\":[{\"name\":\"a.png\"}]},"
        + "{\"userId\":\"u1\",\"authorType\":\"user\","
        + "\"createdAt\":\"2024-01-01T10:00:00Z\"},"
        + "{\"messageId\":\"ok\",\"botId\":\"b1\",\"userId\":\"u1\","
        + "\"authorType\":\"user\",\"content\":\"fine\","
        + "\"createdAt\":\"2024-01-01T10:00:02Z\"}"
        + "],\"cursor\":\"c9\",\"hasMore\":false}}}";

    final EventPage page = source().listEvents(Cursor.token("c8"));

    assertEquals(1, page.items().size());
    assertEquals("ok", page.items().get(0).id());
    assertEquals("c9", page.nextCursor());
  }

  @Test
  void whenRequestingTicket_shouldPostEmptyBodyAndParseTheTicket()
      throws Exception {
    body = "{\"result\":{\"data\":{\"ticket\":\"tk\","
        + "\"wsUrl\":\"wss://push.example.com/ws\","
        + "\"expiresAt\":\"2024-01-01T10:01:00Z\"}}}";

    final ConnectionTicket ticket = source().requestConnectionCredential();

    final Recorded request = requests.get(0);
    assertEquals("POST", request.method());
    assertEquals("/trpc/messages.wsTicket", request.path());
    assertEquals("{}", request.body());
    assertEquals("tk", ticket.ticket());
    assertEquals("wss://push.example.com/ws", ticket.endpoint());
    assertEquals(Instant.parse("2024-01-01T10:01:00Z"), ticket.expiresAt());
  }

  @Test
  void whenRequestingTicket_givenUnauthorized_shouldFailWithAuthStatus() {
    status = 401;
    body = "{\"error\":\"bad token\"}";

    final EventSourceException e = assertThrows(EventSourceException.class,
        () -> source().requestConnectionCredential());

    assertEquals(401, e.status().getAsInt());
    assertTrue(e.isAuthenticationFailure());
    assertTrue(e.getMessage().contains("bad token"));
  }

  @Test
  void whenRequestingTicket_givenMissingTicket_shouldFail() {
    body = "{\"result\":{\"data\":{\"wsUrl\":\"wss://x\"}}}";

    assertThrows(EventSourceException.class,
        () -> source().requestConnectionCredential());
  }

  @Test
  void whenListingEvents_givenMalformedBody_shouldFail() {
    body = "not json";

    final EventSourceException e = assertThrows(EventSourceException.class,
        () -> source().listEvents(Cursor.absent()));

    assertFalse(e.status().isPresent());
  }

  @Test
  void whenListingEvents_givenSlowServer_shouldFailWithTimeout() {
    delayMillis = 1000;
    final HttpEventSource source = new HttpEventSource(
        HttpEventSourceConfig.create(apiUrl, "bot_abc",
            Duration.ofMillis(200)));

    final EventSourceException e = assertThrows(EventSourceException.class,
        () -> source.listEvents(Cursor.absent()));

    assertTrue(e.getMessage().contains("did not respond within 200ms"));
  }

  @Test
  void whenSendingMessage_shouldPostUserContentAndTask() throws Exception {
    body = "{\"result\":{\"data\":{\"messageId\":\"m3\"}}}";

    source().sendMessage("u1", "done", "t9");

    final Recorded request = requests.get(0);
    assertEquals("/trpc/messages.send", request.path());
    final JsonNode sent = MAPPER.readTree(request.body());
    assertEquals("u1", sent.get("userId").asText());
    assertEquals("done", sent.get("content").asText());
    assertEquals("t9", sent.get("taskId").asText());
  }

  @Test
  void whenSendingMessage_givenNoTask_shouldOmitIt() throws Exception {
    source().sendMessage("u1", "done", null);

    assertFalse(MAPPER.readTree(requests.get(0).body()).has("taskId"));
  }

  @Test
  void whenProbing_givenHealthyApi_shouldSucceed() {
    body = "{\"result\":{\"data\":[]}}";

    final ProbeResult result = source().probe(Duration.ofSeconds(2));

    assertTrue(result.ok());
    assertEquals("/trpc/projects.list", requests.get(0).path());
  }

  @Test
  void whenProbing_givenServerError_shouldReportTheStatus() {
    status = 503;

    final ProbeResult result = source().probe(Duration.ofSeconds(2));

    assertFalse(result.ok());
    assertEquals("HTTP 503", result.error());
  }

  @Test
  void whenProbing_givenUnreachableApi_shouldReportFailure() {
    final HttpEventSource unreachable = new HttpEventSource(
        HttpEventSourceConfig.create("http://localhost:1/trpc", "bot_abc"));

    final ProbeResult result = unreachable.probe(Duration.ofSeconds(2));

    assertFalse(result.ok());
    assertTrue(result.error() != null && !result.error().isBlank());
  }

  private HttpEventSource source() {
    return new HttpEventSource(HttpEventSourceConfig.create(apiUrl,
        "bot_abc", Duration.ofSeconds(5)));
  }

  private static JsonNode input(final Recorded request) throws Exception {
    final String query = request.query();
    assertTrue(query.startsWith("input="));
    return MAPPER.readTree(URLDecoder.decode(query.substring(6),
        StandardCharsets.UTF_8));
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final String received = new String(
        exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    requests.add(new Recorded(exchange.getRequestMethod(),
        exchange.getRequestURI().getPath(),
        exchange.getRequestURI().getRawQuery(),
        exchange.getRequestHeaders().getFirst("Authorization"), received));

    if (delayMillis > 0) {
      try {
        Thread.sleep(delayMillis);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    } catch (final IOException e) {
      // client gone after a timeout
    }
  }

  /** A request seen by the local server. */
  private record Recorded(String method, String path, String query,
      String authorization, String body) {
  }
}
