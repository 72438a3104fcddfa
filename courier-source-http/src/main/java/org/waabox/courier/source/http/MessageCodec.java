package org.waabox.courier.source.http;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.event.Attachment;
import org.waabox.courier.event.ConnectionTicket;
import org.waabox.courier.event.EventOrigin;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.RemoteEvent;

/**
 * Static utility class translating the JSON payloads of the remote RPC
 * API.
 *
 * <p>Responses are wrapped as {@code {"result":{"data":...}}}. A message
 * carries {@code messageId}, {@code botId}, {@code userId},
 * {@code authorType} ({@code bot} or {@code user}), {@code content},
 * {@code attachments}, {@code taskId}, {@code createdAt},
 * {@code userName} and {@code botName}. Uses Jackson's tree model;
 * {@link Instant} values are ISO-8601 strings.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MessageCodec {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(MessageCodec.class);

  /** Shared ObjectMapper for tree model operations. */
  static final ObjectMapper MAPPER = new ObjectMapper();

  /** The author type of messages written by the bot itself. */
  private static final String BOT_AUTHOR = "bot";

  /** The content type assumed for attachments that declare none. */
  private static final String DEFAULT_CONTENT_TYPE =
      "application/octet-stream";

  /** Private constructor to prevent instantiation. */
  private MessageCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Creates an empty JSON object.
   *
   * @return a new object node, never null.
   */
  static ObjectNode object() {
    return MAPPER.createObjectNode();
  }

  /**
   * Extracts the {@code result.data} node of a response body.
   *
   * @param body the response body, never null.
   * @return the data node, a missing node when absent.
   * @throws IllegalArgumentException if the body is not valid JSON.
   */
  static JsonNode unwrap(final String body) {
    Objects.requireNonNull(body, "body cannot be null");
    try {
      return MAPPER.readTree(body).path("result").path("data");
    } catch (final Exception e) {
      throw new IllegalArgumentException("Malformed response body", e);
    }
  }

  /**
   * Parses a page of messages.
   *
   * <p>Messages that cannot be read are logged and left out; the page
   * cursor still moves past them.
   *
   * @param data the {@code result.data} node, never null.
   * @return the page, never null.
   * @throws IllegalArgumentException if the page itself is invalid.
   */
  static EventPage parsePage(final JsonNode data) {
    if (!data.isObject()) {
      throw new IllegalArgumentException("Missing message page in: " + data);
    }
    final JsonNode items = data.path("items");
    final List<RemoteEvent> events = new ArrayList<>();
    for (final JsonNode item : items) {
      try {
        events.add(parseMessage(item));
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping unreadable message {}: {}",
            item.path("messageId").asText("?"), e.getMessage());
      }
    }
    return new EventPage(events, textOrNull(data, "cursor"),
        data.path("hasMore").asBoolean(false));
  }

  /**
   * Parses one message.
   *
   * @param node the message node, never null.
   * @return the event, never null.
   * @throws IllegalArgumentException if a required field is missing.
   */
  static RemoteEvent parseMessage(final JsonNode node) {
    final String id = requireText(node, "messageId");
    final String botId = textOrNull(node, "botId");
    final String userId = textOrNull(node, "userId");
    final boolean fromBot = BOT_AUTHOR.equals(textOrNull(node, "authorType"));

    final List<Attachment> attachments = new ArrayList<>();
    for (final JsonNode attachment : node.path("attachments")) {
      attachments.add(new Attachment(
          requireText(attachment, "url"),
          Objects.requireNonNullElse(textOrNull(attachment, "name"), ""),
          Objects.requireNonNullElse(textOrNull(attachment, "contentType"),
              DEFAULT_CONTENT_TYPE),
          attachment.path("size").asLong(0)));
    }

    return new RemoteEvent(
        id,
        fromBot ? EventOrigin.SUBSCRIBER : EventOrigin.EXTERNAL,
        Objects.requireNonNullElse(fromBot ? botId : userId, ""),
        fromBot ? textOrNull(node, "botName") : textOrNull(node, "userName"),
        fromBot ? userId : botId,
        node.path("content").asText(""),
        textOrNull(node, "taskId"),
        parseInstant(requireText(node, "createdAt")),
        attachments);
  }

  /**
   * Parses a connection ticket.
   *
   * @param data the {@code result.data} node, never null.
   * @return the ticket, never null.
   * @throws IllegalArgumentException if the ticket or URL is missing.
   */
  static ConnectionTicket parseTicket(final JsonNode data) {
    final String expiresAt = textOrNull(data, "expiresAt");
    Instant expiry = null;
    if (expiresAt != null) {
      try {
        expiry = Instant.parse(expiresAt);
      } catch (final DateTimeParseException e) {
        expiry = null;
      }
    }
    return new ConnectionTicket(requireText(data, "ticket"),
        requireText(data, "wsUrl"), expiry);
  }

  /**
   * Parses an ISO-8601 instant.
   *
   * @param value the text, never null.
   * @return the instant, never null.
   */
  private static Instant parseInstant(final String value) {
    try {
      return Instant.parse(value);
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp: " + value, e);
    }
  }

  /** Returns the text of a field, or null when missing, null or empty.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the text, may be null.
   */
  private static String textOrNull(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    final String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  /** Returns the text of a field or throws if missing.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the text, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static String requireText(final JsonNode node,
      final String field) {
    final String value = textOrNull(node, field);
    if (value == null) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
