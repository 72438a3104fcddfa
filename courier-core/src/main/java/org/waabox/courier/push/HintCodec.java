package org.waabox.courier.push;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class translating push text frames from and to
 * {@link NotificationHint} values.
 *
 * <p>Frames are JSON objects with an {@code action} field. The server sends
 * {@code {"action":"notify","hint":...}} and {@code {"action":"pong"}};
 * the client sends {@code {"action":"ping"}}. Uses Jackson's tree model.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HintCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The action field name. */
  private static final String ACTION = "action";

  /** The keepalive frame sent by the client. */
  private static final String PING_FRAME;

  static {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put(ACTION, "ping");
    PING_FRAME = node.toString();
  }

  /** Private constructor to prevent instantiation. */
  private HintCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Returns the keepalive text frame.
   *
   * @return the ping frame, never null.
   */
  public static String pingFrame() {
    return PING_FRAME;
  }

  /**
   * Decodes a text frame.
   *
   * @param frame the frame text, never null.
   * @return the hint, empty when the action is unknown.
   * @throws IllegalArgumentException if the frame is not a JSON object
   *     with an {@code action} field.
   */
  public static Optional<NotificationHint> decode(final String frame) {
    Objects.requireNonNull(frame, "frame cannot be null");

    final JsonNode node;
    try {
      node = MAPPER.readTree(frame);
    } catch (final Exception e) {
      throw new IllegalArgumentException("Malformed push frame: " + frame, e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Push frame is not an object: "
          + frame);
    }
    final JsonNode action = node.get(ACTION);
    if (action == null || !action.isTextual()) {
      throw new IllegalArgumentException("Push frame has no action: "
          + frame);
    }

    switch (action.asText()) {
      case "notify":
        return Optional.of(NotificationHint.CHANGE);
      case "pong":
        return Optional.of(NotificationHint.KEEPALIVE_ACK);
      default:
        return Optional.empty();
    }
  }
}
