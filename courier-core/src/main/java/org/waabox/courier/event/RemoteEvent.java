package org.waabox.courier.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of remote data handed to the {@link EventConsumer}, typically a
 * chat message addressed to the subscribed bot.
 *
 * <p>Events are transient: they are built per fetched page and dropped
 * after delivery. The only durable trace of having processed one is the
 * cursor moving past it.
 *
 * @param id          the unique event identifier, never null
 * @param origin      whether the subscriber itself authored the event,
 *                    never null
 * @param authorId    the identifier of the author, never null
 * @param authorName  the display name of the author, may be null
 * @param recipientId the identifier of the addressed subscriber, may be
 *                    null
 * @param content     the payload, never null
 * @param threadKey   the optional thread or grouping key, may be null
 * @param createdAt   the creation instant, never null
 * @param attachments the attached files, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RemoteEvent(
    String id,
    EventOrigin origin,
    String authorId,
    String authorName,
    String recipientId,
    String content,
    String threadKey,
    Instant createdAt,
    List<Attachment> attachments
) {

  /** Validates the event and copies the attachment list. */
  public RemoteEvent {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(origin, "origin cannot be null");
    Objects.requireNonNull(authorId, "authorId cannot be null");
    Objects.requireNonNull(content, "content cannot be null");
    Objects.requireNonNull(createdAt, "createdAt cannot be null");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  /**
   * Whether this event is an echo of the subscriber's own output.
   *
   * @return true if the subscriber authored this event
   */
  public boolean isSelfAuthored() {
    return origin == EventOrigin.SUBSCRIBER;
  }

  /**
   * Returns the thread key, if any.
   *
   * @return the thread key, never null
   */
  public Optional<String> thread() {
    return Optional.ofNullable(threadKey);
  }
}
