package org.waabox.courier.event;

import java.util.Objects;

/**
 * A file attached to a {@link RemoteEvent}.
 *
 * <p>Only the declared metadata is carried; downloading the content is up
 * to the consumer.
 *
 * @param url         the remote pointer to the content, never null
 * @param name        the file name, never null
 * @param contentType the declared content type, never null
 * @param size        the declared size in bytes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Attachment(
    String url,
    String name,
    String contentType,
    long size
) {

  /** Validates the attachment fields. */
  public Attachment {
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(contentType, "contentType cannot be null");
  }
}
