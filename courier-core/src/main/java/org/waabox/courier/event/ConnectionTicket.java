package org.waabox.courier.event;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * A single-use, short-lived credential that opens one push session.
 *
 * @param ticket    the opaque ticket, never null
 * @param endpoint  the push endpoint URL, never null
 * @param expiresAt when the ticket stops being accepted, may be null when
 *                  the source does not say
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConnectionTicket(
    String ticket,
    String endpoint,
    Instant expiresAt
) {

  /** Validates the ticket fields. */
  public ConnectionTicket {
    Objects.requireNonNull(ticket, "ticket cannot be null");
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
  }

  /**
   * Builds the URI to connect to, carrying the ticket as a query parameter.
   *
   * @return the connect URI, never null
   *
   * @throws IllegalArgumentException if the endpoint is not a valid URI
   */
  public URI connectUri() {
    final String separator = endpoint.contains("?") ? "&" : "?";
    return URI.create(endpoint + separator + "ticket="
        + URLEncoder.encode(ticket, StandardCharsets.UTF_8));
  }

  /**
   * Whether the ticket is already expired at the given instant.
   *
   * @param now the reference instant, never null
   *
   * @return true if an expiry is known and is not after {@code now}
   */
  public boolean isExpiredAt(final Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  @Override
  public String toString() {
    return "ConnectionTicket[endpoint=" + endpoint + ", expiresAt="
        + expiresAt + "]";
  }
}
