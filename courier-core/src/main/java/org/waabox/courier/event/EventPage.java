package org.waabox.courier.event;

import java.util.List;
import java.util.Optional;

/**
 * A page of events returned by {@link EventSource#listEvents}.
 *
 * <p>Sources that know the stream position right after each item may
 * report it through {@code itemCursors}, aligned with {@code items}. This
 * lets the caller persist progress after every delivered event. Sources
 * that only report a page-level position leave it empty; the page cursor
 * then counts as the position after the last item.
 *
 * @param items       the events in stream order, never null
 * @param nextCursor  the token positioned after the last item, null when
 *                    the source returned none
 * @param hasMore     whether the source holds more events past this page
 * @param itemCursors the token positioned after each item, empty or the
 *                    same size as items
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EventPage(
    List<RemoteEvent> items,
    String nextCursor,
    boolean hasMore,
    List<String> itemCursors
) {

  /** Copies the lists and checks their alignment. */
  public EventPage {
    items = items == null ? List.of() : List.copyOf(items);
    itemCursors = itemCursors == null ? List.of() : List.copyOf(itemCursors);
    if (!itemCursors.isEmpty() && itemCursors.size() != items.size()) {
      throw new IllegalArgumentException("itemCursors has "
          + itemCursors.size() + " entries for " + items.size() + " items");
    }
  }

  /**
   * Creates a page carrying a page-level cursor only.
   *
   * @param items      the events in stream order, may be null
   * @param nextCursor the page cursor, may be null
   * @param hasMore    whether more events are available
   */
  public EventPage(final List<RemoteEvent> items, final String nextCursor,
      final boolean hasMore) {
    this(items, nextCursor, hasMore, List.of());
  }

  /**
   * Creates an empty page without cursor.
   *
   * @return the empty page, never null
   */
  public static EventPage empty() {
    return new EventPage(List.of(), null, false);
  }

  /**
   * Returns the cursor token of this page.
   *
   * @return the token, empty when the source returned none
   */
  public Optional<String> cursor() {
    return nonBlank(nextCursor);
  }

  /**
   * Returns the stream position right after the item at the given index.
   *
   * @param index the item index, within bounds
   *
   * @return the token, empty when the source did not report one
   */
  public Optional<String> cursorAfter(final int index) {
    if (index < 0 || index >= items.size()) {
      throw new IndexOutOfBoundsException(index);
    }
    if (!itemCursors.isEmpty()) {
      return nonBlank(itemCursors.get(index));
    }
    return index == items.size() - 1 ? cursor() : Optional.empty();
  }

  /**
   * Wraps a possibly blank token.
   *
   * @param token the token, may be null
   *
   * @return the token, empty when null or blank
   */
  private static Optional<String> nonBlank(final String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(token);
  }
}
