package org.waabox.courier.poll;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.cursor.CursorStore;
import org.waabox.courier.event.EventConsumer;
import org.waabox.courier.event.EventPage;
import org.waabox.courier.event.EventSource;
import org.waabox.courier.event.RemoteEvent;
import org.waabox.courier.health.HealthTracker;

/**
 * Fetches one page of events since a cursor and hands each of them to the
 * consumer.
 *
 * <p>Two kinds of runs exist:
 * <ul>
 *   <li>A synchronization run, for an absent cursor: the page is fetched
 *       but nothing is delivered, so the first connection never replays
 *       old history. The returned cursor, or {@link Cursor#seeded()} for an
 *       empty stream, is persisted.</li>
 *   <li>A normal run, for a seeded or token cursor: every event not
 *       authored by the subscriber is delivered in stream order. Progress
 *       is persisted after each delivered event when the source reports
 *       per-item positions, and at the end of the page in every case.</li>
 * </ul>
 *
 * <p>A failed delivery is logged and the rest of the page still goes
 * through. A failed fetch is logged and leaves the cursor unchanged.
 *
 * <p>Not thread-safe: callers go through a {@link PollSerializer} so at
 * most one run per account is in flight.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PollExecutor {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PollExecutor.class);

  /** The polled account, never null. */
  private final String accountId;

  /** The remote source, never null. */
  private final EventSource source;

  /** The downstream consumer, never null. */
  private final EventConsumer consumer;

  /** The durable cursor storage, never null. */
  private final CursorStore cursorStore;

  /** The health counters, never null. */
  private final HealthTracker health;

  /**
   * Creates a new poll executor for one account.
   *
   * @param theAccountId   the account, never null
   * @param theSource      the remote source, never null
   * @param theConsumer    the consumer, never null
   * @param theCursorStore the cursor storage, never null
   * @param theHealth      the health counters, never null
   */
  public PollExecutor(final String theAccountId, final EventSource theSource,
      final EventConsumer theConsumer, final CursorStore theCursorStore,
      final HealthTracker theHealth) {
    accountId = Objects.requireNonNull(theAccountId,
        "accountId must not be null");
    source = Objects.requireNonNull(theSource, "source must not be null");
    consumer = Objects.requireNonNull(theConsumer,
        "consumer must not be null");
    cursorStore = Objects.requireNonNull(theCursorStore,
        "cursorStore must not be null");
    health = Objects.requireNonNull(theHealth, "health must not be null");
  }

  /**
   * Runs one poll cycle.
   *
   * @param cursor the current cursor, never null
   *
   * @return the new cursor, or empty when the cursor must stay unchanged
   */
  public Optional<Cursor> poll(final Cursor cursor) {
    Objects.requireNonNull(cursor, "cursor must not be null");

    final EventPage page;
    try {
      page = source.listEvents(cursor);
    } catch (final Exception e) {
      log.warn("Account '{}': poll failed: {}", accountId, e.getMessage());
      log.debug("Account '{}': poll failure detail", accountId, e);
      health.recordPollFailure(accountId, e);
      return Optional.empty();
    }

    if (cursor.isAbsent()) {
      return synchronize(page);
    }
    return deliver(page);
  }

  /**
   * Records the current stream position without delivering anything.
   *
   * <p>The seed is only recorded for an empty stream; a non-empty page
   * without a position leaves the account unsynchronized so that the
   * history is skipped on a later run instead of replayed.
   *
   * @param page the fetched page, never null
   *
   * @return the cursor to continue from, empty when still unsynchronized
   */
  private Optional<Cursor> synchronize(final EventPage page) {
    final Optional<String> position = page.cursor();
    if (position.isEmpty() && !page.items().isEmpty()) {
      log.warn("Account '{}': source returned {} event(s) without a"
          + " cursor, staying unsynchronized", accountId,
          page.items().size());
      return Optional.empty();
    }
    final Cursor next = position.map(Cursor::token).orElse(Cursor.seeded());
    persist(next);

    log.info("Account '{}': synchronized at {}, skipped {} earlier"
        + " event(s)", accountId, next, page.items().size());

    health.recordSynchronized(accountId);
    try {
      consumer.onSynchronized(accountId);
    } catch (final Exception e) {
      log.warn("Account '{}': synchronization hook failed: {}", accountId,
          e.getMessage(), e);
    }
    return Optional.of(next);
  }

  /**
   * Delivers the events of a page.
   *
   * @param page the fetched page, never null
   *
   * @return the page cursor, or empty when the source returned none
   */
  private Optional<Cursor> deliver(final EventPage page) {
    final List<RemoteEvent> items = page.items();
    if (!items.isEmpty()) {
      log.info("Account '{}': received {} new event(s)", accountId,
          items.size());
    }

    int delivered = 0;
    for (int i = 0; i < items.size(); i++) {
      final RemoteEvent event = items.get(i);
      if (event.isSelfAuthored()) {
        log.debug("Account '{}': skipping self-authored event '{}'",
            accountId, event.id());
        continue;
      }
      try {
        consumer.deliver(event);
      } catch (final Exception e) {
        log.warn("Account '{}': delivery of event '{}' failed: {}",
            accountId, event.id(), e.getMessage(), e);
        health.recordDeliveryFailure(accountId, e);
        continue;
      }
      delivered++;
      health.recordDelivered(accountId);
      page.cursorAfter(i).map(Cursor::token).ifPresent(this::persist);
    }

    final Optional<Cursor> next = page.cursor().map(Cursor::token);
    next.ifPresent(this::persist);

    if (delivered > 0) {
      log.debug("Account '{}': delivered {} of {} event(s)", accountId,
          delivered, items.size());
    }
    return next;
  }

  /**
   * Stores the cursor, logging any failure.
   *
   * @param cursor the cursor to store, never null
   */
  private void persist(final Cursor cursor) {
    try {
      cursorStore.save(accountId, cursor);
    } catch (final Exception e) {
      log.warn("Account '{}': failed to persist {}: {}", accountId, cursor,
          e.getMessage());
    }
  }
}
