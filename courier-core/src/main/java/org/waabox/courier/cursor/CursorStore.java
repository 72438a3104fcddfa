package org.waabox.courier.cursor;

/**
 * Durable, per-account storage of the stream {@link Cursor}.
 *
 * <p>Implementations must be crash safe: a failed or interrupted write
 * must leave the previously stored value readable.
 *
 * <p>Neither operation may throw for I/O reasons. A cursor that cannot be
 * read is reported as absent; a cursor that cannot be written is logged
 * as a warning, the only cost being the redelivery of some events after
 * a restart.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CursorStore {

  /**
   * Loads the stored cursor of the given account.
   *
   * @param accountId the account identifier, never null
   *
   * @return the stored cursor, {@link Cursor#absent()} when nothing usable
   *         is stored, never null
   */
  Cursor load(String accountId);

  /**
   * Stores the cursor of the given account, replacing any previous value.
   *
   * @param accountId the account identifier, never null
   * @param cursor    the cursor to store, never null nor absent
   *
   * @throws IllegalArgumentException if the cursor is absent
   */
  void save(String accountId, Cursor cursor);
}
