package org.waabox.courier.cursor;

import java.util.Objects;
import java.util.Optional;

/**
 * A position marker in a remote event stream.
 *
 * <p>A cursor is one of three things:
 * <ul>
 *   <li>{@link Kind#ABSENT} - this account was never synchronized.</li>
 *   <li>{@link Kind#SEEDED} - the account synchronized at least once, but
 *       the remote stream was empty at that time so the source returned
 *       no token.</li>
 *   <li>{@link Kind#TOKEN} - an opaque token returned by the source.</li>
 * </ul>
 *
 * <p>Tokens are never derived or guessed locally, a cursor only ever wraps
 * a value the remote source handed out.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Cursor {

  /** The persisted form of the {@link Kind#SEEDED} cursor. */
  public static final String SEED_SENTINEL = "__seed__";

  /** The shared absent cursor. */
  private static final Cursor ABSENT = new Cursor(Kind.ABSENT, null);

  /** The shared seeded cursor. */
  private static final Cursor SEEDED = new Cursor(Kind.SEEDED, null);

  /** The cursor variants. */
  public enum Kind {
    /** Never synchronized. */
    ABSENT,
    /** Synchronized once against an empty stream. */
    SEEDED,
    /** A real position returned by the source. */
    TOKEN
  }

  /** The kind of this cursor, never null. */
  private final Kind kind;

  /** The token, only set for {@link Kind#TOKEN}. */
  private final String token;

  /** Private constructor; use the static factories.
   *
   * @param theKind the kind, never null.
   * @param theToken the token, may be null.
   */
  private Cursor(final Kind theKind, final String theToken) {
    kind = theKind;
    token = theToken;
  }

  /** Returns the cursor of an account that was never synchronized.
   *
   * @return the absent cursor, never null.
   */
  public static Cursor absent() {
    return ABSENT;
  }

  /** Returns the cursor of an account synchronized against an empty stream.
   *
   * @return the seeded cursor, never null.
   */
  public static Cursor seeded() {
    return SEEDED;
  }

  /** Wraps a token returned by the remote source.
   *
   * @param token the opaque token, never null nor blank.
   *
   * @return the cursor, never null.
   *
   * @throws IllegalArgumentException if the token is blank or collides
   *                                  with the seed sentinel.
   */
  public static Cursor token(final String token) {
    Objects.requireNonNull(token, "token cannot be null");
    if (token.isBlank()) {
      throw new IllegalArgumentException("token cannot be blank");
    }
    if (SEED_SENTINEL.equals(token)) {
      throw new IllegalArgumentException(
          "token cannot be the seed sentinel " + SEED_SENTINEL);
    }
    return new Cursor(Kind.TOKEN, token);
  }

  /** Restores a cursor from its persisted form.
   *
   * @param persisted the stored value, may be null.
   *
   * @return the cursor; absent if the value is null or blank, never null.
   */
  public static Cursor fromPersisted(final String persisted) {
    if (persisted == null || persisted.isBlank()) {
      return ABSENT;
    }
    final String value = persisted.trim();
    if (SEED_SENTINEL.equals(value)) {
      return SEEDED;
    }
    return new Cursor(Kind.TOKEN, value);
  }

  /** Returns the kind of this cursor.
   *
   * @return the kind, never null.
   */
  public Kind kind() {
    return kind;
  }

  /** Whether the account behind this cursor was never synchronized.
   *
   * @return true for {@link Kind#ABSENT}.
   */
  public boolean isAbsent() {
    return kind == Kind.ABSENT;
  }

  /** Returns the token to send to the remote source.
   *
   * @return the token, empty for absent and seeded cursors.
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /** Returns the value written to durable storage.
   *
   * @return the raw token or the seed sentinel, never null.
   *
   * @throws IllegalStateException if this cursor is absent.
   */
  public String toPersisted() {
    return switch (kind) {
      case TOKEN -> token;
      case SEEDED -> SEED_SENTINEL;
      default -> throw new IllegalStateException(
          "An absent cursor has no persisted form");
    };
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Cursor)) {
      return false;
    }
    final Cursor that = (Cursor) other;
    return kind == that.kind && Objects.equals(token, that.token);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, token);
  }

  @Override
  public String toString() {
    return kind == Kind.TOKEN ? "Cursor[" + token + "]"
        : "Cursor[" + kind + "]";
  }
}
