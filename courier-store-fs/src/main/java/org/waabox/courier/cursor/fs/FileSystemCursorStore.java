package org.waabox.courier.cursor.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.courier.CourierException;
import org.waabox.courier.cursor.Cursor;
import org.waabox.courier.cursor.CursorStore;

/**
 * A {@link CursorStore} implementation that keeps cursors on the local
 * filesystem.
 *
 * <p>Each account gets its own subdirectory under a configurable base
 * directory holding a single {@code cursor} file: the raw cursor token, or
 * the seed sentinel, followed by a newline.
 *
 * <p>Writes use an atomic pattern: the cursor is written to a temporary file
 * and then renamed, so a crash mid-write leaves the previous cursor intact.
 *
 * <p>Storage layout:
 * <pre>
 * {baseDir}/
 *   {accountId}/
 *     cursor
 * </pre>
 *
 * <p>Neither operation throws for I/O failures: a cursor that cannot be read
 * loads as absent, and a cursor that cannot be written is logged and
 * dropped. Losing a save only means events may be delivered again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemCursorStore implements CursorStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemCursorStore.class);

  /** The name of the cursor file within each account directory. */
  private static final String CURSOR_FILE = "cursor";

  /** The suffix of the temporary file used while writing. */
  private static final String TEMP_SUFFIX = ".tmp";

  /** The base directory where all account cursors are stored. */
  private final Path baseDir;

  /**
   * Creates a new FileSystemCursorStore with the given base directory.
   *
   * <p>If the base directory does not exist, it is created along with any
   * necessary parent directories.
   *
   * @param baseDir the base directory for cursor storage, never null
   *
   * @throws NullPointerException if baseDir is null
   * @throws CourierException if the directory cannot be created
   */
  public FileSystemCursorStore(final Path baseDir) {
    Objects.requireNonNull(baseDir, "baseDir must not be null");
    this.baseDir = baseDir;

    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new CourierException(
          "Failed to create base directory: " + baseDir, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Returns {@link Cursor#absent()} when the file does not exist, is
   * blank or cannot be read.
   */
  @Override
  public Cursor load(final String accountId) {
    final Path cursorFile = accountDir(accountId).resolve(CURSOR_FILE);

    if (!Files.exists(cursorFile)) {
      return Cursor.absent();
    }

    try {
      return Cursor.fromPersisted(Files.readString(cursorFile,
          StandardCharsets.UTF_8));
    } catch (final IOException | UncheckedIOException e) {
      log.warn("Account '{}': failed to read cursor from {}: {}", accountId,
          cursorFile, e.getMessage());
      return Cursor.absent();
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Creates the account directory when needed. If a cursor already
   * exists for the account, it is overwritten.
   */
  @Override
  public void save(final String accountId, final Cursor cursor) {
    Objects.requireNonNull(cursor, "cursor must not be null");
    if (cursor.isAbsent()) {
      throw new IllegalArgumentException(
          "An absent cursor cannot be saved for account: " + accountId);
    }

    final Path accountDir = accountDir(accountId);
    final Path cursorFile = accountDir.resolve(CURSOR_FILE);

    try {
      Files.createDirectories(accountDir);

      final Path tempFile = accountDir.resolve(CURSOR_FILE + TEMP_SUFFIX);
      Files.writeString(tempFile, cursor.toPersisted() + "\n",
          StandardCharsets.UTF_8);
      move(tempFile, cursorFile);

      log.debug("Account '{}': saved {}", accountId, cursor);
    } catch (final IOException e) {
      log.warn("Account '{}': failed to save {} to {}: {}", accountId,
          cursor, cursorFile, e.getMessage());
    }
  }

  /**
   * Resolves the directory of an account.
   *
   * @param accountId the account, never null
   *
   * @return the directory, never null
   *
   * @throws IllegalArgumentException if the account id would escape the
   *                                  base directory
   */
  private Path accountDir(final String accountId) {
    Objects.requireNonNull(accountId, "accountId must not be null");
    if (accountId.isBlank() || accountId.contains("/")
        || accountId.contains("\\") || accountId.equals(".")
        || accountId.equals("..")) {
      throw new IllegalArgumentException(
          "Invalid account id for a directory name: '" + accountId + "'");
    }
    return baseDir.resolve(accountId);
  }

  /**
   * Moves the written file into place, atomically when the filesystem
   * supports it.
   *
   * @param source the temporary file, never null
   * @param target the final file, never null
   *
   * @throws IOException if the file cannot be moved
   */
  private static void move(final Path source, final Path target)
      throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
