package org.waabox.courier;

import java.util.Objects;
import java.util.Optional;

/**
 * A problem found in the state of an account.
 *
 * @param accountId the account, never null
 * @param kind      the problem area, never null
 * @param message   the description, never null
 * @param fix       the suggested remedy, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StatusIssue(
    String accountId,
    Kind kind,
    String message,
    String fix
) {

  /** The problem areas. */
  public enum Kind {

    /** Missing or disabled settings. */
    CONFIG,

    /** The remote source rejects or cannot be reached with the settings. */
    AUTH,

    /** The account is not being served. */
    RUNTIME
  }

  /** Validates the components. */
  public StatusIssue {
    Objects.requireNonNull(accountId, "accountId must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  /**
   * Returns the suggested remedy.
   *
   * @return the remedy, empty when none
   */
  public Optional<String> remedy() {
    return Optional.ofNullable(fix);
  }
}
