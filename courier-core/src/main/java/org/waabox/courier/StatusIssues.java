package org.waabox.courier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.waabox.courier.health.ProbeResult;

/**
 * Derives the {@link StatusIssue}s of a set of accounts.
 *
 * <p>An unconfigured account only reports that, as does a disabled one.
 * Otherwise an account reports when it is not running and when its last
 * probe failed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StatusIssues {

  /** Private constructor to prevent instantiation. */
  private StatusIssues() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Collects the issues of the given accounts, in account order.
   *
   * @param snapshots the account states, never null
   *
   * @return the issues, never null
   */
  public static List<StatusIssue> collect(
      final Collection<AccountSnapshot> snapshots) {
    Objects.requireNonNull(snapshots, "snapshots must not be null");

    final List<StatusIssue> issues = new ArrayList<>();
    for (final AccountSnapshot snapshot : snapshots) {
      final String id = snapshot.accountId();

      if (!snapshot.configured()) {
        issues.add(new StatusIssue(id, StatusIssue.Kind.CONFIG,
            "Account is not configured",
            "Set the bot token and API URL of the account"));
        continue;
      }
      if (!snapshot.enabled()) {
        issues.add(new StatusIssue(id, StatusIssue.Kind.CONFIG,
            "Account is disabled", "Set enabled to true"));
        continue;
      }

      if (!snapshot.running()) {
        final String message = snapshot.lastError() == null
            ? "Gateway is not running"
            : "Gateway is not running: " + snapshot.lastError();
        issues.add(new StatusIssue(id, StatusIssue.Kind.RUNTIME, message,
            null));
      }

      final ProbeResult probe = snapshot.probe();
      if (probe != null && !probe.ok()) {
        final String error = probe.error() == null
            ? "unknown error" : probe.error();
        issues.add(new StatusIssue(id, StatusIssue.Kind.AUTH,
            "Probe failed: " + error, "Check bot token and API URL"));
      }
    }
    return List.copyOf(issues);
  }
}
