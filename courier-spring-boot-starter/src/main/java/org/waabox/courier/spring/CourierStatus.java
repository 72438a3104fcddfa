package org.waabox.courier.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.waabox.courier.AccountSnapshot;
import org.waabox.courier.Courier;
import org.waabox.courier.StatusIssue;
import org.waabox.courier.StatusIssues;
import org.waabox.courier.source.http.HttpEventSource;

/**
 * Reports the state of every configured account, served or not.
 *
 * <p>Served accounts come from the running {@link Courier}; disabled and
 * unconfigured accounts are reported idle so that they surface as
 * configuration issues.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CourierStatus {

  /** The properties, never null. */
  private final CourierProperties properties;

  /** The gateway, never null. */
  private final Courier courier;

  /** The sources of the served accounts, never null. */
  private final CourierAccounts accounts;

  /**
   * Creates a new status reporter.
   *
   * @param theProperties the properties, never null
   * @param theCourier    the gateway, never null
   * @param theAccounts   the served accounts, never null
   */
  public CourierStatus(final CourierProperties theProperties,
      final Courier theCourier, final CourierAccounts theAccounts) {
    properties = Objects.requireNonNull(theProperties,
        "properties must not be null");
    courier = Objects.requireNonNull(theCourier, "courier must not be null");
    accounts = Objects.requireNonNull(theAccounts,
        "accounts must not be null");
  }

  /**
   * Returns one snapshot per configured account, without probing.
   *
   * @return the snapshots ordered by account, never null
   */
  public List<AccountSnapshot> snapshots() {
    final Map<String, AccountSnapshot> live = courier.status().stream()
        .collect(Collectors.toMap(AccountSnapshot::accountId,
            Function.identity()));

    final List<AccountSnapshot> result = new ArrayList<>();
    properties.getAccounts().forEach((id, account) -> {
      final AccountSnapshot snapshot = live.get(id);
      result.add(snapshot != null
          ? snapshot
          : AccountSnapshot.idle(id, account.isEnabled(),
              account.isConfigured()));
    });
    result.sort(Comparator.comparing(AccountSnapshot::accountId));
    return result;
  }

  /**
   * Returns one snapshot per configured account, probing every served
   * account against its API.
   *
   * @return the snapshots ordered by account, never null
   */
  public List<AccountSnapshot> probe() {
    final Duration timeout = properties.getProbeTimeout();
    final List<AccountSnapshot> result = new ArrayList<>();
    for (final AccountSnapshot snapshot : snapshots()) {
      final HttpEventSource source =
          accounts.source(snapshot.accountId()).orElse(null);
      result.add(source == null
          ? snapshot
          : snapshot.withProbe(source.probe(timeout)));
    }
    return result;
  }

  /**
   * Derives the issues of every configured account, probing the served
   * ones.
   *
   * @return the issues, empty when every account is healthy
   */
  public List<StatusIssue> issues() {
    return StatusIssues.collect(probe());
  }
}
