package org.waabox.courier.health;

/**
 * The outcome of a reachability check against the remote source.
 *
 * @param ok    whether the source answered successfully
 * @param error the failure description, null when ok
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ProbeResult(boolean ok, String error) {

  /**
   * Creates a successful result.
   *
   * @return the result, never null
   */
  public static ProbeResult success() {
    return new ProbeResult(true, null);
  }

  /**
   * Creates a failed result.
   *
   * @param error the failure description, may be null
   *
   * @return the result, never null
   */
  public static ProbeResult failure(final String error) {
    return new ProbeResult(false, error);
  }
}
