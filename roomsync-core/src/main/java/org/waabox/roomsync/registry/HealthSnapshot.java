package org.waabox.roomsync.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Subscription counts by status, recomputed on demand.
 *
 * @param total         the number of live subscriptions
 * @param connected     how many are connected
 * @param connecting    how many are connecting
 * @param error         how many are in error
 * @param disconnected  how many are disconnected
 * @param averageUptime the mean uptime over every subscription, never null
 * @param oldestUpdate  the oldest status change, null without subscriptions
 * @param aggregate     the aggregate status, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HealthSnapshot(
    int total,
    int connected,
    int connecting,
    int error,
    int disconnected,
    Duration averageUptime,
    Instant oldestUpdate,
    ConnectionStatus aggregate
) {

  /**
   * Returns the oldest status change.
   *
   * @return the instant, empty without subscriptions
   */
  public Optional<Instant> oldest() {
    return Optional.ofNullable(oldestUpdate);
  }
}
