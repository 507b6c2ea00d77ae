package org.waabox.roomsync.registry;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a registry subscription.
 *
 * @param id         the logical channel id, never null
 * @param status     the connection status, never null
 * @param lastUpdate when the status last changed, never null
 * @param createdAt  when the subscription was registered, never null
 * @param uptime     time since the last transition to connected, zero
 *                   unless connected
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Subscription(
    String id,
    ConnectionStatus status,
    Instant lastUpdate,
    Instant createdAt,
    Duration uptime
) {
}
