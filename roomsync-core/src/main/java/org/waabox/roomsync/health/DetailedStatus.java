package org.waabox.roomsync.health;

import java.util.List;

import org.waabox.roomsync.registry.ConnectionStatus;
import org.waabox.roomsync.registry.HealthSnapshot;
import org.waabox.roomsync.registry.Subscription;

/**
 * The full connection picture exposed on the control surface.
 *
 * @param aggregate           the aggregate status, never null
 * @param subscriptions       every live subscription, never null
 * @param health              the counts by status, never null
 * @param reconnectAttempts   automatic attempts made since the last time
 *                            the aggregate was connected
 * @param maxAttempts         the automatic attempt budget
 * @param manualRetryRequired true once the budget ran out; cleared by a
 *                            manual reconnect or a recovery
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DetailedStatus(
    ConnectionStatus aggregate,
    List<Subscription> subscriptions,
    HealthSnapshot health,
    int reconnectAttempts,
    int maxAttempts,
    boolean manualRetryRequired
) {
}
