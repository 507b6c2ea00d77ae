package org.waabox.roomsync.alert;

import java.time.Instant;

/**
 * A classified admin alert, as delivered to the admin feed.
 *
 * @param id        the notification id, never null
 * @param type      the notification type, never null
 * @param priority  the assigned priority, never null
 * @param source    the assigned source, never null
 * @param timestamp when the alert was routed, never null
 * @param userId    the recipient, may be null
 * @param title     the title, may be null
 * @param message   the body, may be null
 * @param roomId    the room it refers to, may be null
 * @param bookingId the booking it refers to, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AdminNotification(
    String id,
    NotificationType type,
    AlertPriority priority,
    AlertSource source,
    Instant timestamp,
    String userId,
    String title,
    String message,
    String roomId,
    String bookingId
) {
}
