package org.waabox.roomsync.alert;

/**
 * The priority and source assigned to an admin-relevant notification.
 *
 * @param priority the priority, never null
 * @param source   the source, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Classification(AlertPriority priority, AlertSource source) {
}
