package org.waabox.roomsync.alert;

import java.util.Objects;

import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;

/**
 * A notifications row as it arrives from the change stream.
 *
 * @param id        the notification id, never null
 * @param type      the raw type column, never null
 * @param userId    the recipient, may be null
 * @param title     the title, may be null
 * @param message   the body, may be null
 * @param roomId    the room it refers to, may be null
 * @param bookingId the booking it refers to, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RawNotification(
    String id,
    String type,
    String userId,
    String title,
    String message,
    String roomId,
    String bookingId
) {

  /** Validates the notification. */
  public RawNotification {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(type, "type must not be null");
  }

  /**
   * Reads a notifications row.
   *
   * @param row the row, never null
   *
   * @return the notification, never null
   *
   * @throws IllegalArgumentException if the id or type is missing
   */
  public static RawNotification fromRow(final Row row) {
    Objects.requireNonNull(row, "row must not be null");
    return new RawNotification(
        row.string(Columns.ID),
        row.string(Columns.TYPE),
        row.optionalString(Columns.USER_ID).orElse(null),
        row.optionalString(Columns.TITLE).orElse(null),
        row.optionalString(Columns.MESSAGE).orElse(null),
        row.optionalString(Columns.ROOM_ID).orElse(null),
        row.optionalString(Columns.BOOKING_ID).orElse(null));
  }
}
