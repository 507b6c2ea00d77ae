package org.waabox.roomsync.alert;

import java.util.Objects;
import java.util.Optional;

/**
 * The notification types written to the notifications table.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum NotificationType {

  /** Something failed on the server side. */
  SYSTEM_ERROR,

  /** An administrator forced a booking over an existing one. */
  ADMIN_OVERRIDE,

  /** Two bookings collided. */
  BOOKING_CONFLICT,

  /** A room was created, changed or deactivated. */
  ROOM_MANAGEMENT,

  /** A booking was cancelled. */
  BOOKING_CANCELLED,

  /** A booking was moved or edited. */
  BOOKING_MODIFIED,

  /** A booking was confirmed; user facing only. */
  BOOKING_CONFIRMED,

  /** A booking is about to start; user facing only. */
  BOOKING_REMINDER;

  /**
   * Returns the type as stored in the type column.
   *
   * @return the lower case name, never null
   */
  public String wireName() {
    return name().toLowerCase();
  }

  /**
   * Parses a type column value.
   *
   * @param value the column value, never null
   *
   * @return the type, empty if unknown
   */
  public static Optional<NotificationType> fromWire(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    for (NotificationType type : values()) {
      if (type.wireName().equalsIgnoreCase(value.trim())) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
