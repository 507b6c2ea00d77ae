package org.waabox.roomsync.booking;

import java.util.Objects;

/**
 * Lifecycle status of a booking. Only confirmed bookings block a room.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum BookingStatus {

  /** The booking holds the room. */
  CONFIRMED,

  /** The booking was cancelled and no longer holds the room. */
  CANCELLED,

  /** The booking awaits approval and does not hold the room yet. */
  PENDING;

  /**
   * Returns the status as stored in the status column.
   *
   * @return the lower case name, never null
   */
  public String wireName() {
    return name().toLowerCase();
  }

  /**
   * Parses a status column value.
   *
   * @param value the column value, never null
   *
   * @return the status, never null
   *
   * @throws IllegalArgumentException if the value is unknown
   */
  public static BookingStatus fromWire(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    return valueOf(value.trim().toUpperCase());
  }
}
