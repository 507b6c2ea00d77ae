package org.waabox.roomsync.sync;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.waabox.roomsync.booking.BookingInterval;

/**
 * The confirmed bookings known for one room, plus its active flag.
 * Confined to the event loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class RoomLedger {

  /** The confirmed bookings by id. */
  private final Map<String, BookingInterval> confirmed = new LinkedHashMap<>();

  /** Whether the room is active; true until a room row says otherwise. */
  private boolean active = true;

  void put(final BookingInterval interval) {
    confirmed.put(interval.bookingId(), interval);
  }

  void remove(final String bookingId) {
    confirmed.remove(bookingId);
  }

  void active(final boolean isActive) {
    active = isActive;
  }

  boolean active() {
    return active;
  }

  boolean occupiedAt(final Instant now) {
    for (BookingInterval interval : confirmed.values()) {
      if (interval.covers(now)) {
        return true;
      }
    }
    return false;
  }

  boolean availableAt(final Instant now) {
    return active && !occupiedAt(now);
  }

  /** Drops bookings that ended before the given instant. */
  void evictEndedBefore(final Instant now) {
    confirmed.values().removeIf(interval -> !interval.endTime().isAfter(now));
  }

  int size() {
    return confirmed.size();
  }
}
