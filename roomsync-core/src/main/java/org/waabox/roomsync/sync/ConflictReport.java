package org.waabox.roomsync.sync;

import java.time.Instant;
import java.util.List;

import org.waabox.roomsync.booking.BookingInterval;

/**
 * The result of re-validating a watched booking window.
 *
 * @param roomId    the watched room, never null
 * @param startTime the watched start, never null
 * @param endTime   the watched end, never null
 * @param conflicts the confirmed bookings overlapping the window, never null
 * @param realtime  true when the check was triggered by another client
 *                  creating or confirming a booking
 * @param timestamp when the check ran, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConflictReport(
    String roomId,
    Instant startTime,
    Instant endTime,
    List<BookingInterval> conflicts,
    boolean realtime,
    Instant timestamp
) {

  /** Copies the conflicts. */
  public ConflictReport {
    conflicts = List.copyOf(conflicts);
  }

  /**
   * Whether the window is taken.
   *
   * @return true if at least one booking conflicts
   */
  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }
}
