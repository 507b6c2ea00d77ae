package org.waabox.roomsync;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.waabox.roomsync.booking.BookingInterval;

/**
 * Thrown when a booking write would overlap a confirmed booking of the
 * same room.
 *
 * <p>A conflict is a business outcome, not a transport failure: the write
 * is never retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BookingConflictException extends RoomSyncException {

  private static final long serialVersionUID = 1L;

  /** The room that was requested, never null. */
  private final String roomId;

  /** The requested start, never null. */
  private final Instant startTime;

  /** The requested end, never null. */
  private final Instant endTime;

  /** The overlapping confirmed bookings, never empty. */
  private final transient List<BookingInterval> conflicts;

  /**
   * Creates a new conflict exception.
   *
   * @param theRoomId    the requested room, never null
   * @param theStartTime the requested start, never null
   * @param theEndTime   the requested end, never null
   * @param theConflicts the overlapping bookings, never null
   */
  public BookingConflictException(final String theRoomId,
      final Instant theStartTime, final Instant theEndTime,
      final List<BookingInterval> theConflicts) {
    super("Room " + theRoomId + " is not available between " + theStartTime
        + " and " + theEndTime + ", overlapping bookings: "
        + theConflicts.stream().map(BookingInterval::bookingId)
            .collect(Collectors.toList()));
    roomId = theRoomId;
    startTime = theStartTime;
    endTime = theEndTime;
    conflicts = List.copyOf(theConflicts);
  }

  /**
   * Returns the requested room.
   *
   * @return the room id, never null
   */
  public String roomId() {
    return roomId;
  }

  /**
   * Returns the requested start.
   *
   * @return the start, never null
   */
  public Instant startTime() {
    return startTime;
  }

  /**
   * Returns the requested end.
   *
   * @return the end, never null
   */
  public Instant endTime() {
    return endTime;
  }

  /**
   * Returns the overlapping confirmed bookings.
   *
   * @return an unmodifiable list, never null
   */
  public List<BookingInterval> conflicts() {
    return conflicts;
  }
}
