package org.waabox.roomsync.booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The storage boundary for bookings.
 *
 * <p>Writes are atomic with respect to conflicts: {@link #insert} and
 * {@link #update} re-check the overlap inside the same critical section
 * that writes the row, so two concurrent writers for overlapping windows of
 * the same room can never both succeed. The losing writer gets a
 * {@link org.waabox.roomsync.BookingConflictException}.
 *
 * <p>Implementations must be thread-safe. Failures of the underlying
 * storage surface as {@link org.waabox.roomsync.RoomSyncException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BookingStore {

  /**
   * Finds the confirmed bookings of a room overlapping a window.
   *
   * @param roomId the room id, never null
   * @param start  the window start, never null
   * @param end    the window end, never null
   *
   * @return the overlapping confirmed bookings, never null
   */
  List<BookingInterval> findConfirmed(String roomId, Instant start,
      Instant end);

  /**
   * Finds the confirmed bookings of a room that end after an instant.
   *
   * @param roomId the room id, never null
   * @param from   the instant, never null
   *
   * @return the bookings, never null
   */
  List<BookingInterval> findUpcoming(String roomId, Instant from);

  /**
   * Finds a booking by id.
   *
   * @param bookingId the booking id, never null
   *
   * @return the booking, empty if unknown
   */
  Optional<BookingInterval> find(String bookingId);

  /**
   * Atomically checks for conflicts and inserts a new booking.
   *
   * @param request the booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws org.waabox.roomsync.BookingConflictException if a confirmed
   *         booking of the room overlaps the requested window
   */
  BookingInterval insert(BookingRequest request);

  /**
   * Atomically checks for conflicts, excluding the booking itself, and
   * rewrites a booking.
   *
   * @param bookingId the booking id, never null
   * @param request   the new booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws org.waabox.roomsync.BookingConflictException if another
   *         confirmed booking overlaps the requested window
   * @throws org.waabox.roomsync.BookingNotFoundException if the booking
   *         does not exist
   */
  BookingInterval update(String bookingId, BookingRequest request);

  /**
   * Marks a booking as cancelled.
   *
   * @param bookingId the booking id, never null
   *
   * @return the cancelled booking, never null
   *
   * @throws org.waabox.roomsync.BookingNotFoundException if the booking
   *         does not exist
   */
  BookingInterval cancel(String bookingId);
}
