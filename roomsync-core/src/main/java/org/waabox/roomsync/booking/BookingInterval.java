package org.waabox.roomsync.booking;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;

/**
 * The time window a booking occupies in a room.
 *
 * <p>The interval is half open: it covers {@code startTime} and ends right
 * before {@code endTime}, so back-to-back bookings never overlap.
 *
 * @param bookingId the booking id, never null
 * @param roomId    the room id, never null
 * @param startTime the inclusive start, never null
 * @param endTime   the exclusive end, strictly after the start
 * @param status    the booking status, never null
 * @param updatedAt the row version, null when the source does not carry it
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BookingInterval(
    String bookingId,
    String roomId,
    Instant startTime,
    Instant endTime,
    BookingStatus status,
    Instant updatedAt
) {

  /**
   * Validates the interval.
   *
   * @throws IllegalArgumentException if the end is not after the start
   */
  public BookingInterval {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(startTime, "startTime must not be null");
    Objects.requireNonNull(endTime, "endTime must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (!endTime.isAfter(startTime)) {
      throw new IllegalArgumentException("endTime must be after startTime: "
          + startTime + " - " + endTime);
    }
  }

  /**
   * Reads a booking row.
   *
   * @param row the row, never null
   *
   * @return the interval, never null
   *
   * @throws IllegalArgumentException if a column is missing or malformed
   */
  public static BookingInterval fromRow(final Row row) {
    Objects.requireNonNull(row, "row must not be null");
    return new BookingInterval(
        row.string(Columns.ID),
        row.string(Columns.ROOM_ID),
        row.instant(Columns.START_TIME),
        row.instant(Columns.END_TIME),
        BookingStatus.fromWire(row.string(Columns.STATUS)),
        row.optionalInstant(Columns.UPDATED_AT).orElse(null));
  }

  /**
   * Writes the interval as a booking row.
   *
   * @return the row, never null
   */
  public Row toRow() {
    return Row.builder()
        .put(Columns.ID, bookingId)
        .put(Columns.ROOM_ID, roomId)
        .put(Columns.START_TIME, startTime.toString())
        .put(Columns.END_TIME, endTime.toString())
        .put(Columns.STATUS, status.wireName())
        .put(Columns.UPDATED_AT,
            updatedAt == null ? null : updatedAt.toString())
        .build();
  }

  /**
   * Whether the booking holds the room.
   *
   * @return true if confirmed
   */
  public boolean isConfirmed() {
    return status == BookingStatus.CONFIRMED;
  }

  /**
   * Whether this interval overlaps the given window.
   *
   * @param start the window start, never null
   * @param end   the window end, never null
   *
   * @return true if {@code startTime < end} and {@code endTime > start}
   */
  public boolean overlaps(final Instant start, final Instant end) {
    return startTime.isBefore(end) && endTime.isAfter(start);
  }

  /**
   * Whether the given instant falls inside the interval.
   *
   * @param instant the instant, never null
   *
   * @return true if {@code startTime <= instant < endTime}
   */
  public boolean covers(final Instant instant) {
    return !instant.isBefore(startTime) && instant.isBefore(endTime);
  }

  /**
   * Returns the row version.
   *
   * @return the version, empty when unknown
   */
  public Optional<Instant> version() {
    return Optional.ofNullable(updatedAt);
  }
}
