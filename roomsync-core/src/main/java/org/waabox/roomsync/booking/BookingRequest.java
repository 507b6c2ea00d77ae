package org.waabox.roomsync.booking;

import java.time.Instant;
import java.util.Objects;

/**
 * The data of a booking write.
 *
 * @param roomId    the room to book, never null
 * @param startTime the inclusive start, never null
 * @param endTime   the exclusive end, must be after the start
 * @param userId    the booking owner, may be null
 * @param title     a short description, may be null
 * @param status    the status to store, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BookingRequest(
    String roomId,
    Instant startTime,
    Instant endTime,
    String userId,
    String title,
    BookingStatus status
) {

  /**
   * Validates the request.
   *
   * @throws IllegalArgumentException if the end is not after the start or
   *                                  the status is cancelled
   */
  public BookingRequest {
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(startTime, "startTime must not be null");
    Objects.requireNonNull(endTime, "endTime must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (!endTime.isAfter(startTime)) {
      throw new IllegalArgumentException("endTime must be after startTime: "
          + startTime + " - " + endTime);
    }
    if (status == BookingStatus.CANCELLED) {
      throw new IllegalArgumentException(
          "Use cancel to cancel a booking, not a write request");
    }
  }

  /**
   * Creates a confirmed booking request.
   *
   * @param roomId    the room to book, never null
   * @param startTime the inclusive start, never null
   * @param endTime   the exclusive end, must be after the start
   * @param userId    the booking owner, may be null
   *
   * @return the request, never null
   */
  public static BookingRequest confirmed(final String roomId,
      final Instant startTime, final Instant endTime, final String userId) {
    return new BookingRequest(roomId, startTime, endTime, userId, null,
        BookingStatus.CONFIRMED);
  }
}
