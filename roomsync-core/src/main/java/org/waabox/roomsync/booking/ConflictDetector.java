package org.waabox.roomsync.booking;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds the confirmed bookings a requested window overlaps.
 *
 * <p>Two intervals overlap iff {@code existing.start < candidate.end} and
 * {@code existing.end > candidate.start}. Only confirmed bookings of the
 * same room are considered, and the booking being updated can be excluded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConflictDetector {

  /** Private constructor to prevent instantiation. */
  private ConflictDetector() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Whether two half-open windows overlap.
   *
   * @param aStart the first start, never null
   * @param aEnd   the first end, never null
   * @param bStart the second start, never null
   * @param bEnd   the second end, never null
   *
   * @return true if they share at least one instant
   */
  public static boolean overlaps(final Instant aStart, final Instant aEnd,
      final Instant bStart, final Instant bEnd) {
    return aStart.isBefore(bEnd) && aEnd.isAfter(bStart);
  }

  /**
   * Returns the candidates that conflict with the requested window, ordered
   * by start time.
   *
   * @param candidates       the known bookings, never null
   * @param roomId           the requested room, never null
   * @param start            the requested start, never null
   * @param end              the requested end, must be after the start
   * @param excludeBookingId the booking being updated, may be null
   *
   * @return the conflicting bookings, never null
   *
   * @throws IllegalArgumentException if the end is not after the start
   */
  public static List<BookingInterval> findOverlaps(
      final Collection<BookingInterval> candidates, final String roomId,
      final Instant start, final Instant end, final String excludeBookingId) {
    Objects.requireNonNull(candidates, "candidates must not be null");
    Objects.requireNonNull(roomId, "roomId must not be null");
    requireWindow(start, end);

    final List<BookingInterval> result = new ArrayList<>();
    for (BookingInterval candidate : candidates) {
      if (!candidate.isConfirmed()
          || !candidate.roomId().equals(roomId)
          || candidate.bookingId().equals(excludeBookingId)) {
        continue;
      }
      if (candidate.overlaps(start, end)) {
        result.add(candidate);
      }
    }
    result.sort(Comparator.comparing(BookingInterval::startTime));
    return result;
  }

  /**
   * Whether any candidate conflicts with the requested window.
   *
   * @param candidates       the known bookings, never null
   * @param roomId           the requested room, never null
   * @param start            the requested start, never null
   * @param end              the requested end, must be after the start
   * @param excludeBookingId the booking being updated, may be null
   *
   * @return true if at least one confirmed booking overlaps
   */
  public static boolean hasOverlap(
      final Collection<BookingInterval> candidates, final String roomId,
      final Instant start, final Instant end, final String excludeBookingId) {
    return !findOverlaps(candidates, roomId, start, end, excludeBookingId)
        .isEmpty();
  }

  /**
   * Validates a requested window.
   *
   * @param start the start, never null
   * @param end   the end, never null
   *
   * @throws IllegalArgumentException if the end is not after the start
   */
  public static void requireWindow(final Instant start, final Instant end) {
    Objects.requireNonNull(start, "start must not be null");
    Objects.requireNonNull(end, "end must not be null");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException(
          "end must be after start: " + start + " - " + end);
    }
  }
}
