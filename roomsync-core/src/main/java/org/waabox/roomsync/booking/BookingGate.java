package org.waabox.roomsync.booking;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.BookingConflictException;
import org.waabox.roomsync.metrics.RoomSyncMetrics;

/**
 * The write path for bookings.
 *
 * <p>Every write first checks the store for confirmed bookings overlapping
 * the requested window and fails fast with a
 * {@link BookingConflictException}. The store's own atomic guard then
 * decides between concurrent writers that both passed the check; its
 * conflict surfaces the same way. Conflicts are never retried.
 *
 * <p>This class is thread-safe as long as the store is.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BookingGate {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(BookingGate.class);

  /** The storage boundary, never null. */
  private final BookingStore store;

  /** The metrics sink, never null. */
  private final RoomSyncMetrics metrics;

  /**
   * Creates a new gate.
   *
   * @param theStore   the booking store, never null
   * @param theMetrics the metrics sink, never null
   */
  public BookingGate(final BookingStore theStore,
      final RoomSyncMetrics theMetrics) {
    store = Objects.requireNonNull(theStore, "store must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Returns the confirmed bookings of a room that overlap a window.
   *
   * @param roomId    the room id, never null
   * @param start     the window start, never null
   * @param end       the window end, must be after the start
   * @param excludeId the booking being updated, may be null
   *
   * @return the conflicting bookings, empty if the window is free
   */
  public List<BookingInterval> checkConflicts(final String roomId,
      final Instant start, final Instant end, final String excludeId) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    ConflictDetector.requireWindow(start, end);
    return ConflictDetector.findOverlaps(
        store.findConfirmed(roomId, start, end), roomId, start, end,
        excludeId);
  }

  /**
   * Creates a booking if its window is free.
   *
   * @param request the booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws BookingConflictException if the window is taken
   */
  public BookingInterval create(final BookingRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    precheck(request, null);
    try {
      final BookingInterval created = store.insert(request);
      log.info("Created booking {} in room {} [{} - {}]",
          created.bookingId(), created.roomId(), created.startTime(),
          created.endTime());
      return created;
    } catch (final BookingConflictException e) {
      throw rejected(e);
    }
  }

  /**
   * Moves or rewrites a booking if the new window is free.
   *
   * @param bookingId the booking id, never null
   * @param request   the new booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws BookingConflictException if the new window is taken
   * @throws org.waabox.roomsync.BookingNotFoundException if the booking
   *         does not exist
   */
  public BookingInterval update(final String bookingId,
      final BookingRequest request) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    Objects.requireNonNull(request, "request must not be null");
    precheck(request, bookingId);
    try {
      final BookingInterval updated = store.update(bookingId, request);
      log.info("Updated booking {} in room {} [{} - {}]", bookingId,
          updated.roomId(), updated.startTime(), updated.endTime());
      return updated;
    } catch (final BookingConflictException e) {
      throw rejected(e);
    }
  }

  /**
   * Cancels a booking, releasing its window.
   *
   * @param bookingId the booking id, never null
   *
   * @return the cancelled booking, never null
   *
   * @throws org.waabox.roomsync.BookingNotFoundException if the booking
   *         does not exist
   */
  public BookingInterval cancel(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    final BookingInterval cancelled = store.cancel(bookingId);
    log.info("Cancelled booking {} in room {}", bookingId,
        cancelled.roomId());
    return cancelled;
  }

  private void precheck(final BookingRequest request, final String excludeId) {
    final List<BookingInterval> conflicts = checkConflicts(request.roomId(),
        request.startTime(), request.endTime(), excludeId);
    if (!conflicts.isEmpty()) {
      throw rejected(new BookingConflictException(request.roomId(),
          request.startTime(), request.endTime(), conflicts));
    }
  }

  private BookingConflictException rejected(
      final BookingConflictException e) {
    log.warn("Booking rejected: {}", e.getMessage());
    metrics.conflictDetected(e.roomId(), e.conflicts().size());
    return e;
  }
}
