package org.waabox.roomsync.booking;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.BookingConflictException;
import org.waabox.roomsync.BookingNotFoundException;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/**
 * {@link BookingStore} keeping bookings in memory.
 *
 * <p>Writes are serialized per room: the conflict check and the write
 * happen while holding the room lock. When a {@link LocalChangeEventSource}
 * is given, every committed write is published to it as a change event,
 * in commit order per room.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryBookingStore implements BookingStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(InMemoryBookingStore.class);

  /** The bookings by id. */
  private final Map<String, StoredBooking> bookings =
      new ConcurrentHashMap<>();

  /** One lock object per room. */
  private final Map<String, Object> roomLocks = new ConcurrentHashMap<>();

  /** Stamps the row versions, never null. */
  private final Clock clock;

  /** Receives committed writes, null when none. */
  private final LocalChangeEventSource events;

  /**
   * Creates a store that does not publish change events.
   *
   * @param theClock stamps the row versions, never null
   */
  public InMemoryBookingStore(final Clock theClock) {
    this(theClock, null);
  }

  /**
   * Creates a store that publishes its writes.
   *
   * @param theClock  stamps the row versions, never null
   * @param theEvents receives the committed writes, may be null
   */
  public InMemoryBookingStore(final Clock theClock,
      final LocalChangeEventSource theEvents) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    events = theEvents;
  }

  /** {@inheritDoc} */
  @Override
  public List<BookingInterval> findConfirmed(final String roomId,
      final Instant start, final Instant end) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    return ConflictDetector.findOverlaps(intervals(), roomId, start, end,
        null);
  }

  /** {@inheritDoc} */
  @Override
  public List<BookingInterval> findUpcoming(final String roomId,
      final Instant from) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(from, "from must not be null");
    final List<BookingInterval> result = new ArrayList<>();
    for (BookingInterval interval : intervals()) {
      if (interval.isConfirmed() && interval.roomId().equals(roomId)
          && interval.endTime().isAfter(from)) {
        result.add(interval);
      }
    }
    result.sort(Comparator.comparing(BookingInterval::startTime));
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<BookingInterval> find(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    return Optional.ofNullable(bookings.get(bookingId))
        .map(StoredBooking::interval);
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval insert(final BookingRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    synchronized (lockFor(request.roomId())) {
      requireNoConflict(request, null);
      final String id = UUID.randomUUID().toString();
      final StoredBooking stored = new StoredBooking(
          new BookingInterval(id, request.roomId(), request.startTime(),
              request.endTime(), request.status(), clock.instant()),
          request.userId(), request.title());
      bookings.put(id, stored);
      log.debug("Inserted booking {} in room {}", id, request.roomId());
      publish(ChangeEvent.insert(Table.BOOKINGS, stored.toRow()));
      return stored.interval();
    }
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval update(final String bookingId,
      final BookingRequest request) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    Objects.requireNonNull(request, "request must not be null");
    final StoredBooking current = bookings.get(bookingId);
    if (current == null) {
      throw new BookingNotFoundException(bookingId);
    }
    final String from = current.interval().roomId();
    final String to = request.roomId();
    // locks are always taken in room id order.
    final Object first = lockFor(from.compareTo(to) <= 0 ? from : to);
    final Object second = lockFor(from.compareTo(to) <= 0 ? to : from);
    synchronized (first) {
      synchronized (second) {
        final StoredBooking before = bookings.get(bookingId);
        if (before == null) {
          throw new BookingNotFoundException(bookingId);
        }
        requireNoConflict(request, bookingId);
        final StoredBooking after = new StoredBooking(
            new BookingInterval(bookingId, request.roomId(),
                request.startTime(), request.endTime(), request.status(),
                clock.instant()),
            request.userId(), request.title());
        bookings.put(bookingId, after);
        log.debug("Updated booking {} in room {}", bookingId, to);
        publish(ChangeEvent.update(Table.BOOKINGS, before.toRow(),
            after.toRow()));
        return after.interval();
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval cancel(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    final StoredBooking current = bookings.get(bookingId);
    if (current == null) {
      throw new BookingNotFoundException(bookingId);
    }
    synchronized (lockFor(current.interval().roomId())) {
      final StoredBooking before = bookings.get(bookingId);
      if (before == null) {
        throw new BookingNotFoundException(bookingId);
      }
      final BookingInterval interval = before.interval();
      final StoredBooking after = new StoredBooking(
          new BookingInterval(bookingId, interval.roomId(),
              interval.startTime(), interval.endTime(),
              BookingStatus.CANCELLED, clock.instant()),
          before.userId(), before.title());
      bookings.put(bookingId, after);
      log.debug("Cancelled booking {}", bookingId);
      publish(ChangeEvent.update(Table.BOOKINGS, before.toRow(),
          after.toRow()));
      return after.interval();
    }
  }

  /**
   * Removes a booking row entirely and publishes the delete.
   *
   * @param bookingId the booking id, never null
   *
   * @return true if the booking existed
   */
  public boolean delete(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId must not be null");
    final StoredBooking current = bookings.get(bookingId);
    if (current == null) {
      return false;
    }
    synchronized (lockFor(current.interval().roomId())) {
      final StoredBooking removed = bookings.remove(bookingId);
      if (removed == null) {
        return false;
      }
      publish(ChangeEvent.delete(Table.BOOKINGS, removed.toRow()));
      return true;
    }
  }

  private void requireNoConflict(final BookingRequest request,
      final String excludeId) {
    final List<BookingInterval> conflicts = ConflictDetector.findOverlaps(
        intervals(), request.roomId(), request.startTime(), request.endTime(),
        excludeId);
    if (!conflicts.isEmpty()) {
      throw new BookingConflictException(request.roomId(),
          request.startTime(), request.endTime(), conflicts);
    }
  }

  private List<BookingInterval> intervals() {
    final List<BookingInterval> result = new ArrayList<>(bookings.size());
    for (StoredBooking stored : bookings.values()) {
      result.add(stored.interval());
    }
    return result;
  }

  private Object lockFor(final String roomId) {
    return roomLocks.computeIfAbsent(roomId, key -> new Object());
  }

  private void publish(final ChangeEvent event) {
    if (events != null) {
      events.publish(event);
    }
  }

  /** A stored booking: its interval plus owner data. */
  private record StoredBooking(
      BookingInterval interval,
      String userId,
      String title
  ) {

    Row toRow() {
      final Row.Builder row = Row.builder();
      interval.toRow().asMap().forEach(row::put);
      return row.put(Columns.USER_ID, userId)
          .put(Columns.TITLE, title)
          .build();
    }
  }
}
