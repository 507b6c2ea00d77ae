package org.waabox.roomsync.sync;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.Registration;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingStatus;
import org.waabox.roomsync.loop.EventLoop;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/**
 * Turns booking and room change events into room availability changes.
 *
 * <p>The engine keeps, per room, the confirmed bookings it has seen and
 * the room's active flag. On every booking or room change it updates that
 * ledger and recomputes whether the room is free right now: a room is
 * unavailable while any known confirmed booking covers the current instant
 * or while it is inactive. A room change mirrors the row's active flag.
 *
 * <p>Booking rows older than the version already applied for the same
 * booking are suppressed, and exact redeliveries are dropped through a
 * bounded window of recently seen events. A deleted booking leaves a
 * tombstone holding the row's version, or the processing time when the
 * row has none; later rows for it are applied only if strictly newer.
 *
 * <p>Each resulting {@link SyncEvent} is stamped with the processing time
 * and published only if it is not older than the last state applied for
 * the room.
 *
 * <p>All state is confined to the {@link EventLoop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AvailabilitySyncEngine {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AvailabilitySyncEngine.class);

  /** The feed name reported when an availability listener fails. */
  private static final String FEED = "availability";

  /** How many recent events are remembered to drop redeliveries. */
  private static final int RECENT_EVENTS = 1024;

  /** How many booking versions are remembered for stale suppression. */
  private static final int KNOWN_VERSIONS = 10_000;

  /** The loop confining the engine state, never null. */
  private final EventLoop loop;

  /** The id stamped on published events, may be null. */
  private final String clientId;

  /** The metrics sink, never null. */
  private final RoomSyncMetrics metrics;

  /** The ledgers by room. */
  private final Map<String, RoomLedger> ledgers = new LinkedHashMap<>();

  /** The room each known booking was last seen in. */
  private final Map<String, String> bookingRooms = new Lru<>(KNOWN_VERSIONS);

  /** The last applied row version per booking. */
  private final Map<String, Instant> versions = new Lru<>(KNOWN_VERSIONS);

  /** The version each deleted booking was deleted at. */
  private final Map<String, Instant> tombstones = new Lru<>(KNOWN_VERSIONS);

  /** The recently processed events. */
  private final Set<ChangeEvent> recent =
      Collections.newSetFromMap(new Lru<>(RECENT_EVENTS));

  /** The last published state by room. */
  private final Map<String, RoomAvailability> applied = new LinkedHashMap<>();

  /** The availability listeners. */
  private final List<AvailabilityListener> listeners =
      new CopyOnWriteArrayList<>();

  /**
   * Creates a new engine.
   *
   * @param theLoop     the event loop, never null
   * @param theClientId the id stamped on published events, may be null
   * @param theMetrics  the metrics sink, never null
   */
  public AvailabilitySyncEngine(final EventLoop theLoop,
      final String theClientId, final RoomSyncMetrics theMetrics) {
    loop = Objects.requireNonNull(theLoop, "loop must not be null");
    clientId = theClientId;
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Registers an availability listener.
   *
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration subscribe(final AvailabilityListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  /**
   * Processes a change event.
   *
   * @param event the raw change, never null
   */
  public void onChange(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    loop.run(() -> process(event));
  }

  /**
   * Seeds a room's ledger with bookings read from the store.
   *
   * <p>The resulting state is recorded without being published.
   *
   * @param roomId   the room id, never null
   * @param bookings the room's confirmed bookings, never null
   *
   * @return the computed availability, never null
   */
  public RoomAvailability prime(final String roomId,
      final Collection<BookingInterval> bookings) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(bookings, "bookings must not be null");
    return loop.call(() -> {
      final RoomLedger ledger = ledger(roomId);
      for (BookingInterval booking : bookings) {
        if (booking.isConfirmed() && booking.roomId().equals(roomId)
            && !isStale(booking)) {
          ledger.put(booking);
          remember(booking);
        }
      }
      final Instant now = now();
      ledger.evictEndedBefore(now);
      final RoomAvailability state = new RoomAvailability(roomId,
          ledger.availableAt(now), now, AvailabilitySource.BOOKING);
      applied.put(roomId, state);
      log.debug("Primed room {} with {} bookings, available: {}", roomId,
          ledger.size(), state.available());
      return state;
    });
  }

  /**
   * Returns the last applied availability of a room.
   *
   * @param roomId the room id, never null
   *
   * @return the state, empty if the room was never seen
   */
  public Optional<RoomAvailability> availability(final String roomId) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    return loop.call(() -> Optional.ofNullable(applied.get(roomId)));
  }

  private void process(final ChangeEvent event) {
    if (event.table() == Table.NOTIFICATIONS) {
      return;
    }
    if (!recent.add(event)) {
      log.debug("Dropping redelivered {} on {}", event.eventType(),
          event.table().tableName());
      metrics.syncEventDiscarded(roomOf(event), "duplicate");
      return;
    }
    try {
      if (event.table() == Table.ROOMS) {
        onRoomChange(event);
      } else {
        onBookingChange(event);
      }
    } catch (final IllegalArgumentException e) {
      log.warn("Ignoring malformed {} row: {}", event.table().tableName(),
          e.getMessage());
      metrics.syncEventDiscarded(roomOf(event), "malformed");
    }
  }

  private void onRoomChange(final ChangeEvent event) {
    final Row row = event.current();
    final String roomId = row.string(Columns.ID);
    final boolean active = event.eventType() != ChangeType.DELETE
        && row.bool(Columns.IS_ACTIVE, true);
    final RoomLedger ledger = ledger(roomId);
    ledger.active(active);
    publish(roomId, active, event.eventType(), AvailabilitySource.ROOM);
  }

  private void onBookingChange(final ChangeEvent event) {
    final Row row = event.current();
    final String bookingId = row.string(Columns.ID);
    final String previousRoom = bookingRooms.get(bookingId);

    if (event.eventType() == ChangeType.DELETE) {
      tombstones.put(bookingId,
          row.optionalInstant(Columns.UPDATED_AT).orElseGet(this::now));
      versions.remove(bookingId);
      final String roomId = row.optionalString(Columns.ROOM_ID)
          .orElse(previousRoom);
      if (roomId == null) {
        log.debug("Delete of unknown booking {} without room, ignoring",
            bookingId);
        return;
      }
      ledger(roomId).remove(bookingId);
      bookingRooms.remove(bookingId);
      recompute(roomId, event.eventType());
      return;
    }

    final BookingInterval booking = BookingInterval.fromRow(row);
    if (isStale(booking)) {
      log.debug("Suppressing stale row of booking {} (version {})",
          bookingId, booking.updatedAt());
      metrics.syncEventDiscarded(booking.roomId(), "stale");
      return;
    }
    remember(booking);

    final Set<String> affected = new LinkedHashSet<>();
    if (previousRoom != null && !previousRoom.equals(booking.roomId())) {
      ledger(previousRoom).remove(bookingId);
      affected.add(previousRoom);
    }
    if (booking.status() == BookingStatus.CONFIRMED) {
      ledger(booking.roomId()).put(booking);
    } else {
      ledger(booking.roomId()).remove(bookingId);
    }
    affected.add(booking.roomId());
    for (String roomId : affected) {
      recompute(roomId, event.eventType());
    }
  }

  private void recompute(final String roomId, final ChangeType eventType) {
    final RoomLedger ledger = ledger(roomId);
    final Instant now = now();
    ledger.evictEndedBefore(now);
    publish(roomId, ledger.availableAt(now), eventType,
        AvailabilitySource.BOOKING);
  }

  private void publish(final String roomId, final boolean available,
      final ChangeType eventType, final AvailabilitySource source) {
    final SyncEvent event = new SyncEvent(roomId, available, now(),
        eventType, source, clientId);
    final RoomAvailability current = applied.get(roomId);
    if (current != null && event.timestamp().isBefore(current.updatedAt())) {
      log.debug("Discarding availability of room {} older than {}", roomId,
          current.updatedAt());
      metrics.syncEventDiscarded(roomId, "stale");
      return;
    }
    applied.put(roomId, RoomAvailability.of(event));
    metrics.syncEventPublished(roomId);
    log.debug("Room {} available: {} ({} {})", roomId, available, source,
        eventType);
    for (AvailabilityListener listener : listeners) {
      try {
        listener.onAvailabilityChange(event);
      } catch (final RuntimeException e) {
        log.error("Availability listener failed: {}", e.getMessage(), e);
        metrics.listenerFailed(FEED, e);
      }
    }
  }

  private boolean isStale(final BookingInterval booking) {
    final Instant deletedAt = tombstones.get(booking.bookingId());
    if (deletedAt != null) {
      return booking.updatedAt() == null
          || !booking.updatedAt().isAfter(deletedAt);
    }
    if (booking.updatedAt() == null) {
      return false;
    }
    final Instant last = versions.get(booking.bookingId());
    return last != null && booking.updatedAt().isBefore(last);
  }

  private void remember(final BookingInterval booking) {
    tombstones.remove(booking.bookingId());
    bookingRooms.put(booking.bookingId(), booking.roomId());
    if (booking.updatedAt() != null) {
      versions.put(booking.bookingId(), booking.updatedAt());
    }
  }

  private RoomLedger ledger(final String roomId) {
    return ledgers.computeIfAbsent(roomId, key -> new RoomLedger());
  }

  private static String roomOf(final ChangeEvent event) {
    final Row row = event.current();
    final String column = event.table() == Table.ROOMS
        ? Columns.ID : Columns.ROOM_ID;
    return row.optionalString(column).orElse("unknown");
  }

  private Instant now() {
    return loop.clock().instant();
  }

  /** Access-ordered map evicting its eldest entry past a fixed size. */
  private static final class Lru<K, V> extends LinkedHashMap<K, V> {

    private static final long serialVersionUID = 1L;

    /** The maximum number of entries. */
    private final int capacity;

    private Lru(final int theCapacity) {
      super(16, 0.75f, true);
      capacity = theCapacity;
    }

    @Override
    protected boolean removeEldestEntry(final Map.Entry<K, V> eldest) {
      return size() > capacity;
    }
  }
}
