package org.waabox.roomsync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.ReconnectPolicy;
import org.waabox.roomsync.booking.BookingGate;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingRequest;
import org.waabox.roomsync.booking.InMemoryBookingStore;
import org.waabox.roomsync.loop.ManualEventLoop;
import org.waabox.roomsync.metrics.RecordingMetrics;
import org.waabox.roomsync.registry.SubscriptionRegistry;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/**
 * Tests for {@link ConflictWatcher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConflictWatcherTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
  private static final Instant TEN = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant TEN_THIRTY =
      Instant.parse("2026-03-02T10:30:00Z");
  private static final Instant ELEVEN = Instant.parse("2026-03-02T11:00:00Z");
  private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

  private InMemoryBookingStore store;
  private BookingGate gate;
  private SubscriptionRegistry registry;
  private ConflictWatcher watcher;
  private List<ConflictReport> reports;

  @BeforeEach
  void setUp() {
    final ManualEventLoop loop = new ManualEventLoop(NOW);
    final LocalChangeEventSource source = new LocalChangeEventSource();
    source.start();
    final RecordingMetrics metrics = new RecordingMetrics();
    store = new InMemoryBookingStore(loop.clock(), source);
    gate = new BookingGate(store, metrics);
    registry = new SubscriptionRegistry(loop, source,
        ReconnectPolicy.defaultPolicy(), metrics);
    watcher = new ConflictWatcher(registry, gate, Runnable::run,
        loop.clock());
    reports = new ArrayList<>();
  }

  @Test
  void whenWatching_shouldReportTheCurrentStateFirst() {
    store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    final ConflictWatch watch =
        watcher.watch("room-a", TEN_THIRTY, NOON, null, reports::add);

    assertTrue(watch.channelId().startsWith(
        "realtime-conflict-prevention-room-a-"));
    assertEquals(1, reports.size());
    assertTrue(reports.get(0).hasConflicts());
    assertFalse(reports.get(0).realtime());
    assertEquals(NOW, reports.get(0).timestamp());
  }

  @Test
  void whenBookingLandsInTheRoom_shouldReportItInRealtime() {
    watcher.watch("room-a", TEN, ELEVEN, null, reports::add);

    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN_THIRTY, NOON, "user-2"));

    assertEquals(2, reports.size());
    final ConflictReport report = reports.get(1);
    assertTrue(report.realtime());
    assertEquals(List.of(created), report.conflicts());
  }

  @Test
  void whenBookingLandsInAnotherRoom_shouldNotReport() {
    watcher.watch("room-a", TEN, ELEVEN, null, reports::add);

    store.insert(BookingRequest.confirmed("room-b", TEN, ELEVEN, "user-2"));

    assertEquals(1, reports.size());
  }

  @Test
  void whenBookingIsCancelled_shouldReportTheWindowFreeAgain() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));
    watcher.watch("room-a", TEN, ELEVEN, null, reports::add);

    store.cancel(created.bookingId());

    assertEquals(2, reports.size());
    assertFalse(reports.get(1).hasConflicts());
    assertFalse(reports.get(1).realtime());
  }

  @Test
  void whenWatching_givenEditedBooking_shouldExcludeIt() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    watcher.watch("room-a", TEN, NOON, created.bookingId(), reports::add);

    assertFalse(reports.get(0).hasConflicts());
  }

  @Test
  void whenCancelled_shouldCloseTheChannelAndStopReporting() {
    final ConflictWatch watch =
        watcher.watch("room-a", TEN, ELEVEN, null, reports::add);

    watch.cancel();
    watch.cancel();
    store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-2"));

    assertTrue(watch.isCancelled());
    assertTrue(registry.subscription(watch.channelId()).isEmpty());
    assertEquals(1, reports.size());
  }

  @Test
  void whenListenerFails_shouldKeepWatching() {
    final List<ConflictReport> seen = new ArrayList<>();
    watcher.watch("room-a", TEN, ELEVEN, null, report -> {
      seen.add(report);
      throw new IllegalStateException("boom");
    });

    store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-2"));

    assertEquals(2, seen.size());
  }

  @Test
  void whenClassifyingEvents_shouldFlagInsertsAndConfirmations() {
    final Row confirmed = Row.builder()
        .put(Columns.ID, "b-1")
        .put(Columns.ROOM_ID, "room-a")
        .put(Columns.STATUS, "confirmed")
        .build();
    final Row pending = Row.builder()
        .put(Columns.ID, "b-1")
        .put(Columns.ROOM_ID, "room-a")
        .put(Columns.STATUS, "pending")
        .build();

    assertTrue(ConflictWatcher.isRealtime(
        ChangeEvent.insert(Table.BOOKINGS, pending)));
    assertTrue(ConflictWatcher.isRealtime(
        ChangeEvent.update(Table.BOOKINGS, pending, confirmed)));
    assertFalse(ConflictWatcher.isRealtime(
        ChangeEvent.update(Table.BOOKINGS, confirmed, pending)));
    assertFalse(ConflictWatcher.isRealtime(
        ChangeEvent.delete(Table.BOOKINGS, confirmed)));
  }
}
