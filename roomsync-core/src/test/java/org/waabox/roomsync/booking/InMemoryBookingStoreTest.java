package org.waabox.roomsync.booking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.BookingConflictException;
import org.waabox.roomsync.BookingNotFoundException;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.ChannelListener;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.ChannelSpec;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Table;

/**
 * Tests for {@link InMemoryBookingStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class InMemoryBookingStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final Instant TEN = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant ELEVEN = Instant.parse("2026-03-02T11:00:00Z");
  private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

  private LocalChangeEventSource source;
  private List<ChangeEvent> events;
  private InMemoryBookingStore store;

  @BeforeEach
  void setUp() {
    source = new LocalChangeEventSource();
    source.start();
    events = new ArrayList<>();
    source.open("test", ChannelSpec.of(Table.BOOKINGS),
        new ChannelListener() {
          @Override
          public void onChange(final ChangeEvent event) {
            events.add(event);
          }

          @Override
          public void onSignal(final ChannelSignal signal,
              final Throwable cause) {
          }
        });
    store = new InMemoryBookingStore(Clock.fixed(NOW, ZoneOffset.UTC),
        source);
  }

  @Test
  void whenInserting_shouldStoreAndPublishTheRow() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    assertEquals(NOW, created.updatedAt());
    assertEquals(created, store.find(created.bookingId()).get());
    assertEquals(1, events.size());
    assertEquals(ChangeType.INSERT, events.get(0).eventType());
    assertEquals("user-1",
        events.get(0).current().string(Columns.USER_ID));
  }

  @Test
  void whenInserting_givenOverlap_shouldRejectIt() {
    store.insert(BookingRequest.confirmed("room-a", TEN, NOON, "user-1"));

    assertThrows(BookingConflictException.class, () -> store.insert(
        BookingRequest.confirmed("room-a", ELEVEN, NOON, "user-2")));
    assertEquals(1, events.size());
  }

  @Test
  void whenInsertingConcurrently_givenSameWindow_shouldAcceptExactlyOne()
      throws Exception {
    final int writers = 8;
    final ExecutorService pool = Executors.newFixedThreadPool(writers);
    final CountDownLatch start = new CountDownLatch(1);
    final AtomicInteger accepted = new AtomicInteger();
    final AtomicInteger rejected = new AtomicInteger();
    try {
      for (int i = 0; i < writers; i++) {
        final String user = "user-" + i;
        pool.execute(() -> {
          try {
            start.await();
            store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN,
                user));
            accepted.incrementAndGet();
          } catch (final BookingConflictException e) {
            rejected.incrementAndGet();
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }

    assertEquals(1, accepted.get());
    assertEquals(writers - 1, rejected.get());
    assertEquals(1, store.findConfirmed("room-a", TEN, ELEVEN).size());
  }

  @Test
  void whenUpdating_givenOwnWindow_shouldAllowResizing() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    final BookingInterval updated = store.update(created.bookingId(),
        BookingRequest.confirmed("room-a", TEN, NOON, "user-1"));

    assertEquals(NOON, updated.endTime());
    assertEquals(ChangeType.UPDATE, events.get(1).eventType());
    assertEquals(ELEVEN.toString(),
        events.get(1).previous().get().string(Columns.END_TIME));
  }

  @Test
  void whenUpdating_givenUnknownBooking_shouldFail() {
    assertThrows(BookingNotFoundException.class, () -> store.update("nope",
        BookingRequest.confirmed("room-a", TEN, NOON, "user-1")));
  }

  @Test
  void whenCancelling_shouldReleaseTheWindow() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    final BookingInterval cancelled = store.cancel(created.bookingId());

    assertEquals(BookingStatus.CANCELLED, cancelled.status());
    assertTrue(store.findConfirmed("room-a", TEN, ELEVEN).isEmpty());
    store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-2"));
  }

  @Test
  void whenListingUpcoming_shouldSkipEndedAndCancelledBookings() {
    store.insert(BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));
    final BookingInterval later = store.insert(
        BookingRequest.confirmed("room-a", ELEVEN, NOON, "user-1"));
    final BookingInterval cancelled = store.insert(BookingRequest.confirmed(
        "room-a", NOON, NOON.plusSeconds(3600), "user-1"));
    store.cancel(cancelled.bookingId());

    final List<BookingInterval> upcoming =
        store.findUpcoming("room-a", ELEVEN);

    assertEquals(List.of(later), upcoming);
  }

  @Test
  void whenDeleting_shouldPublishTheOldRow() {
    final BookingInterval created = store.insert(
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1"));

    assertTrue(store.delete(created.bookingId()));
    assertFalse(store.delete(created.bookingId()));

    assertEquals(ChangeType.DELETE, events.get(1).eventType());
    assertTrue(store.find(created.bookingId()).isEmpty());
  }
}
