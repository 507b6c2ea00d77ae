package org.waabox.roomsync.booking;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.BookingConflictException;
import org.waabox.roomsync.BookingNotFoundException;
import org.waabox.roomsync.metrics.RecordingMetrics;

/**
 * Tests for {@link BookingGate}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BookingGateTest {

  private static final Instant TEN = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant ELEVEN = Instant.parse("2026-03-02T11:00:00Z");
  private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

  private BookingStore store;
  private RecordingMetrics metrics;
  private BookingGate gate;

  @BeforeEach
  void setUp() {
    store = createMock(BookingStore.class);
    metrics = new RecordingMetrics();
    gate = new BookingGate(store, metrics);
  }

  private static BookingInterval confirmed(final String id,
      final Instant start, final Instant end) {
    return new BookingInterval(id, "room-a", start, end,
        BookingStatus.CONFIRMED, TEN);
  }

  @Test
  void whenCreating_givenFreeWindow_shouldInsert() {
    final BookingRequest request =
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1");
    final BookingInterval created = confirmed("b-1", TEN, ELEVEN);
    expect(store.findConfirmed("room-a", TEN, ELEVEN)).andReturn(List.of());
    expect(store.insert(request)).andReturn(created);
    replay(store);

    assertSame(created, gate.create(request));

    assertEquals(0, metrics.conflicts.get());
    verify(store);
  }

  @Test
  void whenCreating_givenTakenWindow_shouldRejectWithoutWriting() {
    final BookingInterval existing = confirmed("b-1", TEN, ELEVEN);
    expect(store.findConfirmed("room-a", TEN, NOON))
        .andReturn(List.of(existing));
    replay(store);

    final BookingConflictException e = assertThrows(
        BookingConflictException.class, () -> gate.create(
            BookingRequest.confirmed("room-a", TEN, NOON, "user-1")));

    assertEquals("room-a", e.roomId());
    assertEquals(List.of(existing), e.conflicts());
    assertEquals(1, metrics.conflicts.get());
    verify(store);
  }

  @Test
  void whenCreating_givenStoreDetectsRace_shouldRethrowTheConflict() {
    final BookingRequest request =
        BookingRequest.confirmed("room-a", TEN, ELEVEN, "user-1");
    final BookingConflictException raced = new BookingConflictException(
        "room-a", TEN, ELEVEN, List.of(confirmed("b-9", TEN, ELEVEN)));
    expect(store.findConfirmed("room-a", TEN, ELEVEN)).andReturn(List.of());
    expect(store.insert(request)).andThrow(raced);
    replay(store);

    final BookingConflictException e = assertThrows(
        BookingConflictException.class, () -> gate.create(request));

    assertSame(raced, e);
    assertEquals(1, metrics.conflicts.get());
    verify(store);
  }

  @Test
  void whenUpdating_givenOnlyItsOwnInterval_shouldNotConflictWithItself() {
    final BookingInterval self = confirmed("b-1", TEN, ELEVEN);
    final BookingRequest request =
        BookingRequest.confirmed("room-a", TEN, NOON, "user-1");
    final BookingInterval updated = confirmed("b-1", TEN, NOON);
    expect(store.findConfirmed("room-a", TEN, NOON)).andReturn(List.of(self));
    expect(store.update("b-1", request)).andReturn(updated);
    replay(store);

    assertSame(updated, gate.update("b-1", request));

    verify(store);
  }

  @Test
  void whenCancelling_givenUnknownBooking_shouldPropagateNotFound() {
    expect(store.cancel("missing"))
        .andThrow(new BookingNotFoundException("missing"));
    replay(store);

    assertThrows(BookingNotFoundException.class,
        () -> gate.cancel("missing"));

    verify(store);
  }

  @Test
  void whenChecking_givenInvertedWindow_shouldRejectTheWindow() {
    replay(store);

    assertThrows(IllegalArgumentException.class,
        () -> gate.checkConflicts("room-a", ELEVEN, TEN, null));

    verify(store);
  }

  @Test
  void whenChecking_givenFreeWindow_shouldReturnEmpty() {
    expect(store.findConfirmed("room-a", ELEVEN, NOON))
        .andReturn(List.of(confirmed("b-1", TEN, ELEVEN)));
    replay(store);

    assertTrue(gate.checkConflicts("room-a", ELEVEN, NOON, null).isEmpty());

    verify(store);
  }
}
