package org.waabox.roomsync.sync;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.roomsync.source.ChangeType;

/**
 * Tests for {@link AvailabilityView}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AvailabilityViewTest {

  private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

  private static SyncEvent event(final boolean available,
      final Instant timestamp) {
    return new SyncEvent("room-r", available, timestamp, ChangeType.UPDATE,
        AvailabilitySource.BOOKING, "client-1");
  }

  @Test
  void whenApplying_givenOlderEvent_shouldKeepTheNewerState() {
    final AvailabilityView view = new AvailabilityView();
    assertTrue(view.apply(event(false, T0.plusSeconds(5))));

    assertFalse(view.apply(event(true, T0)));

    assertFalse(view.isAvailable("room-r"));
  }

  @Test
  void whenApplying_givenSameTimestamp_shouldTakeTheLatestArrival() {
    final AvailabilityView view = new AvailabilityView();
    view.onAvailabilityChange(event(false, T0));

    assertTrue(view.apply(event(true, T0)));

    assertTrue(view.isAvailable("room-r"));
  }

  @Test
  void whenQuerying_givenUnknownRoom_shouldReportUnavailable() {
    final AvailabilityView view = new AvailabilityView();

    assertFalse(view.isAvailable("room-x"));
    assertTrue(view.get("room-x").isEmpty());
  }
}
