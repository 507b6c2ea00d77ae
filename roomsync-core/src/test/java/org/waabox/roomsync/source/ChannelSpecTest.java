package org.waabox.roomsync.source;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChannelSpec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChannelSpecTest {

  private static ChangeEvent notification(final ChangeType type,
      final String userId) {
    final Row row = Row.builder()
        .put(Columns.ID, "n-1")
        .put(Columns.TYPE, "system_error")
        .put(Columns.USER_ID, userId)
        .build();
    return type == ChangeType.DELETE
        ? ChangeEvent.delete(Table.NOTIFICATIONS, row)
        : new ChangeEvent(type, Table.NOTIFICATIONS, null, row);
  }

  @Test
  void whenMatching_givenFilteredSpec_shouldOnlyAcceptTheFilteredValue() {
    final ChannelSpec spec = ChannelSpec.of(Table.NOTIFICATIONS)
        .onlyEvents(ChangeType.INSERT)
        .filteredBy(Columns.USER_ID, "admin-1");

    assertTrue(spec.matches(notification(ChangeType.INSERT, "admin-1")));
    assertFalse(spec.matches(notification(ChangeType.INSERT, "admin-2")));
    assertFalse(spec.matches(notification(ChangeType.UPDATE, "admin-1")));
  }

  @Test
  void whenMatching_givenOtherTable_shouldReject() {
    final ChannelSpec spec = ChannelSpec.of(Table.BOOKINGS, Table.ROOMS);

    assertFalse(spec.matches(notification(ChangeType.INSERT, "admin-1")));
  }

  @Test
  void whenMatching_givenDeleteAndFilter_shouldUseTheOldRow() {
    final ChannelSpec spec = ChannelSpec.of(Table.NOTIFICATIONS)
        .filteredBy(Columns.USER_ID, "admin-1");

    assertTrue(spec.matches(notification(ChangeType.DELETE, "admin-1")));
  }

  @Test
  void whenMatching_givenRowWithoutFilteredColumn_shouldReject() {
    final ChannelSpec spec = ChannelSpec.of(Table.NOTIFICATIONS)
        .filteredBy(Columns.ROOM_ID, "room-a");

    assertFalse(spec.matches(notification(ChangeType.INSERT, "admin-1")));
  }
}
