package org.waabox.roomsync.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChangeEventCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeEventCodecTest {

  @Test
  void whenSerializing_givenBookingInsert_shouldWriteSnakeCaseRow() {
    final ChangeEvent event = ChangeEvent.insert(Table.BOOKINGS,
        Row.builder()
            .put(Columns.ID, "b-1")
            .put(Columns.ROOM_ID, "room-a")
            .put(Columns.START_TIME, "2026-03-02T10:00:00Z")
            .put(Columns.STATUS, "confirmed")
            .build());

    final String json = ChangeEventCodec.serialize(event);

    assertTrue(json.contains("\"eventType\":\"INSERT\""));
    assertTrue(json.contains("\"table\":\"bookings\""));
    assertTrue(json.contains("\"before\":null"));
    assertTrue(json.contains("\"room_id\":\"room-a\""));
    assertTrue(json.contains("\"start_time\":\"2026-03-02T10:00:00Z\""));
  }

  @Test
  void whenDeserializing_givenRoomUpdate_shouldKeepColumnTypes() {
    final String json = "{\"eventType\":\"UPDATE\",\"table\":\"rooms\","
        + "\"before\":{\"id\":\"room-a\",\"is_active\":true},"
        + "\"after\":{\"id\":\"room-a\",\"is_active\":false,"
        + "\"capacity\":12,\"description\":null}}";

    final ChangeEvent event = ChangeEventCodec.deserialize(json);

    assertEquals(ChangeType.UPDATE, event.eventType());
    assertEquals(Table.ROOMS, event.table());
    assertTrue(event.before().bool(Columns.IS_ACTIVE, false));
    assertFalse(event.after().bool(Columns.IS_ACTIVE, true));
    assertEquals(12L, event.after().asMap().get("capacity"));
    assertFalse(event.after().has("description"));
  }

  @Test
  void whenDeserializing_givenDelete_shouldOnlyCarryTheOldRow() {
    final String json = "{\"eventType\":\"delete\",\"table\":\"bookings\","
        + "\"before\":{\"id\":\"b-1\",\"updated_at\":\"2026-03-02T09:00:00Z\"},"
        + "\"after\":null}";

    final ChangeEvent event = ChangeEventCodec.deserialize(json);

    assertEquals(ChangeType.DELETE, event.eventType());
    assertNull(event.after());
    assertEquals("b-1", event.current().string(Columns.ID));
    assertEquals(Instant.parse("2026-03-02T09:00:00Z"),
        event.current().instant(Columns.UPDATED_AT));
  }

  @Test
  void whenRoundTripping_givenUpdate_shouldBeEqual() {
    final ChangeEvent original = ChangeEvent.update(Table.BOOKINGS,
        Row.builder().put(Columns.ID, "b-1").put(Columns.STATUS, "confirmed")
            .build(),
        Row.builder().put(Columns.ID, "b-1").put(Columns.STATUS, "cancelled")
            .build());

    assertEquals(original,
        ChangeEventCodec.deserialize(ChangeEventCodec.serialize(original)));
  }

  @Test
  void whenDeserializing_givenUnknownTable_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ChangeEventCodec.deserialize(
            "{\"eventType\":\"INSERT\",\"table\":\"users\",\"after\":{}}"));
  }

  @Test
  void whenDeserializing_givenInsertWithoutRow_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ChangeEventCodec.deserialize(
            "{\"eventType\":\"INSERT\",\"table\":\"bookings\"}"));
  }

  @Test
  void whenDeserializing_givenMalformedJson_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ChangeEventCodec.deserialize("{not json"));
  }
}
