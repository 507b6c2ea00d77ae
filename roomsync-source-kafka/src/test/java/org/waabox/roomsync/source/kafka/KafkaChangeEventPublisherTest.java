package org.waabox.roomsync.source.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventCodec;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/** Unit tests for {@link KafkaChangeEventPublisher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KafkaChangeEventPublisherTest {

  private final MockProducer<String, String> producer = new MockProducer<>(
      true, new StringSerializer(), new StringSerializer());

  private final KafkaChangeEventPublisher publisher =
      new KafkaChangeEventPublisher(KafkaSourceConfig.create(
          "localhost:9092", "hotel-changes", "node-"), producer);

  @Test
  void whenPublishing_givenBooking_shouldKeyByRoomAndWriteJson() {
    final ChangeEvent event = ChangeEvent.insert(Table.BOOKINGS,
        Row.builder()
            .put(Columns.ID, "b-1")
            .put(Columns.ROOM_ID, "room-a")
            .put(Columns.STATUS, "confirmed")
            .build());

    publisher.publish(event);

    final List<ProducerRecord<String, String>> sent = producer.history();
    assertEquals(1, sent.size());
    assertEquals("hotel-changes", sent.get(0).topic());
    assertEquals("room-a", sent.get(0).key());

    final ChangeEvent decoded = ChangeEventCodec.deserialize(
        sent.get(0).value());
    assertEquals(ChangeType.INSERT, decoded.eventType());
    assertEquals("b-1", decoded.after().string(Columns.ID));
  }

  @Test
  void whenPublishing_givenRoomDelete_shouldKeyByRoomId() {
    final ChangeEvent event = ChangeEvent.delete(Table.ROOMS,
        Row.builder().put(Columns.ID, "room-b").build());

    publisher.publish(event);

    assertEquals("room-b", producer.history().get(0).key());
  }

  @Test
  void whenComputingKey_givenRowWithoutIds_shouldReturnNull() {
    final ChangeEvent event = ChangeEvent.insert(Table.NOTIFICATIONS,
        Row.builder().put(Columns.TYPE, "system_alert").build());

    assertNull(KafkaChangeEventPublisher.partitionKey(event));
  }

  @Test
  void whenPublishing_givenSendFailure_shouldNotThrow() {
    final MockProducer<String, String> failing = new MockProducer<>(
        false, new StringSerializer(), new StringSerializer());
    final KafkaChangeEventPublisher failingPublisher =
        new KafkaChangeEventPublisher(
            KafkaSourceConfig.create("localhost:9092"), failing);

    failingPublisher.publish(ChangeEvent.insert(Table.BOOKINGS,
        Row.builder().put(Columns.ID, "b-1").build()));

    assertTrue(failing.errorNext(new RuntimeException("broker down")));
  }

  @Test
  void whenClosing_shouldCloseTheProducer() {
    publisher.close();

    assertTrue(producer.closed());
  }
}
