package org.waabox.roomsync.source.kafka;

import java.util.Objects;
import java.util.Properties;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventCodec;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;

/** Publishes row change events to the topic read by
 * {@link KafkaChangeEventSource}.
 *
 * <p>The writer side of a deployment (whatever commits bookings, rooms
 * and notifications) uses it to feed every node. Events are keyed by
 * room, so the changes of one room keep their order within a partition.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeEventPublisher implements AutoCloseable {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(KafkaChangeEventPublisher.class);

  /** The configuration, never null. */
  private final KafkaSourceConfig config;

  /** The Kafka producer, never null. */
  private final Producer<String, String> producer;

  /** Creates a new publisher with a {@link KafkaProducer} built from the
   * configuration.
   *
   * @param theConfig the Kafka configuration, never null
   */
  public KafkaChangeEventPublisher(final KafkaSourceConfig theConfig) {
    this(theConfig, createProducer(theConfig));
  }

  /** Creates a new publisher over the given producer.
   *
   * @param theConfig the Kafka configuration, never null
   * @param theProducer the producer, never null
   */
  KafkaChangeEventPublisher(final KafkaSourceConfig theConfig,
      final Producer<String, String> theProducer) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    producer = Objects.requireNonNull(theProducer,
        "producer must not be null");
  }

  /** Publishes the given change event. Failures are logged.
   *
   * @param event the event to publish, never null
   */
  public void publish(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");

    final String key = partitionKey(event);
    final String json = ChangeEventCodec.serialize(event);
    final ProducerRecord<String, String> record = new ProducerRecord<>(
        config.topic(), key, json);

    producer.send(record, (metadata, exception) -> {
      if (exception != null) {
        log.error("Failed to publish {} on {} for key '{}': {}",
            event.eventType(), event.table(), key, exception.getMessage(),
            exception);
      } else {
        log.debug("Published {} on {} to partition {} offset {}",
            event.eventType(), event.table(), metadata.partition(),
            metadata.offset());
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    KafkaChangeEventSource.closeQuietly(producer, "producer");
  }

  /** Returns the record key of an event: the room id of the row, or the
   * row id when the row carries no room.
   *
   * <p>Package-private for testability.
   *
   * @param event the event, never null
   *
   * @return the key, null if the row has neither column
   */
  static String partitionKey(final ChangeEvent event) {
    final Row row = event.current();
    return row.optionalString(Columns.ROOM_ID)
        .orElseGet(() -> row.optionalString(Columns.ID).orElse(null));
  }

  /** Creates a new Kafka producer configured with string serializers.
   *
   * @param config the Kafka configuration, never null
   *
   * @return the Kafka producer, never null
   */
  private static Producer<String, String> createProducer(
      final KafkaSourceConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    return new KafkaProducer<>(props);
  }
}
