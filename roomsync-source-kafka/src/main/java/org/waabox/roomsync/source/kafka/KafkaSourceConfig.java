package org.waabox.roomsync.source.kafka;

import java.util.Objects;

/** Configuration holder for the Kafka change event transport.
 *
 * <p>Encapsulates the connection details and topic used by
 * {@link KafkaChangeEventSource} and {@link KafkaChangeEventPublisher}.
 * Every node consumes with its own consumer group (formed by
 * {@code consumerGroupPrefix + UUID}), so each instance sees every change.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaSourceConfig {

  /** Default Kafka topic for change events. */
  private static final String DEFAULT_TOPIC = "roomsync-changes";

  /** Default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "roomsync-";

  /** The Kafka bootstrap servers connection string, never null. */
  private final String bootstrapServers;

  /** The Kafka topic carrying change events, never null. */
  private final String topic;

  /** The prefix for generating unique consumer groups, never null. */
  private final String consumerGroupPrefix;

  /** Creates a new KafkaSourceConfig.
   *
   * @param theBootstrapServers the Kafka bootstrap servers, never null
   * @param theTopic the change event topic, never null
   * @param theConsumerGroupPrefix the consumer group prefix, never null
   */
  private KafkaSourceConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    if (topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
  }

  /** Creates a configuration with the given bootstrap servers and the
   * default topic and consumer group prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers (e.g.
   *        "localhost:9092"), never null
   *
   * @return a new KafkaSourceConfig with default values, never null
   */
  public static KafkaSourceConfig create(final String bootstrapServers) {
    return new KafkaSourceConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX);
  }

  /** Creates a configuration with a custom topic and consumer group prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param topic the change event topic, never null nor blank
   * @param consumerGroupPrefix the prefix for generating unique consumer
   *        groups, never null
   *
   * @return a new KafkaSourceConfig with the specified values, never null
   */
  public static KafkaSourceConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix) {
    return new KafkaSourceConfig(bootstrapServers, topic,
        consumerGroupPrefix);
  }

  /** Returns the Kafka bootstrap servers connection string.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the topic carrying change events.
   *
   * @return the topic name, never null
   */
  public String topic() {
    return topic;
  }

  /** Returns the prefix used to build the per-node consumer group.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }
}
