package org.waabox.roomsync.source.kafka;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventCodec;
import org.waabox.roomsync.source.ChangeEventSource;
import org.waabox.roomsync.source.ChannelHandle;
import org.waabox.roomsync.source.ChannelListener;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.ChannelSpec;

/** Kafka-based implementation of {@link ChangeEventSource} that consumes
 * JSON change events from a single topic.
 *
 * <p>Every node uses its own consumer group and starts at the latest
 * offset, so each instance sees every change published after it started
 * and nothing older. Records are decoded with {@link ChangeEventCodec} and
 * handed to the open channels whose spec matches.
 *
 * <p>A channel reports {@link ChannelSignal#SUBSCRIBED} after the first
 * successful poll that finds partitions assigned to the consumer. When a
 * poll fails, every open channel receives
 * {@link ChannelSignal#CHANNEL_ERROR} and is dropped; the caller reopens
 * it.
 *
 * <p>Typical usage:
 * <pre>
 *   KafkaSourceConfig config = KafkaSourceConfig.create("localhost:9092");
 *   RoomSync roomSync = RoomSync.builder()
 *       .source(new KafkaChangeEventSource(config))
 *       .build();
 * </pre>
 *
 * <p>Thread safety: this class is thread-safe. The consumer is only polled
 * from a single daemon thread and the channel list is a
 * {@link CopyOnWriteArrayList}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeEventSource implements ChangeEventSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(KafkaChangeEventSource.class);

  /** Poll timeout for the Kafka consumer. */
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  /** The configuration, never null. */
  private final KafkaSourceConfig config;

  /** Creates the consumer on start, never null. */
  private final Supplier<Consumer<String, String>> consumerFactory;

  /** The open channels. */
  private final List<KafkaChannel> channels = new CopyOnWriteArrayList<>();

  /** Whether the poll loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The Kafka consumer, null until started. */
  private volatile Consumer<String, String> consumer;

  /** The thread running the poll loop, null until started. */
  private volatile Thread pollThread;

  /** Creates a new KafkaChangeEventSource with the given configuration.
   *
   * @param theConfig the Kafka configuration, never null
   */
  public KafkaChangeEventSource(final KafkaSourceConfig theConfig) {
    this(theConfig, null);
  }

  /** Creates a new KafkaChangeEventSource that obtains its consumer from
   * the given factory.
   *
   * @param theConfig the Kafka configuration, never null
   * @param theConsumerFactory creates the consumer, null to create a
   *        {@link KafkaConsumer} from the configuration
   */
  KafkaChangeEventSource(final KafkaSourceConfig theConfig,
      final Supplier<Consumer<String, String>> theConsumerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = theConsumerFactory != null
        ? theConsumerFactory
        : this::createConsumer;
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    if (running.getAndSet(true)) {
      log.warn("KafkaChangeEventSource is already running");
      return;
    }

    connect();

    pollThread = new Thread(this::pollLoop, "roomsync-kafka-poll");
    pollThread.setDaemon(true);
    pollThread.start();

    log.info("KafkaChangeEventSource started on topic '{}' with bootstrap"
        + " servers '{}'", config.topic(), config.bootstrapServers());
  }

  /** {@inheritDoc} */
  @Override
  public ChannelHandle open(final String channelId, final ChannelSpec spec,
      final ChannelListener listener) {
    Objects.requireNonNull(channelId, "channelId must not be null");
    Objects.requireNonNull(spec, "spec must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final KafkaChannel channel = new KafkaChannel(channelId, spec, listener);
    channels.add(channel);
    log.debug("Opened Kafka channel {} with {}", channelId, spec);
    return channel;
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (!running.getAndSet(false)) {
      log.warn("KafkaChangeEventSource is not running");
      return;
    }

    log.info("Stopping KafkaChangeEventSource...");

    if (consumer != null) {
      consumer.wakeup();
    }

    if (pollThread != null) {
      try {
        pollThread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for poll thread to stop");
      }
    }

    closeQuietly(consumer, "consumer");

    consumer = null;
    pollThread = null;
    channels.clear();

    log.info("KafkaChangeEventSource stopped");
  }

  /** Creates the consumer and subscribes it to the topic.
   *
   * <p>Package-private for testability.
   */
  void connect() {
    consumer = consumerFactory.get();
    consumer.subscribe(Collections.singletonList(config.topic()));
  }

  /** Polls the consumer once and dispatches what it returned.
   *
   * <p>Package-private for testability.
   *
   * @return true if the poll succeeded, false if it failed and the open
   *         channels were dropped
   */
  boolean pollOnce() {
    final ConsumerRecords<String, String> records;
    try {
      records = consumer.poll(POLL_TIMEOUT);
    } catch (final WakeupException e) {
      throw e;
    } catch (final KafkaException e) {
      log.error("Error polling topic '{}': {}", config.topic(),
          e.getMessage(), e);
      failChannels(e);
      return false;
    }

    if (!consumer.assignment().isEmpty()) {
      for (final KafkaChannel channel : channels) {
        if (!channel.subscribed) {
          channel.subscribed = true;
          signal(channel, ChannelSignal.SUBSCRIBED, null);
        }
      }
    }

    for (final ConsumerRecord<String, String> record : records) {
      if (record.value() == null) {
        continue;
      }
      final ChangeEvent event;
      try {
        event = ChangeEventCodec.deserialize(record.value());
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping malformed change event from partition {} offset"
            + " {}: {}", record.partition(), record.offset(),
            e.getMessage());
        continue;
      }
      deliver(event);
    }
    return true;
  }

  /** The main consumer poll loop. Runs in a daemon thread until
   * {@link #stop()} is called.
   */
  private void pollLoop() {
    try {
      while (running.get()) {
        if (!pollOnce()) {
          pause();
        }
      }
    } catch (final WakeupException e) {
      if (running.get()) {
        throw e;
      }
      // Expected on shutdown, ignore.
    }
  }

  /** Waits one poll timeout after a failed poll. */
  private void pause() {
    try {
      Thread.sleep(POLL_TIMEOUT.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      running.set(false);
    }
  }

  private void deliver(final ChangeEvent event) {
    for (final KafkaChannel channel : channels) {
      if (!channel.subscribed || !channel.spec.matches(event)) {
        continue;
      }
      try {
        channel.listener.onChange(event);
      } catch (final RuntimeException e) {
        log.error("Listener of channel '{}' threw exception",
            channel.channelId, e);
      }
    }
  }

  private void failChannels(final KafkaException cause) {
    for (final KafkaChannel channel : channels) {
      channels.remove(channel);
      signal(channel, ChannelSignal.CHANNEL_ERROR, cause);
    }
  }

  private static void signal(final KafkaChannel channel,
      final ChannelSignal signal, final Throwable cause) {
    try {
      channel.listener.onSignal(signal, cause);
    } catch (final RuntimeException e) {
      log.error("Listener of channel '{}' threw exception on {}",
          channel.channelId, signal, e);
    }
  }

  /** Creates a new Kafka consumer configured with string deserializers
   * and a unique consumer group for broadcast semantics.
   *
   * @return the Kafka consumer, never null
   */
  private Consumer<String, String> createConsumer() {
    final String groupId = config.consumerGroupPrefix()
        + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** Closes an AutoCloseable resource quietly, logging any errors.
   *
   * @param closeable the resource to close, may be null
   * @param name the name for logging purposes, never null
   */
  static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }

  /** A channel fed by the poll loop. */
  private final class KafkaChannel implements ChannelHandle {

    /** The channel id, never null. */
    private final String channelId;

    /** What the channel listens to, never null. */
    private final ChannelSpec spec;

    /** The channel listener, never null. */
    private final ChannelListener listener;

    /** Whether SUBSCRIBED was signalled. */
    private volatile boolean subscribed;

    private KafkaChannel(final String theChannelId,
        final ChannelSpec theSpec, final ChannelListener theListener) {
      channelId = theChannelId;
      spec = theSpec;
      listener = theListener;
    }

    @Override
    public String channelId() {
      return channelId;
    }

    @Override
    public void close() {
      channels.remove(this);
    }
  }
}
