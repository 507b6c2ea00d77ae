package org.waabox.roomsync.store.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.RoomSyncException;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventCodec;
import org.waabox.roomsync.source.ChangeEventSource;
import org.waabox.roomsync.source.ChannelHandle;
import org.waabox.roomsync.source.ChannelListener;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.ChannelSpec;

/**
 * A {@link ChangeEventSource} that polls the change log written by the
 * {@link JdbcBookingStore}.
 *
 * <p>On {@link #start()} the tables are created if missing and the source
 * remembers the newest change log sequence, so only changes committed
 * afterwards are delivered. Every poll reads the entries past the last
 * sequence seen, decodes them with {@link ChangeEventCodec} and hands them
 * to the channels whose spec matches.
 *
 * <p>A channel reports {@link ChannelSignal#SUBSCRIBED} on the first
 * successful poll after it was opened. When a poll fails, every open
 * channel receives {@link ChannelSignal#CHANNEL_ERROR} and is dropped; the
 * caller reopens it.
 *
 * <p>Thread safety: this class is thread-safe. Polls run on a single
 * daemon thread and the channel list is a {@link CopyOnWriteArrayList}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeLogSource implements ChangeEventSource {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcChangeLogSource.class);

  /** The configuration, never null. */
  private final JdbcStoreConfig config;

  /** The open channels. */
  private final List<PollingChannel> channels = new CopyOnWriteArrayList<>();

  /** The last change log sequence delivered, only touched by polls. */
  private volatile long lastSequence;

  /** The scheduler that runs the polling task. */
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a new change log source.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcChangeLogSource(final JdbcStoreConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    JdbcSchema.create(config);
    lastSequence = newestSequence();

    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "roomsync-change-log-poll");
      thread.setDaemon(true);
      return thread;
    });

    final long intervalMillis = config.pollInterval().toMillis();

    scheduler.scheduleAtFixedRate(this::poll,
        intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

    log.info("JdbcChangeLogSource started at sequence {}, polling every {}"
        + " ms", lastSequence, intervalMillis);
  }

  /** {@inheritDoc} */
  @Override
  public ChannelHandle open(final String channelId, final ChannelSpec spec,
      final ChannelListener listener) {
    Objects.requireNonNull(channelId, "channelId cannot be null");
    Objects.requireNonNull(spec, "spec cannot be null");
    Objects.requireNonNull(listener, "listener cannot be null");

    final PollingChannel channel =
        new PollingChannel(channelId, spec, listener);
    channels.add(channel);
    log.debug("Opened change log channel {} with {}", channelId, spec);
    return channel;
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (final InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
      log.info("JdbcChangeLogSource stopped");
    }
    channels.clear();
  }

  /**
   * Reads and delivers the change log entries past the last sequence seen.
   */
  void poll() {
    final List<Entry> entries = new ArrayList<>();
    final String sql = "SELECT seq, payload FROM " + config.changeLogTable()
        + " WHERE seq > ? ORDER BY seq";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setLong(1, lastSequence);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          entries.add(new Entry(rs.getLong("seq"), rs.getString("payload")));
        }
      }

    } catch (final SQLException e) {
      log.error("Error polling change log table '{}'",
          config.changeLogTable(), e);
      failChannels(e);
      return;
    }

    for (final PollingChannel channel : channels) {
      if (!channel.subscribed) {
        channel.subscribed = true;
        signal(channel, ChannelSignal.SUBSCRIBED, null);
      }
    }

    for (final Entry entry : entries) {
      lastSequence = entry.sequence;
      final ChangeEvent event;
      try {
        event = ChangeEventCodec.deserialize(entry.payload);
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping malformed change log entry {}: {}",
            entry.sequence, e.getMessage());
        continue;
      }
      deliver(event);
    }
  }

  private void deliver(final ChangeEvent event) {
    for (final PollingChannel channel : channels) {
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

  private void failChannels(final SQLException cause) {
    for (final PollingChannel channel : channels) {
      channels.remove(channel);
      signal(channel, ChannelSignal.CHANNEL_ERROR, cause);
    }
  }

  private static void signal(final PollingChannel channel,
      final ChannelSignal signal, final Throwable cause) {
    try {
      channel.listener.onSignal(signal, cause);
    } catch (final RuntimeException e) {
      log.error("Listener of channel '{}' threw exception on {}",
          channel.channelId, signal, e);
    }
  }

  private long newestSequence() {
    final String sql = "SELECT COALESCE(MAX(seq), 0) FROM "
        + config.changeLogTable();

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql);
         final ResultSet rs = ps.executeQuery()) {

      rs.next();
      return rs.getLong(1);

    } catch (final SQLException e) {
      throw new RoomSyncException(
          "Failed to read change log table '" + config.changeLogTable()
              + "'", e);
    }
  }

  /** A change log row. */
  private static final class Entry {

    /** The change log sequence. */
    private final long sequence;

    /** The JSON encoded change event. */
    private final String payload;

    private Entry(final long theSequence, final String thePayload) {
      sequence = theSequence;
      payload = thePayload;
    }
  }

  /** A channel fed by the poller. */
  private final class PollingChannel implements ChannelHandle {

    /** The channel id, never null. */
    private final String channelId;

    /** What the channel listens to, never null. */
    private final ChannelSpec spec;

    /** The channel listener, never null. */
    private final ChannelListener listener;

    /** Whether SUBSCRIBED was signalled. */
    private volatile boolean subscribed;

    private PollingChannel(final String theChannelId,
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
