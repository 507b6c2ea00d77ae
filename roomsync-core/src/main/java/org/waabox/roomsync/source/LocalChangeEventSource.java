package org.waabox.roomsync.source;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link ChangeEventSource}.
 *
 * <p>Events handed to {@link #publish(ChangeEvent)} are delivered
 * synchronously, on the publishing thread, to every open channel whose spec
 * matches. Channels report {@link ChannelSignal#SUBSCRIBED} as soon as they
 * are opened unless auto-subscribe is turned off, in which case the
 * transport status is driven through {@link #signal(String, ChannelSignal)}.
 *
 * <p>Suitable for single-node deployments paired with the in-memory booking
 * store, and for tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LocalChangeEventSource implements ChangeEventSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LocalChangeEventSource.class);

  /** The open channels, in opening order. */
  private final List<LocalChannel> channels = new CopyOnWriteArrayList<>();

  /** How many times each channel id was opened. */
  private final Map<String, Integer> openCounts = new ConcurrentHashMap<>();

  /** Whether opened channels signal SUBSCRIBED immediately. */
  private volatile boolean autoSubscribe = true;

  /** Whether the source was started. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** {@inheritDoc} */
  @Override
  public void start() {
    running.set(true);
    log.info("Local change event source started");
  }

  /** {@inheritDoc} */
  @Override
  public ChannelHandle open(final String channelId, final ChannelSpec spec,
      final ChannelListener listener) {
    Objects.requireNonNull(channelId, "channelId must not be null");
    Objects.requireNonNull(spec, "spec must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final LocalChannel channel = new LocalChannel(channelId, spec, listener);
    channels.add(channel);
    openCounts.merge(channelId, 1, Integer::sum);
    log.debug("Opened local channel {} with {}", channelId, spec);

    if (autoSubscribe) {
      listener.onSignal(ChannelSignal.SUBSCRIBED, null);
    }
    return channel;
  }

  /**
   * Delivers an event to every open channel that matches it.
   *
   * @param event the event, never null
   */
  public void publish(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    for (LocalChannel channel : channels) {
      if (channel.spec.matches(event)) {
        channel.listener.onChange(event);
      }
    }
  }

  /**
   * Reports a transport signal on every open channel with the given id.
   *
   * <p>Error and close signals also close those channels.
   *
   * @param channelId the channel id, never null
   * @param signal    the signal, never null
   */
  public void signal(final String channelId, final ChannelSignal signal) {
    Objects.requireNonNull(channelId, "channelId must not be null");
    Objects.requireNonNull(signal, "signal must not be null");
    for (LocalChannel channel : channels) {
      if (channel.channelId.equals(channelId)) {
        if (signal != ChannelSignal.SUBSCRIBED) {
          channels.remove(channel);
        }
        channel.listener.onSignal(signal, null);
      }
    }
  }

  /**
   * Turns the immediate SUBSCRIBED signal on open on or off.
   *
   * @param enabled true to subscribe channels as soon as they open
   */
  public void autoSubscribe(final boolean enabled) {
    autoSubscribe = enabled;
  }

  /**
   * Returns how many times a channel id was opened since creation.
   *
   * @param channelId the channel id, never null
   *
   * @return the number of opens
   */
  public int openCount(final String channelId) {
    return openCounts.getOrDefault(channelId, 0);
  }

  /**
   * Returns how many channels with the given id are currently open.
   *
   * @param channelId the channel id, never null
   *
   * @return the number of open channels
   */
  public int openChannels(final String channelId) {
    int count = 0;
    for (LocalChannel channel : channels) {
      if (channel.channelId.equals(channelId)) {
        count++;
      }
    }
    return count;
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (running.compareAndSet(true, false)) {
      log.info("Stopping local change event source, {} channels open",
          channels.size());
    }
    channels.clear();
  }

  /** A channel registered on this source. */
  private final class LocalChannel implements ChannelHandle {

    /** The channel id, never null. */
    private final String channelId;

    /** The channel spec, never null. */
    private final ChannelSpec spec;

    /** The channel listener, never null. */
    private final ChannelListener listener;

    private LocalChannel(final String theChannelId, final ChannelSpec theSpec,
        final ChannelListener theListener) {
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
