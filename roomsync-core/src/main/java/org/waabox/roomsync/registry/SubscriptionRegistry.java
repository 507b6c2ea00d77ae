package org.waabox.roomsync.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.ChannelException;
import org.waabox.roomsync.ChannelTimeoutException;
import org.waabox.roomsync.ReconnectPolicy;
import org.waabox.roomsync.Registration;
import org.waabox.roomsync.loop.EventLoop;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventSource;
import org.waabox.roomsync.source.ChannelHandle;
import org.waabox.roomsync.source.ChannelListener;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.ChannelSpec;

/**
 * Owns the push subscriptions, at most one per logical channel id, and the
 * aggregate connection status derived from them.
 *
 * <p>All state is confined to the {@link EventLoop}; public methods can be
 * called from any thread and are marshalled onto the loop. Transport
 * callbacks are posted onto the loop and checked against the epoch token
 * of their subscription: a callback from a channel that was closed,
 * superseded or timed out is discarded.
 *
 * <p>Opening an id that is already connected returns the live subscription.
 * Channel opens for the same id are never closer than the policy's minimum
 * spacing; an open arriving sooner is deferred, and further opens while it
 * is deferred coalesce into it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionRegistry {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SubscriptionRegistry.class);

  /** The feed name reported when a status listener fails. */
  private static final String STATUS_FEED = "connection-status";

  /** The loop confining the registry state, never null. */
  private final EventLoop loop;

  /** The transport channels are opened on, never null. */
  private final ChangeEventSource source;

  /** Spacing and timeout configuration, never null. */
  private final ReconnectPolicy policy;

  /** The metrics sink, never null. */
  private final RoomSyncMetrics metrics;

  /** The live subscriptions by channel id, in registration order. */
  private final Map<String, SubscriptionEntry> subscriptions =
      new LinkedHashMap<>();

  /** When each channel id was last opened; survives unsubscribe. */
  private final Map<String, Instant> lastOpen = new LinkedHashMap<>();

  /** The aggregate status listeners. */
  private final List<ConnectionStatusListener> statusListeners =
      new CopyOnWriteArrayList<>();

  /** The aggregate status last broadcast. */
  private ConnectionStatus lastAggregate = ConnectionStatus.DISCONNECTED;

  /** Whether {@link #shutdown()} was called; the loop may be gone. */
  private volatile boolean terminated;

  /**
   * Creates a new registry.
   *
   * @param theLoop    the event loop, never null
   * @param theSource  the transport, never null
   * @param thePolicy  the reconnect policy, never null
   * @param theMetrics the metrics sink, never null
   */
  public SubscriptionRegistry(final EventLoop theLoop,
      final ChangeEventSource theSource, final ReconnectPolicy thePolicy,
      final RoomSyncMetrics theMetrics) {
    loop = Objects.requireNonNull(theLoop, "loop must not be null");
    source = Objects.requireNonNull(theSource, "source must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Opens, reuses or supersedes the subscription for a channel id.
   *
   * @param id       the logical channel id, never null
   * @param spec     what the channel listens to, never null
   * @param listener receives the channel events on the loop, never null
   *
   * @return the subscription as registered, never null
   */
  public Subscription open(final String id, final ChannelSpec spec,
      final ChangeListener listener) {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(spec, "spec must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    if (terminated) {
      throw new IllegalStateException("The registry has been shut down");
    }
    return loop.call(() -> doOpen(id, spec, listener));
  }

  /**
   * Closes the subscription for a channel id. Idempotent, and a no-op once
   * the registry is shut down.
   *
   * @param id the channel id, never null
   */
  public void close(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    if (terminated) {
      return;
    }
    loop.run(() -> {
      final SubscriptionEntry entry = subscriptions.remove(id);
      if (entry == null) {
        return;
      }
      dropChannel(entry);
      log.info("Closed subscription {}", id);
      broadcast();
    });
  }

  /**
   * Closes every subscription.
   */
  public void closeAll() {
    loop.run(() -> {
      if (subscriptions.isEmpty()) {
        return;
      }
      final List<SubscriptionEntry> entries =
          new ArrayList<>(subscriptions.values());
      subscriptions.clear();
      entries.forEach(this::dropChannel);
      log.info("Closed {} subscriptions", entries.size());
      broadcast();
    });
  }

  /**
   * Closes every subscription and stops accepting work.
   *
   * <p>Afterwards {@link #open} is rejected, {@link #close} does nothing
   * and the status queries report an empty, disconnected registry without
   * touching the loop, so they keep working once the loop is shut down.
   * Idempotent.
   */
  public void shutdown() {
    if (terminated) {
      return;
    }
    closeAll();
    terminated = true;
  }

  /**
   * Re-opens a subscription that is in error or disconnected.
   *
   * @param id the channel id, never null
   *
   * @return true if a reconnect was started
   */
  public boolean reconnect(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    return loop.call(() -> {
      final SubscriptionEntry entry = subscriptions.get(id);
      if (entry == null || !isFailed(entry)) {
        return false;
      }
      doReconnect(entry);
      return true;
    });
  }

  /**
   * Re-opens every subscription that is in error or disconnected.
   *
   * @return the number of subscriptions moved back to connecting
   */
  public int reconnectFailed() {
    return loop.call(() -> {
      final List<SubscriptionEntry> failed = new ArrayList<>();
      for (SubscriptionEntry entry : subscriptions.values()) {
        if (isFailed(entry)) {
          failed.add(entry);
        }
      }
      failed.forEach(this::doReconnect);
      if (!failed.isEmpty()) {
        log.info("Reconnecting {} failed subscriptions", failed.size());
      }
      return failed.size();
    });
  }

  /**
   * Returns the aggregate status of the live subscriptions.
   *
   * @return the status, never null
   */
  public ConnectionStatus status() {
    if (terminated) {
      return ConnectionStatus.DISCONNECTED;
    }
    return loop.call(this::aggregate);
  }

  /**
   * Registers a listener for the aggregate status.
   *
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration onStatusChange(final ConnectionStatusListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    statusListeners.add(listener);
    return () -> statusListeners.remove(listener);
  }

  /**
   * Returns a snapshot of every live subscription.
   *
   * @return the subscriptions in registration order, never null
   */
  public List<Subscription> subscriptions() {
    return loop.call(() -> {
      final Instant now = now();
      final List<Subscription> result = new ArrayList<>();
      for (SubscriptionEntry entry : subscriptions.values()) {
        result.add(entry.snapshot(now));
      }
      return List.copyOf(result);
    });
  }

  /**
   * Returns a snapshot of the subscription for a channel id.
   *
   * @param id the channel id, never null
   *
   * @return the subscription, empty if none is registered
   */
  public Optional<Subscription> subscription(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    return loop.call(() -> {
      final SubscriptionEntry entry = subscriptions.get(id);
      return entry == null
          ? Optional.<Subscription>empty()
          : Optional.of(entry.snapshot(now()));
    });
  }

  /**
   * Computes the health snapshot.
   *
   * @return the snapshot, never null
   */
  public HealthSnapshot health() {
    if (terminated) {
      return new HealthSnapshot(0, 0, 0, 0, 0, Duration.ZERO, null,
          ConnectionStatus.DISCONNECTED);
    }
    return loop.call(() -> {
      final Instant now = now();
      int connected = 0;
      int connecting = 0;
      int error = 0;
      int disconnected = 0;
      Duration totalUptime = Duration.ZERO;
      Instant oldest = null;
      for (SubscriptionEntry entry : subscriptions.values()) {
        switch (entry.status()) {
          case CONNECTED:
            connected++;
            break;
          case CONNECTING:
            connecting++;
            break;
          case ERROR:
            error++;
            break;
          default:
            disconnected++;
            break;
        }
        totalUptime = totalUptime.plus(entry.uptime(now));
        if (oldest == null || entry.lastUpdate().isBefore(oldest)) {
          oldest = entry.lastUpdate();
        }
      }
      final int total = subscriptions.size();
      final Duration average = total == 0
          ? Duration.ZERO : totalUptime.dividedBy(total);
      return new HealthSnapshot(total, connected, connecting, error,
          disconnected, average, oldest, aggregate());
    });
  }

  private Subscription doOpen(final String id, final ChannelSpec spec,
      final ChangeListener listener) {
    final SubscriptionEntry existing = subscriptions.get(id);
    if (existing != null) {
      if (existing.status() == ConnectionStatus.CONNECTED) {
        log.debug("Subscription {} already connected, reusing it", id);
        return existing.snapshot(now());
      }
      if (existing.isDeferred()) {
        log.debug("Coalescing open of {} into the pending one", id);
        existing.replace(spec, listener);
        return existing.snapshot(now());
      }
      log.info("Superseding subscription {} in status {}", id,
          existing.status());
      dropChannel(existing);
    }
    final SubscriptionEntry entry =
        new SubscriptionEntry(id, spec, listener, now());
    subscriptions.put(id, entry);
    broadcast();
    openOrDefer(entry);
    return entry.snapshot(now());
  }

  private void doReconnect(final SubscriptionEntry entry) {
    if (transition(entry, ConnectionStatus.CONNECTING)) {
      openOrDefer(entry);
    }
  }

  private void openOrDefer(final SubscriptionEntry entry) {
    final Instant now = now();
    final Instant last = lastOpen.get(entry.id());
    if (last != null) {
      final Duration elapsed = Duration.between(last, now);
      if (elapsed.compareTo(policy.minReconnectSpacing()) < 0) {
        final Duration wait = policy.minReconnectSpacing().minus(elapsed);
        final long epoch = entry.epoch();
        log.debug("Deferring open of {} by {} ms", entry.id(),
            wait.toMillis());
        entry.openTimer(loop.schedule(
            () -> deferredOpen(entry, epoch), wait));
        return;
      }
    }
    openChannel(entry);
  }

  private void deferredOpen(final SubscriptionEntry entry, final long epoch) {
    if (!isCurrent(entry, epoch)) {
      return;
    }
    entry.openTimer(null);
    openChannel(entry);
  }

  private void openChannel(final SubscriptionEntry entry) {
    lastOpen.put(entry.id(), now());
    final long epoch = entry.nextEpoch();
    entry.connectTimer(loop.schedule(() -> connectTimedOut(entry, epoch),
        policy.connectTimeout()));
    try {
      entry.handle(source.open(entry.id(), entry.spec(),
          new EpochCallback(entry, epoch)));
      log.debug("Opened channel {} (epoch {})", entry.id(), epoch);
    } catch (final RuntimeException e) {
      log.warn("Failed to open channel {}: {}", entry.id(), e.getMessage());
      fail(entry, new ChannelException(entry.id(), "open failed", e));
    }
  }

  private void connectTimedOut(final SubscriptionEntry entry,
      final long epoch) {
    if (!isCurrent(entry, epoch)
        || entry.status() != ConnectionStatus.CONNECTING) {
      return;
    }
    log.warn("Channel {} did not connect within {} ms", entry.id(),
        policy.connectTimeout().toMillis());
    metrics.channelTimedOut(entry.id());
    entry.connectTimer(null);
    fail(entry, new ChannelTimeoutException(entry.id(),
        policy.connectTimeout()));
  }

  private void onChannelChange(final SubscriptionEntry entry,
      final ChangeEvent event) {
    if (entry.status() == ConnectionStatus.CONNECTING) {
      transition(entry, ConnectionStatus.CONNECTED);
    }
    try {
      entry.listener().onChange(event);
    } catch (final RuntimeException e) {
      log.error("Listener of channel {} failed: {}", entry.id(),
          e.getMessage(), e);
      metrics.listenerFailed(entry.id(), e);
    }
  }

  private void onChannelSignal(final SubscriptionEntry entry,
      final ChannelSignal signal, final Throwable cause) {
    final ConnectionStatus target = ConnectionStatus.fromSignal(signal);
    switch (target) {
      case CONNECTED:
        transition(entry, ConnectionStatus.CONNECTED);
        break;
      case ERROR:
        fail(entry, cause == null
            ? new ChannelException(entry.id(), signal.name())
            : new ChannelException(entry.id(), signal.name(), cause));
        break;
      default:
        dropChannel(entry);
        transition(entry, ConnectionStatus.DISCONNECTED);
        break;
    }
  }

  private void fail(final SubscriptionEntry entry,
      final ChannelException error) {
    dropChannel(entry);
    entry.lastError(error);
    if (transition(entry, ConnectionStatus.ERROR)) {
      log.warn("Subscription {} failed: {}", entry.id(), error.getMessage());
    }
  }

  private boolean transition(final SubscriptionEntry entry,
      final ConnectionStatus next) {
    final ConnectionStatus current = entry.status();
    if (current == next) {
      return false;
    }
    if (!current.canTransitionTo(next)) {
      log.warn("Ignoring illegal transition {} -> {} on subscription {}",
          current, next, entry.id());
      return false;
    }
    entry.status(next, now());
    log.debug("Subscription {}: {} -> {}", entry.id(), current, next);
    if (next == ConnectionStatus.CONNECTED) {
      entry.lastError(null);
      log.info("Subscription {} connected", entry.id());
    }
    broadcast();
    return true;
  }

  private void dropChannel(final SubscriptionEntry entry) {
    entry.cancelOpenTimer();
    entry.cancelConnectTimer();
    final ChannelHandle handle = entry.handle();
    entry.handle(null);
    entry.nextEpoch();
    if (handle != null) {
      try {
        handle.close();
      } catch (final RuntimeException e) {
        log.warn("Failed to close channel {}: {}", entry.id(),
            e.getMessage());
      }
    }
  }

  private void broadcast() {
    final ConnectionStatus aggregate = aggregate();
    if (aggregate != lastAggregate) {
      log.info("Aggregate connection status: {} -> {}", lastAggregate,
          aggregate);
      lastAggregate = aggregate;
      metrics.aggregateStatusChanged(aggregate);
    }
    for (ConnectionStatusListener listener : statusListeners) {
      try {
        listener.onStatusChange(aggregate);
      } catch (final RuntimeException e) {
        log.error("Connection status listener failed: {}", e.getMessage(), e);
        metrics.listenerFailed(STATUS_FEED, e);
      }
    }
  }

  private ConnectionStatus aggregate() {
    final List<ConnectionStatus> statuses = new ArrayList<>();
    for (SubscriptionEntry entry : subscriptions.values()) {
      statuses.add(entry.status());
    }
    return ConnectionStatus.aggregate(statuses);
  }

  private boolean isCurrent(final SubscriptionEntry entry, final long epoch) {
    return subscriptions.get(entry.id()) == entry && entry.epoch() == epoch;
  }

  private static boolean isFailed(final SubscriptionEntry entry) {
    return entry.status() == ConnectionStatus.ERROR
        || entry.status() == ConnectionStatus.DISCONNECTED;
  }

  private Instant now() {
    return loop.clock().instant();
  }

  /** Posts transport callbacks onto the loop, tagged with their epoch. */
  private final class EpochCallback implements ChannelListener {

    /** The subscription the channel was opened for, never null. */
    private final SubscriptionEntry entry;

    /** The epoch of the channel, compared on delivery. */
    private final long epoch;

    private EpochCallback(final SubscriptionEntry theEntry,
        final long theEpoch) {
      entry = theEntry;
      epoch = theEpoch;
    }

    @Override
    public void onChange(final ChangeEvent event) {
      loop.execute(() -> {
        if (discarded()) {
          return;
        }
        onChannelChange(entry, event);
      });
    }

    @Override
    public void onSignal(final ChannelSignal signal, final Throwable cause) {
      loop.execute(() -> {
        if (discarded()) {
          return;
        }
        onChannelSignal(entry, signal, cause);
      });
    }

    private boolean discarded() {
      if (isCurrent(entry, epoch)) {
        return false;
      }
      log.debug("Discarding late callback on channel {} (epoch {})",
          entry.id(), epoch);
      metrics.staleCallbackDiscarded(entry.id());
      return true;
    }
  }
}
