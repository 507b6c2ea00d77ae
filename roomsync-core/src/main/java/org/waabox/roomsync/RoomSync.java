package org.waabox.roomsync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.alert.AdminAlertListener;
import org.waabox.roomsync.alert.AdminAlertRouter;
import org.waabox.roomsync.booking.BookingGate;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingRequest;
import org.waabox.roomsync.booking.BookingStore;
import org.waabox.roomsync.booking.InMemoryBookingStore;
import org.waabox.roomsync.health.DetailedStatus;
import org.waabox.roomsync.health.HealthMonitor;
import org.waabox.roomsync.loop.EventLoop;
import org.waabox.roomsync.loop.SingleThreadEventLoop;
import org.waabox.roomsync.metrics.NoopRoomSyncMetrics;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.registry.ConnectionStatus;
import org.waabox.roomsync.registry.ConnectionStatusListener;
import org.waabox.roomsync.registry.HealthSnapshot;
import org.waabox.roomsync.registry.SubscriptionRegistry;
import org.waabox.roomsync.source.ChangeEventSource;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.ChannelSpec;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Table;
import org.waabox.roomsync.sync.AvailabilityListener;
import org.waabox.roomsync.sync.AvailabilitySyncEngine;
import org.waabox.roomsync.sync.ConflictListener;
import org.waabox.roomsync.sync.ConflictWatch;
import org.waabox.roomsync.sync.ConflictWatcher;
import org.waabox.roomsync.sync.RoomAvailability;

/**
 * The main entry point of the room availability synchronization engine.
 *
 * <p>RoomSync wires a change event source, a booking store and a single
 * event loop into:
 * <ul>
 *   <li>an availability feed, kept consistent across clients as bookings
 *       and rooms change;</li>
 *   <li>a write gate that prevents overlapping confirmed bookings;</li>
 *   <li>an admin alert feed with priorities and throttling;</li>
 *   <li>a supervised subscription layer that reconnects failed channels
 *       within a bounded budget.</li>
 * </ul>
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}. Every method is safe to call from any thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RoomSync {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(RoomSync.class);

  /** The channel carrying every booking and room change. */
  public static final String GLOBAL_CHANNEL = "global-room-sync";

  /** Prefix of the per-administrator notification channels. */
  public static final String ADMIN_CHANNEL_PREFIX = "admin-notifications-";

  /** The identifier of this client. */
  private final String clientId;

  /** The loop all engine state is confined to. */
  private final EventLoop loop;

  /** Whether the loop was created by the builder and is shut down here. */
  private final boolean ownsLoop;

  /** The change event transport. */
  private final ChangeEventSource source;

  /** The booking storage boundary. */
  private final BookingStore store;

  /** The write path. */
  private final BookingGate gate;

  /** The subscription registry. */
  private final SubscriptionRegistry registry;

  /** Computes the availability feed. */
  private final AvailabilitySyncEngine engine;

  /** Classifies and throttles the admin feed. */
  private final AdminAlertRouter router;

  /** Supervises the subscriptions. */
  private final HealthMonitor monitor;

  /** Runs the conflict watches. */
  private final ConflictWatcher watcher;

  /** The reconnect budget reported once stopped. */
  private final ReconnectPolicy policy;

  /** The thread running the conflict watch checks. */
  private final ExecutorService conflictChecks;

  /** Live admin alert registrations per administrator; loop confined. */
  private final Map<String, Integer> adminSubscribers = new HashMap<>();

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private RoomSync(final String theClientId, final EventLoop theLoop,
      final boolean theOwnsLoop, final ChangeEventSource theSource,
      final BookingStore theStore, final ReconnectPolicy thePolicy,
      final Duration theThrottleWindow, final RoomSyncMetrics theMetrics) {
    clientId = theClientId;
    loop = theLoop;
    ownsLoop = theOwnsLoop;
    source = theSource;
    store = theStore;
    policy = thePolicy;
    gate = new BookingGate(theStore, theMetrics);
    registry = new SubscriptionRegistry(theLoop, theSource, thePolicy,
        theMetrics);
    engine = new AvailabilitySyncEngine(theLoop, theClientId, theMetrics);
    router = new AdminAlertRouter(theLoop, theThrottleWindow, theMetrics);
    monitor = new HealthMonitor(theLoop, registry, thePolicy, theMetrics);
    conflictChecks = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "roomsync-conflict-check");
      thread.setDaemon(true);
      return thread;
    });
    watcher = new ConflictWatcher(registry, gate, conflictChecks,
        theLoop.clock());
  }

  /**
   * Creates a new builder for constructing a RoomSync instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the transport, opens the global availability channel and starts
   * the health monitor.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("RoomSync has already been started");
    }
    source.start();
    registry.open(GLOBAL_CHANNEL, ChannelSpec.of(Table.BOOKINGS, Table.ROOMS),
        engine::onChange);
    monitor.start();
    log.info("RoomSync {} started", clientId);
  }

  /**
   * Stops the health monitor, closes every subscription and stops the
   * transport. Idempotent.
   *
   * <p>A stopped instance cannot be restarted. Its status queries report
   * {@link ConnectionStatus#DISCONNECTED} and removing a registration or
   * cancelling a watch it handed out does nothing.
   */
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }
    monitor.stop();
    registry.shutdown();
    source.stop();
    conflictChecks.shutdownNow();
    if (ownsLoop) {
      loop.shutdown();
    }
    log.info("RoomSync {} stopped", clientId);
  }

  /**
   * Returns the identifier of this client.
   *
   * @return the client id, never null
   */
  public String clientId() {
    return clientId;
  }

  /**
   * Registers a listener for the availability feed.
   *
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration subscribeAvailability(
      final AvailabilityListener listener) {
    return engine.subscribe(listener);
  }

  /**
   * Registers a listener for an administrator's alerts, opening the
   * administrator's notification channel if needed.
   *
   * @param adminUserId the administrator, never null
   * @param listener    the listener, never null
   *
   * @return the registration; removing the last one for the administrator
   *         closes the channel, never null
   */
  public Registration subscribeAdminAlerts(final String adminUserId,
      final AdminAlertListener listener) {
    Objects.requireNonNull(adminUserId, "adminUserId must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    requireRunning();
    final String channelId = ADMIN_CHANNEL_PREFIX + adminUserId;
    loop.run(() -> {
      if (adminSubscribers.merge(adminUserId, 1, Integer::sum) == 1) {
        registry.open(channelId, ChannelSpec.of(Table.NOTIFICATIONS)
            .onlyEvents(ChangeType.INSERT)
            .filteredBy(Columns.USER_ID, adminUserId), router::onChange);
      }
    });
    final Registration alerts = router.subscribe(adminUserId, listener);
    final AtomicBoolean removed = new AtomicBoolean(false);
    return () -> {
      if (!removed.compareAndSet(false, true)) {
        return;
      }
      alerts.remove();
      if (stopped.get()) {
        return;
      }
      loop.run(() -> {
        if (adminSubscribers.merge(adminUserId, -1, Integer::sum) == 0) {
          adminSubscribers.remove(adminUserId);
          registry.close(channelId);
        }
      });
    };
  }

  /**
   * Watches a booking window for conflicts created by other clients.
   *
   * @param roomId    the room id, never null
   * @param start     the window start, never null
   * @param end       the window end, must be after the start
   * @param excludeId the booking being edited, may be null
   * @param listener  receives the reports, never null
   *
   * @return the watch, never null
   */
  public ConflictWatch watchConflicts(final String roomId,
      final Instant start, final Instant end, final String excludeId,
      final ConflictListener listener) {
    requireRunning();
    return watcher.watch(roomId, start, end, excludeId, listener);
  }

  /**
   * Returns the confirmed bookings overlapping a window.
   *
   * @param roomId    the room id, never null
   * @param start     the window start, never null
   * @param end       the window end, must be after the start
   * @param excludeId the booking being updated, may be null
   *
   * @return the conflicts, empty if the window is free
   */
  public List<BookingInterval> checkConflicts(final String roomId,
      final Instant start, final Instant end, final String excludeId) {
    return gate.checkConflicts(roomId, start, end, excludeId);
  }

  /**
   * Creates a booking.
   *
   * @param request the booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws BookingConflictException if the window is taken
   */
  public BookingInterval createBooking(final BookingRequest request) {
    return gate.create(request);
  }

  /**
   * Rewrites a booking.
   *
   * @param bookingId the booking id, never null
   * @param request   the new booking data, never null
   *
   * @return the stored booking, never null
   *
   * @throws BookingConflictException if the new window is taken
   * @throws BookingNotFoundException if the booking does not exist
   */
  public BookingInterval updateBooking(final String bookingId,
      final BookingRequest request) {
    return gate.update(bookingId, request);
  }

  /**
   * Cancels a booking.
   *
   * @param bookingId the booking id, never null
   *
   * @return the cancelled booking, never null
   *
   * @throws BookingNotFoundException if the booking does not exist
   */
  public BookingInterval cancelBooking(final String bookingId) {
    return gate.cancel(bookingId);
  }

  /**
   * Restores the reconnect budget and re-opens every failed subscription.
   *
   * @return the number of subscriptions moved back to connecting
   */
  public int reconnectAll() {
    return monitor.reconnectAll();
  }

  /**
   * Returns the subscription counts by status.
   *
   * @return the snapshot, never null
   */
  public HealthSnapshot health() {
    return registry.health();
  }

  /**
   * Returns the full connection picture.
   *
   * @return the status, never null
   */
  public DetailedStatus detailedStatus() {
    if (stopped.get()) {
      final HealthSnapshot health = registry.health();
      return new DetailedStatus(health.aggregate(), List.of(), health, 0,
          policy.maxAttempts(), false);
    }
    return monitor.detailedStatus();
  }

  /**
   * Returns the aggregate connection status.
   *
   * @return the status, never null
   */
  public ConnectionStatus status() {
    return registry.status();
  }

  /**
   * Registers a listener for the aggregate connection status.
   *
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration onStatusChange(final ConnectionStatusListener listener) {
    return registry.onStatusChange(listener);
  }

  /**
   * Returns the last applied availability of a room.
   *
   * @param roomId the room id, never null
   *
   * @return the state, empty if the room was never seen
   */
  public Optional<RoomAvailability> availability(final String roomId) {
    return engine.availability(roomId);
  }

  /**
   * Loads a room's upcoming confirmed bookings from the store into the
   * availability engine.
   *
   * @param roomId the room id, never null
   *
   * @return the computed availability, never null
   */
  public RoomAvailability primeAvailability(final String roomId) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    final List<BookingInterval> bookings =
        store.findUpcoming(roomId, loop.clock().instant());
    return engine.prime(roomId, bookings);
  }

  private void requireRunning() {
    if (!started.get() || stopped.get()) {
      throw new IllegalStateException("RoomSync is not running");
    }
  }

  /**
   * Builder for creating {@link RoomSync} instances.
   *
   * <p>All settings are optional. Without a source and a store the
   * instance runs single-node, on an in-process source fed by an in-memory
   * store.
   */
  public static final class Builder {

    /** The optional client identifier. */
    private String clientId;

    /** The optional change event source. */
    private ChangeEventSource source;

    /** The optional booking store. */
    private BookingStore store;

    /** The optional event loop. */
    private EventLoop loop;

    /** The optional clock for the default event loop. */
    private Clock clock;

    /** The optional reconnect policy. */
    private ReconnectPolicy reconnectPolicy;

    /** The optional alert throttle window. */
    private Duration alertThrottleWindow;

    /** The optional metrics reporter. */
    private RoomSyncMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the identifier stamped on the availability events of this
     * client.
     *
     * <p>If not set, an auto-generated UUID will be used.
     *
     * @param theClientId the client identifier, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theClientId is empty
     */
    public Builder clientId(final String theClientId) {
      Objects.requireNonNull(theClientId, "clientId must not be null");
      if (theClientId.isEmpty()) {
        throw new IllegalArgumentException("clientId must not be empty");
      }
      this.clientId = theClientId;
      return this;
    }

    /**
     * Sets the change event transport.
     *
     * <p>If not set, a {@link LocalChangeEventSource} is used.
     *
     * @param theSource the source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder changeEventSource(final ChangeEventSource theSource) {
      Objects.requireNonNull(theSource, "changeEventSource must not be null");
      this.source = theSource;
      return this;
    }

    /**
     * Sets the booking store.
     *
     * <p>If not set, an {@link InMemoryBookingStore} is used; it publishes
     * its writes when the source is a {@link LocalChangeEventSource}.
     *
     * @param theStore the store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder bookingStore(final BookingStore theStore) {
      Objects.requireNonNull(theStore, "bookingStore must not be null");
      this.store = theStore;
      return this;
    }

    /**
     * Sets the event loop. A loop given here is not shut down by
     * {@link RoomSync#stop()}.
     *
     * <p>If not set, a {@link SingleThreadEventLoop} is created.
     *
     * @param theLoop the loop, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder eventLoop(final EventLoop theLoop) {
      Objects.requireNonNull(theLoop, "eventLoop must not be null");
      this.loop = theLoop;
      return this;
    }

    /**
     * Sets the clock of the default event loop.
     *
     * <p>If not set, the system UTC clock is used. Cannot be combined with
     * {@link #eventLoop(EventLoop)}, whose loop brings its own clock.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Sets the reconnect policy.
     *
     * <p>If not set, {@link ReconnectPolicy#defaultPolicy()} is used.
     *
     * @param thePolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder reconnectPolicy(final ReconnectPolicy thePolicy) {
      Objects.requireNonNull(thePolicy, "reconnectPolicy must not be null");
      this.reconnectPolicy = thePolicy;
      return this;
    }

    /**
     * Sets the throttle window of low and medium admin alerts.
     *
     * <p>If not set, 5 seconds are used.
     *
     * @param theWindow the window, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder alertThrottleWindow(final Duration theWindow) {
      Objects.requireNonNull(theWindow, "alertThrottleWindow must not be null");
      this.alertThrottleWindow = theWindow;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopRoomSyncMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final RoomSyncMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the RoomSync instance with the configured settings.
     *
     * <p>Any unset optional fields are replaced with their defaults.
     *
     * @return a new RoomSync instance, never null
     *
     * @throws IllegalStateException if both a clock and an event loop were
     *                               set
     */
    public RoomSync build() {
      if (loop != null && clock != null) {
        throw new IllegalStateException(
            "Set either a clock or an event loop, not both");
      }
      final String resolvedClientId = clientId != null
          ? clientId : UUID.randomUUID().toString();
      final boolean ownsLoop = loop == null;
      final EventLoop resolvedLoop = loop != null
          ? loop
          : new SingleThreadEventLoop(
              clock != null ? clock : Clock.systemUTC());
      final ChangeEventSource resolvedSource = source != null
          ? source : new LocalChangeEventSource();
      final BookingStore resolvedStore;
      if (store != null) {
        resolvedStore = store;
      } else if (resolvedSource instanceof LocalChangeEventSource) {
        resolvedStore = new InMemoryBookingStore(resolvedLoop.clock(),
            (LocalChangeEventSource) resolvedSource);
      } else {
        resolvedStore = new InMemoryBookingStore(resolvedLoop.clock());
      }
      final ReconnectPolicy resolvedPolicy = reconnectPolicy != null
          ? reconnectPolicy : ReconnectPolicy.defaultPolicy();
      final Duration resolvedWindow = alertThrottleWindow != null
          ? alertThrottleWindow : AdminAlertRouter.DEFAULT_THROTTLE_WINDOW;
      final RoomSyncMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopRoomSyncMetrics();

      return new RoomSync(
          resolvedClientId,
          resolvedLoop,
          ownsLoop,
          resolvedSource,
          resolvedStore,
          resolvedPolicy,
          resolvedWindow,
          resolvedMetrics);
    }
  }
}
