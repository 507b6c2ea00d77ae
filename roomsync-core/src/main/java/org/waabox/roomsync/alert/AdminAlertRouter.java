package org.waabox.roomsync.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.Registration;
import org.waabox.roomsync.loop.EventLoop;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.Table;

/**
 * Classifies notifications and delivers the admin-relevant ones to the
 * admin feed.
 *
 * <p>High and critical alerts are delivered immediately and are never
 * dropped. Low and medium alerts are throttled per recipient, priority and
 * room (or notification type when the alert names no room): at most one
 * is delivered per throttle window.
 *
 * <p>All state is confined to the {@link EventLoop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AdminAlertRouter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AdminAlertRouter.class);

  /** The default throttle window. */
  public static final Duration DEFAULT_THROTTLE_WINDOW = Duration.ofSeconds(5);

  /** The feed name reported when an alert listener fails. */
  private static final String FEED = "admin-alerts";

  /** The priority and source of every admin-relevant type. */
  private static final Map<NotificationType, Classification> TABLE =
      new EnumMap<>(NotificationType.class);

  static {
    TABLE.put(NotificationType.SYSTEM_ERROR,
        new Classification(AlertPriority.CRITICAL, AlertSource.SYSTEM));
    TABLE.put(NotificationType.ADMIN_OVERRIDE,
        new Classification(AlertPriority.HIGH, AlertSource.BOOKING));
    TABLE.put(NotificationType.BOOKING_CONFLICT,
        new Classification(AlertPriority.HIGH, AlertSource.BOOKING));
    TABLE.put(NotificationType.ROOM_MANAGEMENT,
        new Classification(AlertPriority.MEDIUM, AlertSource.ROOM));
    TABLE.put(NotificationType.BOOKING_CANCELLED,
        new Classification(AlertPriority.LOW, AlertSource.BOOKING));
    TABLE.put(NotificationType.BOOKING_MODIFIED,
        new Classification(AlertPriority.LOW, AlertSource.BOOKING));
  }

  /** The loop confining the router state, never null. */
  private final EventLoop loop;

  /** The throttle window for low and medium alerts, never null. */
  private final Duration throttleWindow;

  /** The metrics sink, never null. */
  private final RoomSyncMetrics metrics;

  /** When each throttle key last delivered. */
  private final Map<String, Instant> lastDelivery = new HashMap<>();

  /** The feed subscribers. */
  private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

  /**
   * Creates a new router.
   *
   * @param theLoop           the event loop, never null
   * @param theThrottleWindow the low and medium throttle window, must not
   *                          be negative
   * @param theMetrics        the metrics sink, never null
   */
  public AdminAlertRouter(final EventLoop theLoop,
      final Duration theThrottleWindow, final RoomSyncMetrics theMetrics) {
    loop = Objects.requireNonNull(theLoop, "loop must not be null");
    throttleWindow = Objects.requireNonNull(theThrottleWindow,
        "throttleWindow must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    if (theThrottleWindow.isNegative()) {
      throw new IllegalArgumentException(
          "throttleWindow must not be negative, got: " + theThrottleWindow);
    }
  }

  /**
   * Assigns a priority and a source to a notification.
   *
   * @param raw the notification, never null
   *
   * @return the classification, empty if the type is not admin-relevant
   */
  public Optional<Classification> classify(final RawNotification raw) {
    Objects.requireNonNull(raw, "raw must not be null");
    return NotificationType.fromWire(raw.type()).map(TABLE::get);
  }

  /**
   * Registers a listener for every recipient's alerts.
   *
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration subscribe(final AdminAlertListener listener) {
    return subscribe(null, listener);
  }

  /**
   * Registers a listener for one recipient's alerts.
   *
   * @param userId   the recipient, null for every recipient
   * @param listener the listener, never null
   *
   * @return the registration, never null
   */
  public Registration subscribe(final String userId,
      final AdminAlertListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    final Subscriber subscriber = new Subscriber(userId, listener);
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  /**
   * Routes notification inserts; other change events are ignored.
   *
   * @param event the change, never null
   */
  public void onChange(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    if (event.table() != Table.NOTIFICATIONS
        || event.eventType() != ChangeType.INSERT) {
      return;
    }
    final RawNotification raw;
    try {
      raw = RawNotification.fromRow(event.current());
    } catch (final IllegalArgumentException e) {
      log.warn("Ignoring malformed notification row: {}", e.getMessage());
      return;
    }
    route(raw);
  }

  /**
   * Classifies a notification and delivers it unless it is not
   * admin-relevant or is throttled.
   *
   * @param raw the notification, never null
   *
   * @return true if delivered to the feed
   */
  public boolean route(final RawNotification raw) {
    Objects.requireNonNull(raw, "raw must not be null");
    return loop.call(() -> doRoute(raw));
  }

  private boolean doRoute(final RawNotification raw) {
    final Optional<Classification> classification = classify(raw);
    if (classification.isEmpty()) {
      log.debug("Notification {} of type {} is not admin-relevant",
          raw.id(), raw.type());
      return false;
    }
    final AlertPriority priority = classification.get().priority();
    final Instant now = loop.clock().instant();

    if (!priority.isUrgent()) {
      evictExpired(now);
      final String key = throttleKey(raw, priority);
      final Instant last = lastDelivery.get(key);
      if (last != null && now.isBefore(last.plus(throttleWindow))) {
        log.debug("Throttled {} alert {} ({})", priority, raw.id(), key);
        metrics.alertThrottled(priority);
        return false;
      }
      lastDelivery.put(key, now);
    }

    final AdminNotification alert = new AdminNotification(raw.id(),
        NotificationType.fromWire(raw.type()).orElseThrow(), priority,
        classification.get().source(), now, raw.userId(), raw.title(),
        raw.message(), raw.roomId(), raw.bookingId());
    metrics.alertDelivered(priority);
    if (priority == AlertPriority.CRITICAL) {
      log.warn("Critical admin alert {}: {}", raw.id(), raw.title());
    } else {
      log.debug("Delivering {} alert {}", priority, raw.id());
    }
    for (Subscriber subscriber : subscribers) {
      if (subscriber.userId != null
          && !subscriber.userId.equals(raw.userId())) {
        continue;
      }
      try {
        subscriber.listener.onAlert(alert);
      } catch (final RuntimeException e) {
        log.error("Admin alert listener failed: {}", e.getMessage(), e);
        metrics.listenerFailed(FEED, e);
      }
    }
    return true;
  }

  private void evictExpired(final Instant now) {
    lastDelivery.values().removeIf(
        delivered -> !now.isBefore(delivered.plus(throttleWindow)));
  }

  private static String throttleKey(final RawNotification raw,
      final AlertPriority priority) {
    final String scope = raw.roomId() != null
        ? "room:" + raw.roomId()
        : "type:" + raw.type().toLowerCase();
    return raw.userId() + "|" + priority + "|" + scope;
  }

  /** A feed listener with its optional recipient filter. */
  private static final class Subscriber {

    /** The recipient, null for every recipient. */
    private final String userId;

    /** The listener, never null. */
    private final AdminAlertListener listener;

    private Subscriber(final String theUserId,
        final AdminAlertListener theListener) {
      userId = theUserId;
      listener = theListener;
    }
  }
}
