package org.waabox.roomsync.metrics;

import org.waabox.roomsync.alert.AlertPriority;
import org.waabox.roomsync.registry.ConnectionStatus;

/**
 * An abstraction for recording operational metrics of the synchronization
 * engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopRoomSyncMetrics}
 * when metrics collection is not required.
 *
 * <p>Implementations must be thread-safe: the write gate reports from the
 * caller's thread, everything else from the event loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RoomSyncMetrics {

  /**
   * Records a change of the aggregate connection status.
   *
   * @param status the new aggregate status, never null
   */
  void aggregateStatusChanged(ConnectionStatus status);

  /**
   * Records an automatic reconnect attempt.
   *
   * @param attempt the one-based attempt number
   */
  void reconnectAttempted(int attempt);

  /**
   * Records that the automatic reconnect budget ran out.
   *
   * @param attempts the number of attempts made
   */
  void reconnectExhausted(int attempts);

  /**
   * Records a channel that did not complete its handshake in time.
   *
   * @param channelId the channel id, never null
   */
  void channelTimedOut(String channelId);

  /**
   * Records a transport callback discarded because its channel was closed
   * or superseded.
   *
   * @param channelId the channel id, never null
   */
  void staleCallbackDiscarded(String channelId);

  /**
   * Records a downstream listener failure.
   *
   * @param feed  the feed whose listener failed, never null
   * @param cause the listener exception, never null
   */
  void listenerFailed(String feed, Throwable cause);

  /**
   * Records an availability change published downstream.
   *
   * @param roomId the room id, never null
   */
  void syncEventPublished(String roomId);

  /**
   * Records a change that did not produce an availability update.
   *
   * @param roomId the room id, never null
   * @param reason a short reason such as "stale" or "duplicate", never null
   */
  void syncEventDiscarded(String roomId, String reason);

  /**
   * Records an admin alert delivered to the listeners.
   *
   * @param priority the alert priority, never null
   */
  void alertDelivered(AlertPriority priority);

  /**
   * Records an admin alert suppressed by the throttle.
   *
   * @param priority the alert priority, never null
   */
  void alertThrottled(AlertPriority priority);

  /**
   * Records a booking conflict found before or during a write.
   *
   * @param roomId    the room id, never null
   * @param conflicts the number of overlapping bookings
   */
  void conflictDetected(String roomId, int conflicts);
}
