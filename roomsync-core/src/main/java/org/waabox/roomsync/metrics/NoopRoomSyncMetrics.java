package org.waabox.roomsync.metrics;

import org.waabox.roomsync.alert.AlertPriority;
import org.waabox.roomsync.registry.ConnectionStatus;

/**
 * A no-operation implementation of {@link RoomSyncMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRoomSyncMetrics implements RoomSyncMetrics {

  /** {@inheritDoc} */
  @Override
  public void aggregateStatusChanged(final ConnectionStatus status) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconnectAttempted(final int attempt) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconnectExhausted(final int attempts) {
  }

  /** {@inheritDoc} */
  @Override
  public void channelTimedOut(final String channelId) {
  }

  /** {@inheritDoc} */
  @Override
  public void staleCallbackDiscarded(final String channelId) {
  }

  /** {@inheritDoc} */
  @Override
  public void listenerFailed(final String feed, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void syncEventPublished(final String roomId) {
  }

  /** {@inheritDoc} */
  @Override
  public void syncEventDiscarded(final String roomId, final String reason) {
  }

  /** {@inheritDoc} */
  @Override
  public void alertDelivered(final AlertPriority priority) {
  }

  /** {@inheritDoc} */
  @Override
  public void alertThrottled(final AlertPriority priority) {
  }

  /** {@inheritDoc} */
  @Override
  public void conflictDetected(final String roomId, final int conflicts) {
  }
}
