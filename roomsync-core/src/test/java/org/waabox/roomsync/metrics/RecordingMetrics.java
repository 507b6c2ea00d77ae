package org.waabox.roomsync.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.roomsync.alert.AlertPriority;
import org.waabox.roomsync.registry.ConnectionStatus;

/**
 * {@link RoomSyncMetrics} that counts what it is told, for assertions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordingMetrics extends NoopRoomSyncMetrics {

  public final List<ConnectionStatus> aggregates = new ArrayList<>();
  public final AtomicInteger reconnectAttempts = new AtomicInteger();
  public final AtomicInteger exhausted = new AtomicInteger();
  public final AtomicInteger timeouts = new AtomicInteger();
  public final AtomicInteger staleCallbacks = new AtomicInteger();
  public final AtomicInteger listenerFailures = new AtomicInteger();
  public final AtomicInteger published = new AtomicInteger();
  public final List<String> discarded = new ArrayList<>();
  public final AtomicInteger delivered = new AtomicInteger();
  public final AtomicInteger throttled = new AtomicInteger();
  public final AtomicInteger conflicts = new AtomicInteger();

  @Override
  public void aggregateStatusChanged(final ConnectionStatus status) {
    aggregates.add(status);
  }

  @Override
  public void reconnectAttempted(final int attempt) {
    reconnectAttempts.incrementAndGet();
  }

  @Override
  public void reconnectExhausted(final int attempts) {
    exhausted.incrementAndGet();
  }

  @Override
  public void channelTimedOut(final String channelId) {
    timeouts.incrementAndGet();
  }

  @Override
  public void staleCallbackDiscarded(final String channelId) {
    staleCallbacks.incrementAndGet();
  }

  @Override
  public void listenerFailed(final String feed, final Throwable cause) {
    listenerFailures.incrementAndGet();
  }

  @Override
  public void syncEventPublished(final String roomId) {
    published.incrementAndGet();
  }

  @Override
  public void syncEventDiscarded(final String roomId, final String reason) {
    discarded.add(reason);
  }

  @Override
  public void alertDelivered(final AlertPriority priority) {
    delivered.incrementAndGet();
  }

  @Override
  public void alertThrottled(final AlertPriority priority) {
    throttled.incrementAndGet();
  }

  @Override
  public void conflictDetected(final String roomId, final int count) {
    conflicts.incrementAndGet();
  }
}
