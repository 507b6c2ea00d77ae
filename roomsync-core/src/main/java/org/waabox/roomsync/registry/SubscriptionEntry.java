package org.waabox.roomsync.registry;

import java.time.Duration;
import java.time.Instant;

import org.waabox.roomsync.loop.ScheduledTask;
import org.waabox.roomsync.source.ChannelHandle;
import org.waabox.roomsync.source.ChannelSpec;

/**
 * Mutable registry state of one logical channel. Confined to the event
 * loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SubscriptionEntry {

  /** The logical channel id, never null. */
  private final String id;

  /** When the entry was registered, never null. */
  private final Instant createdAt;

  /** What the channel listens to, replaced when a deferred open coalesces. */
  private ChannelSpec spec;

  /** Receives the channel events, replaced on coalesce. */
  private ChangeListener listener;

  /** The current status, never null. */
  private ConnectionStatus status = ConnectionStatus.CONNECTING;

  /** When the status last changed, never null. */
  private Instant lastUpdate;

  /** When the entry last became connected, null unless connected. */
  private Instant connectedSince;

  /** The epoch token; bumped whenever the current channel is dropped. */
  private long epoch;

  /** The open transport channel, null while none is open. */
  private ChannelHandle handle;

  /** The pending deferred open, null when none. */
  private ScheduledTask openTimer;

  /** The pending connect timeout, null when none. */
  private ScheduledTask connectTimer;

  /** The last channel failure, null if none. */
  private Throwable lastError;

  SubscriptionEntry(final String theId, final ChannelSpec theSpec,
      final ChangeListener theListener, final Instant now) {
    id = theId;
    spec = theSpec;
    listener = theListener;
    createdAt = now;
    lastUpdate = now;
  }

  String id() {
    return id;
  }

  ChannelSpec spec() {
    return spec;
  }

  ChangeListener listener() {
    return listener;
  }

  ConnectionStatus status() {
    return status;
  }

  long epoch() {
    return epoch;
  }

  ChannelHandle handle() {
    return handle;
  }

  Throwable lastError() {
    return lastError;
  }

  boolean isDeferred() {
    return openTimer != null;
  }

  void replace(final ChannelSpec theSpec, final ChangeListener theListener) {
    spec = theSpec;
    listener = theListener;
  }

  void status(final ConnectionStatus next, final Instant now) {
    status = next;
    lastUpdate = now;
    connectedSince = next == ConnectionStatus.CONNECTED ? now : null;
    if (next != ConnectionStatus.CONNECTING) {
      cancelConnectTimer();
    }
  }

  long nextEpoch() {
    return ++epoch;
  }

  void handle(final ChannelHandle theHandle) {
    handle = theHandle;
  }

  void lastError(final Throwable error) {
    lastError = error;
  }

  void openTimer(final ScheduledTask task) {
    openTimer = task;
  }

  void connectTimer(final ScheduledTask task) {
    connectTimer = task;
  }

  void cancelOpenTimer() {
    if (openTimer != null) {
      openTimer.cancel();
      openTimer = null;
    }
  }

  void cancelConnectTimer() {
    if (connectTimer != null) {
      connectTimer.cancel();
      connectTimer = null;
    }
  }

  Duration uptime(final Instant now) {
    if (connectedSince == null || now.isBefore(connectedSince)) {
      return Duration.ZERO;
    }
    return Duration.between(connectedSince, now);
  }

  Instant lastUpdate() {
    return lastUpdate;
  }

  Subscription snapshot(final Instant now) {
    return new Subscription(id, status, lastUpdate, createdAt, uptime(now));
  }
}
