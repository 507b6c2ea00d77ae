package org.waabox.roomsync.sync;

import java.util.concurrent.atomic.AtomicBoolean;

import org.waabox.roomsync.registry.SubscriptionRegistry;

/**
 * A live re-validation of a booking window, bound to its own channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConflictWatch {

  /** The channel the watch listens on, never null. */
  private final String channelId;

  /** The registry owning the channel, never null. */
  private final SubscriptionRegistry registry;

  /** Whether the watch was cancelled. */
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  ConflictWatch(final String theChannelId,
      final SubscriptionRegistry theRegistry) {
    channelId = theChannelId;
    registry = theRegistry;
  }

  /**
   * Returns the id of the channel the watch listens on.
   *
   * @return the channel id, never null
   */
  public String channelId() {
    return channelId;
  }

  /**
   * Whether {@link #cancel()} was called.
   *
   * @return true once cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Stops the watch and closes its channel. Idempotent.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      registry.close(channelId);
    }
  }
}
