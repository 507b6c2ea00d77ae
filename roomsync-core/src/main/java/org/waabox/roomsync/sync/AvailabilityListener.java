package org.waabox.roomsync.sync;

/**
 * Receives the availability feed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface AvailabilityListener {

  /**
   * Called on the event loop for every published availability change.
   *
   * @param event the change, never null
   */
  void onAvailabilityChange(SyncEvent event);
}
