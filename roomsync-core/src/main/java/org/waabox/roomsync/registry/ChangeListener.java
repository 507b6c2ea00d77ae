package org.waabox.roomsync.registry;

import org.waabox.roomsync.source.ChangeEvent;

/**
 * Receives the change events of a registry subscription, on the event loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChangeListener {

  /**
   * Called for every change event of a live subscription.
   *
   * @param event the event, never null
   */
  void onChange(ChangeEvent event);
}
