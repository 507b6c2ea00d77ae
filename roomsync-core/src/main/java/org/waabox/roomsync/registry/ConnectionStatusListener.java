package org.waabox.roomsync.registry;

/**
 * Notified with the aggregate status after every subscription transition.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ConnectionStatusListener {

  /**
   * Called on the event loop after a transition.
   *
   * @param status the recomputed aggregate status, never null
   */
  void onStatusChange(ConnectionStatus status);
}
