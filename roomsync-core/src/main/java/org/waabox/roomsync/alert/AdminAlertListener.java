package org.waabox.roomsync.alert;

/**
 * Receives the admin feed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface AdminAlertListener {

  /**
   * Called on the event loop for every delivered alert.
   *
   * @param notification the alert, never null
   */
  void onAlert(AdminNotification notification);
}
