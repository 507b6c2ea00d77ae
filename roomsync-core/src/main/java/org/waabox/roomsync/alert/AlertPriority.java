package org.waabox.roomsync.alert;

/**
 * How urgently an admin alert must reach the administrators.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum AlertPriority {

  LOW,

  MEDIUM,

  HIGH,

  CRITICAL;

  /**
   * Whether alerts of this priority bypass the throttle.
   *
   * @return true for high and critical
   */
  public boolean isUrgent() {
    return this == HIGH || this == CRITICAL;
  }
}
