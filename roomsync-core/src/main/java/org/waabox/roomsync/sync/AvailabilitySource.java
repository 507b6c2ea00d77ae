package org.waabox.roomsync.sync;

/**
 * The kind of row that triggered an availability change.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum AvailabilitySource {

  /** A booking was created, changed, cancelled or removed. */
  BOOKING,

  /** A room was activated or deactivated. */
  ROOM
}
