package org.waabox.roomsync.alert;

/**
 * The area of the system an admin alert comes from.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum AlertSource {

  BOOKING,

  ROOM,

  SYSTEM,

  USER
}
