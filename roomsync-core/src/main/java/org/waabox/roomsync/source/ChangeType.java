package org.waabox.roomsync.source;

/**
 * The kind of row mutation a {@link ChangeEvent} describes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChangeType {

  /** A row was created; the event carries the new row. */
  INSERT,

  /** A row was modified; the event carries the new row and maybe the old. */
  UPDATE,

  /** A row was removed; the event carries the old row. */
  DELETE
}
