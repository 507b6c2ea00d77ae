package org.waabox.roomsync.sync;

/**
 * Receives the reports of a {@link ConflictWatch}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ConflictListener {

  /**
   * Called after every check of the watched window.
   *
   * @param report the check result, never null
   */
  void onReport(ConflictReport report);
}
