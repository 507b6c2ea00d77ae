package org.waabox.roomsync.source;

/**
 * An open channel on a {@link ChangeEventSource}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChannelHandle {

  /**
   * Returns the channel id the handle was opened with.
   *
   * @return the id, never null
   */
  String channelId();

  /** Closes the channel. Idempotent. */
  void close();
}
