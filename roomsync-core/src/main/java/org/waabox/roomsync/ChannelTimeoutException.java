package org.waabox.roomsync;

import java.time.Duration;

/**
 * Reported when a channel stays in the connecting state longer than the
 * configured connect timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChannelTimeoutException extends ChannelException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new timeout exception.
   *
   * @param channelId the id of the channel that never connected, never null
   * @param timeout   the timeout that elapsed, never null
   */
  public ChannelTimeoutException(final String channelId,
      final Duration timeout) {
    super(channelId, "handshake not completed within " + timeout.toMillis()
        + " ms");
  }
}
