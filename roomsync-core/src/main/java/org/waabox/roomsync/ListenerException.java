package org.waabox.roomsync;

/**
 * Wraps an exception thrown by a downstream listener.
 *
 * <p>Listener failures are isolated at the broadcast boundary: they are
 * logged and reported to the metrics, never propagated into the event
 * loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ListenerException extends RoomSyncException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new listener exception.
   *
   * @param feed  the name of the feed whose listener failed, never null
   * @param cause the exception thrown by the listener, never null
   */
  public ListenerException(final String feed, final Throwable cause) {
    super("Listener failed on feed '" + feed + "': " + cause.getMessage(),
        cause);
  }
}
