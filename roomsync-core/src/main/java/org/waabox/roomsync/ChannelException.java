package org.waabox.roomsync;

/**
 * Thrown or reported when a push channel fails at the transport level.
 *
 * <p>Channel failures are retryable: the reconnector re-opens the channel
 * within its retry budget.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChannelException extends RoomSyncException {

  private static final long serialVersionUID = 1L;

  /** The id of the failed channel, never null. */
  private final String channelId;

  /**
   * Creates a new channel exception.
   *
   * @param theChannelId the id of the failed channel, never null
   * @param message      the detail message, never null
   */
  public ChannelException(final String theChannelId, final String message) {
    super("Channel '" + theChannelId + "': " + message);
    channelId = theChannelId;
  }

  /**
   * Creates a new channel exception with an underlying cause.
   *
   * @param theChannelId the id of the failed channel, never null
   * @param message      the detail message, never null
   * @param cause        the transport failure, never null
   */
  public ChannelException(final String theChannelId, final String message,
      final Throwable cause) {
    super("Channel '" + theChannelId + "': " + message, cause);
    channelId = theChannelId;
  }

  /**
   * Returns the id of the failed channel.
   *
   * @return the channel id, never null
   */
  public String channelId() {
    return channelId;
  }

  /** {@inheritDoc} */
  @Override
  public boolean isRetryable() {
    return true;
  }
}
