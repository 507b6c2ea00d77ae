package org.waabox.roomsync.source;

/**
 * Status signals a transport reports for an open channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChannelSignal {

  /** The handshake completed; events will flow. */
  SUBSCRIBED,

  /** The transport failed. */
  CHANNEL_ERROR,

  /** The transport gave up waiting for the server. */
  TIMED_OUT,

  /** The channel was closed by either side. */
  CLOSED
}
