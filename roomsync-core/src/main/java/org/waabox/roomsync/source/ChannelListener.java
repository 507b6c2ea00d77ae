package org.waabox.roomsync.source;

/**
 * Receives the events and status signals of one channel.
 *
 * <p>Transports may invoke it from any thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChannelListener {

  /**
   * Called for every change event matching the channel spec.
   *
   * @param event the event, never null
   */
  void onChange(ChangeEvent event);

  /**
   * Called when the transport status of the channel changes.
   *
   * @param signal the signal, never null
   * @param cause  the transport failure, null unless the signal is an error
   */
  void onSignal(ChannelSignal signal, Throwable cause);
}
