package org.waabox.roomsync.source;

/**
 * A push transport delivering row change events over named channels.
 *
 * <p>Implementations define how change events reach the engine (in
 * process, by polling a change log, from a Kafka topic) and manage the
 * lifecycle of the underlying transport.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Call {@link #start()} to bring the transport up</li>
 *   <li>Open channels via {@link #open(String, ChannelSpec, ChannelListener)}
 *   </li>
 *   <li>Close channels through their {@link ChannelHandle}</li>
 *   <li>Call {@link #stop()} to shut down the transport</li>
 * </ol>
 *
 * <p>Each open channel reports {@link ChannelSignal#SUBSCRIBED} once events
 * can flow, and an error or close signal when it breaks. A transport is
 * allowed to deliver a late callback after its handle was closed; callers
 * must tolerate it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeEventSource {

  /**
   * Starts the transport.
   */
  void start();

  /**
   * Opens a channel.
   *
   * @param channelId the logical channel id, never null
   * @param spec      what the channel listens to, never null
   * @param listener  receives the channel events and signals, never null
   *
   * @return the open channel, never null
   */
  ChannelHandle open(String channelId, ChannelSpec spec,
      ChannelListener listener);

  /**
   * Stops the transport and closes every channel still open.
   */
  void stop();
}
