package org.waabox.roomsync.registry;

import java.util.Collection;
import java.util.Objects;

import org.waabox.roomsync.source.ChannelSignal;

/**
 * Connection status of a single subscription, and of the registry as a
 * whole.
 *
 * <p>Legal transitions:
 * <pre>
 * CONNECTING -> CONNECTED
 * CONNECTING | CONNECTED -> ERROR
 * ERROR | DISCONNECTED -> CONNECTING
 * any -> DISCONNECTED
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConnectionStatus {

  /** A channel open is pending or in progress. */
  CONNECTING,

  /** The channel is live. */
  CONNECTED,

  /** The channel failed or timed out. */
  ERROR,

  /** The channel was closed. */
  DISCONNECTED;

  /**
   * Whether a subscription in this status may move to the given status.
   *
   * @param next the target status, never null
   *
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(final ConnectionStatus next) {
    Objects.requireNonNull(next, "next must not be null");
    switch (next) {
      case CONNECTED:
        return this == CONNECTING;
      case ERROR:
        return this == CONNECTING || this == CONNECTED;
      case CONNECTING:
        return this == ERROR || this == DISCONNECTED;
      case DISCONNECTED:
        return true;
      default:
        return false;
    }
  }

  /**
   * Maps a transport signal to the status it implies.
   *
   * @param signal the signal, never null
   *
   * @return the status, never null
   */
  public static ConnectionStatus fromSignal(final ChannelSignal signal) {
    Objects.requireNonNull(signal, "signal must not be null");
    switch (signal) {
      case SUBSCRIBED:
        return CONNECTED;
      case CHANNEL_ERROR:
      case TIMED_OUT:
        return ERROR;
      case CLOSED:
      default:
        return DISCONNECTED;
    }
  }

  /**
   * Computes the aggregate status of a set of subscriptions.
   *
   * <p>No subscriptions is {@link #DISCONNECTED}; all connected is
   * {@link #CONNECTED}; otherwise any error wins, then any connecting,
   * then {@link #DISCONNECTED}.
   *
   * @param statuses the statuses of the live subscriptions, never null
   *
   * @return the aggregate status, never null
   */
  public static ConnectionStatus aggregate(
      final Collection<ConnectionStatus> statuses) {
    Objects.requireNonNull(statuses, "statuses must not be null");
    if (statuses.isEmpty()) {
      return DISCONNECTED;
    }
    boolean allConnected = true;
    boolean anyConnecting = false;
    for (ConnectionStatus status : statuses) {
      if (status == ERROR) {
        return ERROR;
      }
      if (status != CONNECTED) {
        allConnected = false;
      }
      if (status == CONNECTING) {
        anyConnecting = true;
      }
    }
    if (allConnected) {
      return CONNECTED;
    }
    return anyConnecting ? CONNECTING : DISCONNECTED;
  }
}
