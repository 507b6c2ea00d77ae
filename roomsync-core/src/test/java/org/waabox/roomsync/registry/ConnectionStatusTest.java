package org.waabox.roomsync.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.waabox.roomsync.registry.ConnectionStatus.CONNECTED;
import static org.waabox.roomsync.registry.ConnectionStatus.CONNECTING;
import static org.waabox.roomsync.registry.ConnectionStatus.DISCONNECTED;
import static org.waabox.roomsync.registry.ConnectionStatus.ERROR;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.roomsync.source.ChannelSignal;

/**
 * Tests for {@link ConnectionStatus}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConnectionStatusTest {

  @Test
  void whenAggregating_givenNoSubscriptions_shouldBeDisconnected() {
    assertEquals(DISCONNECTED, ConnectionStatus.aggregate(List.of()));
  }

  @Test
  void whenAggregating_givenAllConnected_shouldBeConnected() {
    assertEquals(CONNECTED,
        ConnectionStatus.aggregate(List.of(CONNECTED, CONNECTED)));
  }

  @Test
  void whenAggregating_givenAnyError_shouldBeError() {
    assertEquals(ERROR, ConnectionStatus.aggregate(
        List.of(CONNECTED, CONNECTING, ERROR, DISCONNECTED)));
  }

  @Test
  void whenAggregating_givenConnectingAndNoError_shouldBeConnecting() {
    assertEquals(CONNECTING, ConnectionStatus.aggregate(
        List.of(CONNECTED, CONNECTING, DISCONNECTED)));
  }

  @Test
  void whenAggregating_givenConnectedAndDisconnected_shouldBeDisconnected() {
    assertEquals(DISCONNECTED,
        ConnectionStatus.aggregate(List.of(CONNECTED, DISCONNECTED)));
  }

  @Test
  void whenMappingSignals_shouldFollowTransportSemantics() {
    assertEquals(CONNECTED,
        ConnectionStatus.fromSignal(ChannelSignal.SUBSCRIBED));
    assertEquals(ERROR,
        ConnectionStatus.fromSignal(ChannelSignal.CHANNEL_ERROR));
    assertEquals(ERROR, ConnectionStatus.fromSignal(ChannelSignal.TIMED_OUT));
    assertEquals(DISCONNECTED,
        ConnectionStatus.fromSignal(ChannelSignal.CLOSED));
  }

  @Test
  void whenCheckingTransitions_shouldAllowOnlyTheStateMachineEdges() {
    assertTrue(CONNECTING.canTransitionTo(CONNECTED));
    assertTrue(CONNECTING.canTransitionTo(ERROR));
    assertTrue(CONNECTED.canTransitionTo(ERROR));
    assertTrue(ERROR.canTransitionTo(CONNECTING));
    assertTrue(DISCONNECTED.canTransitionTo(CONNECTING));
    for (ConnectionStatus status : ConnectionStatus.values()) {
      assertTrue(status.canTransitionTo(DISCONNECTED));
    }

    assertFalse(ERROR.canTransitionTo(CONNECTED));
    assertFalse(DISCONNECTED.canTransitionTo(CONNECTED));
    assertFalse(DISCONNECTED.canTransitionTo(ERROR));
    assertFalse(CONNECTED.canTransitionTo(CONNECTING));
  }
}
