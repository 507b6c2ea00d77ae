package org.waabox.roomsync.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.ReconnectPolicy;
import org.waabox.roomsync.loop.ManualEventLoop;
import org.waabox.roomsync.metrics.RecordingMetrics;
import org.waabox.roomsync.registry.ConnectionStatus;
import org.waabox.roomsync.registry.SubscriptionRegistry;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.ChannelSpec;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Table;

/**
 * Tests for {@link HealthMonitor}.
 *
 * <p>With the default policy a channel that never handshakes fails ten
 * seconds after every open, the monitor samples every thirty seconds and
 * retries two seconds after a sample.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HealthMonitorTest {

  private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

  private ManualEventLoop loop;
  private LocalChangeEventSource source;
  private RecordingMetrics metrics;
  private SubscriptionRegistry registry;
  private HealthMonitor monitor;

  @BeforeEach
  void setUp() {
    loop = new ManualEventLoop(T0);
    source = new LocalChangeEventSource();
    source.start();
    source.autoSubscribe(false);
    metrics = new RecordingMetrics();
    final ReconnectPolicy policy = ReconnectPolicy.defaultPolicy();
    registry = new SubscriptionRegistry(loop, source, policy, metrics);
    monitor = new HealthMonitor(loop, registry, policy, metrics);
    registry.open("s", ChannelSpec.of(Table.BOOKINGS), event -> { });
  }

  @Test
  void whenFailuresExhaustTheBudget_shouldWaitForManualReconnect() {
    monitor.start();

    loop.advance(Duration.ofSeconds(181));

    assertEquals(6, source.openCount("s"));
    assertEquals(6, metrics.timeouts.get());
    assertEquals(5, metrics.reconnectAttempts.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(ConnectionStatus.ERROR, registry.status());
    assertTrue(monitor.manualRetryRequired());

    loop.advance(Duration.ofMinutes(10));

    assertEquals(6, source.openCount("s"));
    final DetailedStatus status = monitor.detailedStatus();
    assertEquals(ConnectionStatus.ERROR, status.aggregate());
    assertEquals(5, status.reconnectAttempts());
    assertEquals(5, status.maxAttempts());
    assertTrue(status.manualRetryRequired());
    assertEquals(1, status.subscriptions().size());

    assertEquals(1, monitor.reconnectAll());

    assertEquals(7, source.openCount("s"));
    assertEquals(0, monitor.attempts());
    assertFalse(monitor.manualRetryRequired());
    source.signal("s", ChannelSignal.SUBSCRIBED);
    assertEquals(ConnectionStatus.CONNECTED, registry.status());
  }

  @Test
  void whenConnectionRecovers_shouldResetTheBudget() {
    monitor.start();
    loop.advance(Duration.ofSeconds(32));
    assertEquals(1, monitor.attempts());
    assertEquals(2, source.openCount("s"));

    source.signal("s", ChannelSignal.SUBSCRIBED);

    assertEquals(0, monitor.attempts());
    assertEquals(ConnectionStatus.CONNECTED,
        monitor.detailedStatus().aggregate());
  }

  @Test
  void whenEverythingIsHealthy_shouldNotReconnect() {
    source.signal("s", ChannelSignal.SUBSCRIBED);
    monitor.start();

    loop.advance(Duration.ofMinutes(5));

    assertEquals(1, source.openCount("s"));
    assertEquals(0, metrics.reconnectAttempts.get());
  }

  @Test
  void whenStopped_shouldNoLongerReconnect() {
    monitor.start();
    monitor.start();
    loop.advance(Duration.ofSeconds(30));
    assertEquals(1, metrics.reconnectAttempts.get());

    monitor.stop();
    monitor.stop();
    loop.advance(Duration.ofMinutes(5));

    assertEquals(1, source.openCount("s"));
    assertEquals(1, metrics.reconnectAttempts.get());
  }
}
