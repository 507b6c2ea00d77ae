package org.waabox.roomsync.health;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.ReconnectPolicy;
import org.waabox.roomsync.Registration;
import org.waabox.roomsync.loop.EventLoop;
import org.waabox.roomsync.loop.ScheduledTask;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.registry.ConnectionStatus;
import org.waabox.roomsync.registry.HealthSnapshot;
import org.waabox.roomsync.registry.SubscriptionRegistry;

/**
 * Samples subscription health and re-opens failed channels within a
 * bounded budget.
 *
 * <p>Health is sampled when the monitor starts and then every
 * health-check interval. When a sample finds subscriptions in error, no
 * reconnect is pending and the budget is not spent, a reconnect of every
 * failed subscription is scheduled after the policy's backoff. The budget
 * is restored whenever the aggregate status returns to connected. Once it
 * is spent the monitor stops retrying and flags that a manual retry is
 * required; {@link #reconnectAll()} is that manual retry.
 *
 * <p>All state is confined to the {@link EventLoop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HealthMonitor {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HealthMonitor.class);

  /** The loop confining the monitor state, never null. */
  private final EventLoop loop;

  /** The supervised registry, never null. */
  private final SubscriptionRegistry registry;

  /** The reconnect budget and timings, never null. */
  private final ReconnectPolicy policy;

  /** The metrics sink, never null. */
  private final RoomSyncMetrics metrics;

  /** The periodic health sample, null while stopped. */
  private ScheduledTask sampler;

  /** The scheduled reconnect, null when none is pending. */
  private ScheduledTask pending;

  /** The aggregate status registration, null while stopped. */
  private Registration statusRegistration;

  /** Automatic attempts made since the aggregate was last connected. */
  private int attempts;

  /** Whether the automatic budget ran out. */
  private boolean manualRetryRequired;

  /**
   * Creates a new monitor.
   *
   * @param theLoop     the event loop, never null
   * @param theRegistry the registry to supervise, never null
   * @param thePolicy   the reconnect policy, never null
   * @param theMetrics  the metrics sink, never null
   */
  public HealthMonitor(final EventLoop theLoop,
      final SubscriptionRegistry theRegistry, final ReconnectPolicy thePolicy,
      final RoomSyncMetrics theMetrics) {
    loop = Objects.requireNonNull(theLoop, "loop must not be null");
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Takes the first sample and starts the periodic sampling. Idempotent.
   */
  public void start() {
    loop.run(() -> {
      if (sampler != null) {
        return;
      }
      statusRegistration = registry.onStatusChange(this::onStatusChange);
      sampler = loop.scheduleAtFixedRate(this::sample,
          policy.healthCheckInterval(), policy.healthCheckInterval());
      log.info("Health monitor started, {}", policy);
      sample();
    });
  }

  /**
   * Stops sampling and cancels any pending reconnect. Idempotent.
   */
  public void stop() {
    loop.run(() -> {
      if (sampler == null) {
        return;
      }
      sampler.cancel();
      sampler = null;
      cancelPending();
      statusRegistration.remove();
      statusRegistration = null;
      log.info("Health monitor stopped");
    });
  }

  /**
   * Restores the automatic budget and reconnects every failed
   * subscription.
   *
   * @return the number of subscriptions moved back to connecting
   */
  public int reconnectAll() {
    return loop.call(() -> {
      cancelPending();
      attempts = 0;
      manualRetryRequired = false;
      final int reconnected = registry.reconnectFailed();
      log.info("Manual reconnect of {} subscriptions", reconnected);
      return reconnected;
    });
  }

  /**
   * Builds the detailed status.
   *
   * @return the status, never null
   */
  public DetailedStatus detailedStatus() {
    return loop.call(() -> {
      final HealthSnapshot health = registry.health();
      return new DetailedStatus(health.aggregate(), registry.subscriptions(),
          health, attempts, policy.maxAttempts(), manualRetryRequired);
    });
  }

  /**
   * Returns the automatic attempts made since the aggregate was last
   * connected.
   *
   * @return the attempt count
   */
  public int attempts() {
    return loop.call(() -> attempts);
  }

  /**
   * Whether the automatic budget ran out.
   *
   * @return true until a manual reconnect or a recovery
   */
  public boolean manualRetryRequired() {
    return loop.call(() -> manualRetryRequired);
  }

  void sample() {
    final HealthSnapshot health = registry.health();
    log.debug("Health: {} total, {} connected, {} connecting, {} error, "
        + "{} disconnected", health.total(), health.connected(),
        health.connecting(), health.error(), health.disconnected());
    if (health.error() == 0 || pending != null || manualRetryRequired) {
      return;
    }
    if (attempts >= policy.maxAttempts()) {
      manualRetryRequired = true;
      metrics.reconnectExhausted(attempts);
      log.error("Giving up after {} reconnect attempts, {} subscriptions "
          + "in error; a manual reconnect is required", attempts,
          health.error());
      return;
    }
    final Duration delay = policy.delayFor(attempts);
    attempts++;
    metrics.reconnectAttempted(attempts);
    log.warn("{} subscriptions in error, reconnect attempt {}/{} in {} ms",
        health.error(), attempts, policy.maxAttempts(), delay.toMillis());
    pending = loop.schedule(this::reconnectFailed, delay);
  }

  private void reconnectFailed() {
    pending = null;
    registry.reconnectFailed();
  }

  private void onStatusChange(final ConnectionStatus status) {
    if (status != ConnectionStatus.CONNECTED) {
      return;
    }
    if (attempts > 0 || manualRetryRequired) {
      log.info("Connection restored after {} reconnect attempts", attempts);
    }
    attempts = 0;
    manualRetryRequired = false;
    cancelPending();
  }

  private void cancelPending() {
    if (pending != null) {
      pending.cancel();
      pending = null;
    }
  }
}
