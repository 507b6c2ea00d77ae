package org.waabox.roomsync.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.roomsync.BackoffStrategy;

/**
 * Configuration properties for RoomSync, mapped from the
 * {@code roomsync.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code roomsync.client-id} - the identifier stamped on the
 *       availability events of this node. If not set, a random UUID is
 *       generated automatically.</li>
 *   <li>{@code roomsync.reconnect.*} - the health check and reconnect
 *       settings.</li>
 *   <li>{@code roomsync.alerts.throttle-window} - how long a low or medium
 *       admin alert of the same kind is suppressed for the same room.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "roomsync")
public class RoomSyncProperties {

  /** The client identifier, null means auto-generate UUID. */
  private String clientId;

  /** The reconnect settings, never null. */
  private final Reconnect reconnect = new Reconnect();

  /** The admin alert settings, never null. */
  private final Alerts alerts = new Alerts();

  /**
   * Returns the configured client identifier.
   *
   * @return the client identifier, or null if auto-generation should be used
   */
  public String getClientId() {
    return clientId;
  }

  /**
   * Sets the client identifier.
   *
   * @param clientId the client identifier, may be null
   */
  public void setClientId(final String clientId) {
    this.clientId = clientId;
  }

  /**
   * Returns the reconnect settings.
   *
   * @return the reconnect settings, never null
   */
  public Reconnect getReconnect() {
    return reconnect;
  }

  /**
   * Returns the admin alert settings.
   *
   * @return the admin alert settings, never null
   */
  public Alerts getAlerts() {
    return alerts;
  }

  /** The {@code roomsync.reconnect.*} settings. */
  public static class Reconnect {

    /** How often subscriptions are checked. */
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    /** Automatic reconnects allowed per subscription before giving up. */
    private int maxAttempts = 5;

    /** The base delay before an automatic reconnect. */
    private Duration backoff = Duration.ofSeconds(2);

    /** How the delay grows with the attempts. */
    private BackoffStrategy backoffStrategy = BackoffStrategy.FIXED;

    /** The minimum time between two channel opens for the same id. */
    private Duration minReconnectSpacing = Duration.ofSeconds(1);

    /** How long a channel may stay connecting. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    public Duration getHealthCheckInterval() {
      return healthCheckInterval;
    }

    public void setHealthCheckInterval(final Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(final Duration backoff) {
      this.backoff = backoff;
    }

    public BackoffStrategy getBackoffStrategy() {
      return backoffStrategy;
    }

    public void setBackoffStrategy(final BackoffStrategy backoffStrategy) {
      this.backoffStrategy = backoffStrategy;
    }

    public Duration getMinReconnectSpacing() {
      return minReconnectSpacing;
    }

    public void setMinReconnectSpacing(final Duration minReconnectSpacing) {
      this.minReconnectSpacing = minReconnectSpacing;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }
  }

  /** The {@code roomsync.alerts.*} settings. */
  public static class Alerts {

    /** The throttle window of low and medium alerts. */
    private Duration throttleWindow = Duration.ofSeconds(5);

    public Duration getThrottleWindow() {
      return throttleWindow;
    }

    public void setThrottleWindow(final Duration throttleWindow) {
      this.throttleWindow = throttleWindow;
    }
  }
}
