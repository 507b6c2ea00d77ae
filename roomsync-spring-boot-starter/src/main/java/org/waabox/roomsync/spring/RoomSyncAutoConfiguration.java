package org.waabox.roomsync.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.roomsync.ReconnectPolicy;
import org.waabox.roomsync.RoomSync;
import org.waabox.roomsync.booking.BookingStore;
import org.waabox.roomsync.metrics.RoomSyncMetrics;
import org.waabox.roomsync.source.ChangeEventSource;

/**
 * Spring Boot auto-configuration for the RoomSync availability engine.
 *
 * <p>This configuration creates and manages a singleton {@link RoomSync}
 * instance, wiring optional beans for the change event source, the booking
 * store, the metrics reporter and the reconnect policy. If these beans are
 * not present in the application context, the RoomSync defaults are used
 * and the reconnect policy is built from {@link RoomSyncProperties}.
 *
 * <p>All {@link RoomSyncCustomizer} beans discovered in the application
 * context are invoked before the RoomSync lifecycle starts.
 *
 * <p>The RoomSync lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(RoomSyncProperties.class)
public class RoomSyncAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RoomSyncAutoConfiguration.class);

  /**
   * Creates the singleton {@link RoomSync} bean.
   *
   * @param properties          the configuration properties, never null
   * @param sourceProvider      provider for an optional ChangeEventSource
   *                            bean
   * @param storeProvider       provider for an optional BookingStore bean
   * @param metricsProvider     provider for an optional RoomSyncMetrics bean
   * @param policyProvider      provider for an optional ReconnectPolicy bean
   * @param customizers         the list of customizers, may be empty
   *
   * @return the configured RoomSync instance, never null
   */
  @Bean
  public RoomSync roomSync(
      final RoomSyncProperties properties,
      final ObjectProvider<ChangeEventSource> sourceProvider,
      final ObjectProvider<BookingStore> storeProvider,
      final ObjectProvider<RoomSyncMetrics> metricsProvider,
      final ObjectProvider<ReconnectPolicy> policyProvider,
      final List<RoomSyncCustomizer> customizers) {

    requireAtMostOne(sourceProvider, ChangeEventSource.class);
    requireAtMostOne(storeProvider, BookingStore.class);

    final RoomSync.Builder builder = RoomSync.builder();

    final String clientId = properties.getClientId();
    if (clientId != null && !clientId.isBlank()) {
      builder.clientId(clientId);
      log.info("RoomSync configured with client ID: {}", clientId);
    }

    sourceProvider.ifAvailable(source -> {
      builder.changeEventSource(source);
      log.info("RoomSync using ChangeEventSource: {}",
          source.getClass().getSimpleName());
    });

    storeProvider.ifAvailable(store -> {
      builder.bookingStore(store);
      log.info("RoomSync using BookingStore: {}",
          store.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("RoomSync using custom RoomSyncMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final ReconnectPolicy policy = policyProvider.getIfAvailable(
        () -> reconnectPolicy(properties));
    builder.reconnectPolicy(policy);
    builder.alertThrottleWindow(properties.getAlerts().getThrottleWindow());

    final RoomSync roomSync = builder.build();

    for (final RoomSyncCustomizer customizer : customizers) {
      customizer.customize(roomSync);
      log.debug("Invoked RoomSyncCustomizer: {}",
          customizer.getClass().getSimpleName());
    }

    log.info("RoomSync created with client ID {} and {}",
        roomSync.clientId(), policy);

    return roomSync;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the RoomSync
   * start/stop lifecycle.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * so the source and the store are ready first, and stops early for the
   * same reason.
   *
   * <p>A {@link RoomSync} runs once: starting the lifecycle again while it
   * runs, or after it was stopped, is logged and ignored.
   *
   * @param roomSync the RoomSync instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle roomSyncLifecycle(final RoomSync roomSync) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      /** Whether the lifecycle was stopped; RoomSync cannot restart. */
      private volatile boolean stopped = false;

      @Override
      public synchronized void start() {
        if (running) {
          log.debug("RoomSync lifecycle already running");
          return;
        }
        if (stopped) {
          log.warn("RoomSync lifecycle was stopped and cannot restart");
          return;
        }
        log.info("Starting RoomSync lifecycle...");
        roomSync.start();
        running = true;
        log.info("RoomSync lifecycle started successfully.");
      }

      @Override
      public synchronized void stop() {
        log.info("Stopping RoomSync lifecycle...");
        roomSync.stop();
        running = false;
        stopped = true;
        log.info("RoomSync lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Builds the reconnect policy from the {@code roomsync.reconnect.*}
   * properties.
   *
   * @param properties the configuration properties, never null
   *
   * @return the reconnect policy, never null
   *
   * @throws IllegalArgumentException if a property is out of range
   */
  static ReconnectPolicy reconnectPolicy(
      final RoomSyncProperties properties) {
    final RoomSyncProperties.Reconnect reconnect = properties.getReconnect();
    return ReconnectPolicy.of(
        reconnect.getHealthCheckInterval(),
        reconnect.getMaxAttempts(),
        reconnect.getBackoff(),
        reconnect.getBackoffStrategy(),
        reconnect.getMinReconnectSpacing(),
        reconnect.getConnectTimeout());
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "RoomSync requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
