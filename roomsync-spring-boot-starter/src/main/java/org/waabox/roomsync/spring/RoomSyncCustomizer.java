package org.waabox.roomsync.spring;

import org.waabox.roomsync.RoomSync;

/**
 * A callback interface for wiring listeners into the {@link RoomSync}
 * instance created by the Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to subscribe to the
 * availability feed or the connection status. All discovered
 * {@code RoomSyncCustomizer} beans are invoked during the RoomSync bean
 * creation, before the lifecycle starts, so no availability change is
 * missed.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * RoomSyncCustomizer availabilityBoard(final RoomBoard board) {
 *     return roomSync -> roomSync.subscribeAvailability(board::refresh);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RoomSyncCustomizer {

  /**
   * Customizes the given RoomSync instance.
   *
   * @param roomSync the RoomSync instance, never null
   */
  void customize(RoomSync roomSync);
}
