package org.waabox.roomsync.sync;

import java.time.Instant;

/**
 * The last applied availability of a room.
 *
 * @param roomId    the room id, never null
 * @param available whether the room is free
 * @param updatedAt when the state was applied, never null
 * @param source    the kind of row that last changed it, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RoomAvailability(
    String roomId,
    boolean available,
    Instant updatedAt,
    AvailabilitySource source
) {

  /**
   * Creates the state described by a sync event.
   *
   * @param event the event, never null
   *
   * @return the state, never null
   */
  public static RoomAvailability of(final SyncEvent event) {
    return new RoomAvailability(event.roomId(), event.available(),
        event.timestamp(), event.source());
  }
}
