package org.waabox.roomsync.sync;

import java.time.Instant;
import java.util.Objects;

import org.waabox.roomsync.source.ChangeType;

/**
 * An availability change of a room, published to the availability feed.
 *
 * <p>The timestamp is the processing time of the change on this node and is
 * the only ordering signal: consumers apply an event only if it is not
 * older than the last one they applied for the same room.
 *
 * @param roomId         the room id, never null
 * @param available      whether the room is free right now
 * @param timestamp      when the change was processed, never null
 * @param eventType      the row mutation that caused it, never null
 * @param source         the kind of row that caused it, never null
 * @param originClientId the client that processed it, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncEvent(
    String roomId,
    boolean available,
    Instant timestamp,
    ChangeType eventType,
    AvailabilitySource source,
    String originClientId
) {

  /** Validates the event. */
  public SyncEvent {
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(source, "source must not be null");
  }
}
