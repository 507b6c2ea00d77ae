package org.waabox.roomsync.sync;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client-side view of room availability fed by the availability feed.
 *
 * <p>Applies an event only when it is not older than the last applied one
 * for the same room; older events are discarded. Safe to read from any
 * thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AvailabilityView implements AvailabilityListener {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AvailabilityView.class);

  /** The applied state by room. */
  private final Map<String, RoomAvailability> rooms =
      new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public void onAvailabilityChange(final SyncEvent event) {
    apply(event);
  }

  /**
   * Applies an event unless it is older than the room's current state.
   *
   * @param event the event, never null
   *
   * @return true if applied
   */
  public boolean apply(final SyncEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    final AtomicBoolean applied = new AtomicBoolean(false);
    rooms.compute(event.roomId(), (roomId, current) -> {
      if (current != null && event.timestamp().isBefore(current.updatedAt())) {
        return current;
      }
      applied.set(true);
      return RoomAvailability.of(event);
    });
    if (!applied.get()) {
      log.debug("Discarded stale availability event for room {} at {}",
          event.roomId(), event.timestamp());
    }
    return applied.get();
  }

  /**
   * Returns the applied state of a room.
   *
   * @param roomId the room id, never null
   *
   * @return the state, empty if no event was applied for the room
   */
  public Optional<RoomAvailability> get(final String roomId) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    return Optional.ofNullable(rooms.get(roomId));
  }

  /**
   * Whether a room is known to be free.
   *
   * @param roomId the room id, never null
   *
   * @return true if the last applied state says available
   */
  public boolean isAvailable(final String roomId) {
    return get(roomId).map(RoomAvailability::available).orElse(false);
  }
}
