package org.waabox.roomsync.sync;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.RoomSyncException;
import org.waabox.roomsync.booking.BookingGate;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingStatus;
import org.waabox.roomsync.booking.ConflictDetector;
import org.waabox.roomsync.registry.SubscriptionRegistry;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeType;
import org.waabox.roomsync.source.ChannelSpec;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Table;

/**
 * Re-validates booking windows while a client is filling in a booking.
 *
 * <p>Each watch opens a bookings channel filtered by room, runs an initial
 * check and re-runs the check on every change of the room's bookings. The
 * checks query the store, so they run on the given executor rather than on
 * the event loop; reports are delivered on that executor.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConflictWatcher {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ConflictWatcher.class);

  /** Prefix of the per-watch channel ids. */
  static final String CHANNEL_PREFIX = "realtime-conflict-prevention-";

  /** The registry the watch channels are opened on, never null. */
  private final SubscriptionRegistry registry;

  /** Runs the conflict checks, never null. */
  private final BookingGate gate;

  /** The thread the checks run on, never null. */
  private final Executor checks;

  /** Stamps the reports, never null. */
  private final Clock clock;

  /** Makes channel ids unique. */
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Creates a new watcher.
   *
   * @param theRegistry the subscription registry, never null
   * @param theGate     the write gate, never null
   * @param theChecks   the executor running the checks, never null
   * @param theClock    stamps the reports, never null
   */
  public ConflictWatcher(final SubscriptionRegistry theRegistry,
      final BookingGate theGate, final Executor theChecks,
      final Clock theClock) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    gate = Objects.requireNonNull(theGate, "gate must not be null");
    checks = Objects.requireNonNull(theChecks, "checks must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Starts watching a booking window.
   *
   * @param roomId    the room id, never null
   * @param start     the window start, never null
   * @param end       the window end, must be after the start
   * @param excludeId the booking being edited, may be null
   * @param listener  receives the reports, never null
   *
   * @return the watch, never null
   */
  public ConflictWatch watch(final String roomId, final Instant start,
      final Instant end, final String excludeId,
      final ConflictListener listener) {
    Objects.requireNonNull(roomId, "roomId must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    ConflictDetector.requireWindow(start, end);

    final String channelId = CHANNEL_PREFIX + roomId + "-"
        + sequence.incrementAndGet();
    final ConflictWatch watch = new ConflictWatch(channelId, registry);
    final Check check = new Check(watch, roomId, start, end, excludeId,
        listener);

    registry.open(channelId,
        ChannelSpec.of(Table.BOOKINGS).filteredBy(Columns.ROOM_ID, roomId),
        event -> check.submit(isRealtime(event)));
    check.submit(false);
    log.debug("Watching room {} [{} - {}] on {}", roomId, start, end,
        channelId);
    return watch;
  }

  static boolean isRealtime(final ChangeEvent event) {
    if (event.eventType() == ChangeType.INSERT) {
      return true;
    }
    if (event.eventType() == ChangeType.UPDATE) {
      return event.current().optionalString(Columns.STATUS)
          .map(BookingStatus.CONFIRMED.wireName()::equalsIgnoreCase)
          .orElse(false);
    }
    return false;
  }

  /** One watched window. */
  private final class Check {

    /** The owning watch, never null. */
    private final ConflictWatch watch;

    /** The watched room, never null. */
    private final String roomId;

    /** The watched start, never null. */
    private final Instant start;

    /** The watched end, never null. */
    private final Instant end;

    /** The booking being edited, may be null. */
    private final String excludeId;

    /** Receives the reports, never null. */
    private final ConflictListener listener;

    private Check(final ConflictWatch theWatch, final String theRoomId,
        final Instant theStart, final Instant theEnd,
        final String theExcludeId, final ConflictListener theListener) {
      watch = theWatch;
      roomId = theRoomId;
      start = theStart;
      end = theEnd;
      excludeId = theExcludeId;
      listener = theListener;
    }

    void submit(final boolean realtime) {
      if (watch.isCancelled()) {
        return;
      }
      try {
        checks.execute(() -> run(realtime));
      } catch (final RejectedExecutionException e) {
        log.debug("Conflict check for {} rejected, watcher stopped",
            watch.channelId());
      }
    }

    private void run(final boolean realtime) {
      if (watch.isCancelled()) {
        return;
      }
      final List<BookingInterval> conflicts;
      try {
        conflicts = gate.checkConflicts(roomId, start, end, excludeId);
      } catch (final RoomSyncException e) {
        log.warn("Conflict check for room {} failed: {}", roomId,
            e.getMessage());
        return;
      }
      if (watch.isCancelled()) {
        return;
      }
      final ConflictReport report = new ConflictReport(roomId, start, end,
          conflicts, realtime, clock.instant());
      try {
        listener.onReport(report);
      } catch (final RuntimeException e) {
        log.error("Conflict listener of {} failed: {}", watch.channelId(),
            e.getMessage(), e);
      }
    }
  }
}
