package org.waabox.roomsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.alert.AdminNotification;
import org.waabox.roomsync.alert.AlertPriority;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingRequest;
import org.waabox.roomsync.loop.ManualEventLoop;
import org.waabox.roomsync.registry.ConnectionStatus;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChannelSignal;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.LocalChangeEventSource;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;
import org.waabox.roomsync.sync.ConflictReport;
import org.waabox.roomsync.sync.SyncEvent;

/**
 * End to end tests for {@link RoomSync} over the local transport.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RoomSyncTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:15:00Z");
  private static final Instant TEN = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant TEN_THIRTY =
      Instant.parse("2026-03-02T10:30:00Z");
  private static final Instant ELEVEN = Instant.parse("2026-03-02T11:00:00Z");
  private static final Instant ELEVEN_THIRTY =
      Instant.parse("2026-03-02T11:30:00Z");
  private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

  private ManualEventLoop loop;
  private LocalChangeEventSource source;
  private RoomSync roomSync;
  private List<SyncEvent> availability;

  @BeforeEach
  void setUp() {
    loop = new ManualEventLoop(NOW);
    source = new LocalChangeEventSource();
    roomSync = RoomSync.builder()
        .clientId("node-1")
        .eventLoop(loop)
        .changeEventSource(source)
        .build();
    availability = new ArrayList<>();
    roomSync.subscribeAvailability(availability::add);
    roomSync.start();
  }

  @AfterEach
  void tearDown() {
    roomSync.stop();
  }

  private static ChangeEvent notification(final String id,
      final String userId, final String type) {
    return ChangeEvent.insert(Table.NOTIFICATIONS, Row.builder()
        .put(Columns.ID, id)
        .put(Columns.USER_ID, userId)
        .put(Columns.TYPE, type)
        .put(Columns.TITLE, "title")
        .build());
  }

  @Test
  void whenStarted_shouldConnectTheGlobalChannel() {
    assertEquals(ConnectionStatus.CONNECTED, roomSync.status());
    assertEquals(1, source.openChannels(RoomSync.GLOBAL_CHANNEL));
    assertEquals(1, roomSync.health().connected());
    assertThrows(IllegalStateException.class, roomSync::start);
  }

  @Test
  void whenBookingCreated_shouldPublishTheRoomAvailability() {
    final BookingInterval created = roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN, ELEVEN, "user-1"));

    assertEquals(1, availability.size());
    final SyncEvent event = availability.get(0);
    assertEquals("room-r", event.roomId());
    assertFalse(event.available());
    assertEquals("node-1", event.originClientId());
    assertFalse(roomSync.availability("room-r").get().available());

    roomSync.cancelBooking(created.bookingId());

    assertTrue(availability.get(1).available());
  }

  @Test
  void whenBookingOverlaps_shouldRejectIt() {
    roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN, ELEVEN, "user-1"));

    assertThrows(BookingConflictException.class, () -> roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN_THIRTY, ELEVEN_THIRTY,
            "user-2")));
    assertEquals(1, roomSync.checkConflicts("room-r", TEN_THIRTY,
        ELEVEN_THIRTY, null).size());
    assertTrue(roomSync.checkConflicts("room-r", ELEVEN, NOON, null)
        .isEmpty());
    assertNotNull(roomSync.createBooking(
        BookingRequest.confirmed("room-r", ELEVEN, NOON, "user-2")));
  }

  @Test
  void whenUpdatingBooking_shouldMoveItsWindow() {
    final BookingInterval created = roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN, ELEVEN, "user-1"));

    final BookingInterval moved = roomSync.updateBooking(created.bookingId(),
        BookingRequest.confirmed("room-r", ELEVEN, NOON, "user-1"));

    assertEquals(ELEVEN, moved.startTime());
    assertTrue(availability.get(1).available());
  }

  @Test
  void whenSubscribingAdminAlerts_shouldShareOneChannelPerAdmin() {
    final List<AdminNotification> first = new ArrayList<>();
    final List<AdminNotification> second = new ArrayList<>();
    final String channelId = RoomSync.ADMIN_CHANNEL_PREFIX + "admin-1";

    final Registration one =
        roomSync.subscribeAdminAlerts("admin-1", first::add);
    final Registration two =
        roomSync.subscribeAdminAlerts("admin-1", second::add);
    source.publish(notification("n-1", "admin-1", "system_error"));
    source.publish(notification("n-2", "admin-2", "system_error"));

    assertEquals(1, source.openCount(channelId));
    assertEquals(1, first.size());
    assertEquals(AlertPriority.CRITICAL, first.get(0).priority());
    assertEquals(1, second.size());

    one.remove();
    one.remove();
    assertEquals(1, source.openChannels(channelId));
    two.remove();
    assertEquals(0, source.openChannels(channelId));
  }

  @Test
  void whenWatchingConflicts_shouldReportNewOverlaps() throws Exception {
    final BlockingQueue<ConflictReport> reports = new LinkedBlockingQueue<>();
    roomSync.watchConflicts("room-r", TEN, ELEVEN, null, reports::add);

    final ConflictReport initial = reports.poll(5, TimeUnit.SECONDS);
    assertNotNull(initial);
    assertFalse(initial.hasConflicts());

    roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN_THIRTY, ELEVEN_THIRTY,
            "user-2"));

    final ConflictReport realtime = reports.poll(5, TimeUnit.SECONDS);
    assertNotNull(realtime);
    assertTrue(realtime.realtime());
    assertEquals(1, realtime.conflicts().size());
  }

  @Test
  void whenGlobalChannelFails_shouldRecoverOnManualReconnect() {
    source.signal(RoomSync.GLOBAL_CHANNEL, ChannelSignal.CHANNEL_ERROR);
    assertEquals(ConnectionStatus.ERROR, roomSync.status());
    loop.advance(Duration.ofSeconds(1));

    assertEquals(1, roomSync.reconnectAll());

    assertEquals(ConnectionStatus.CONNECTED, roomSync.status());
    assertEquals(0, roomSync.detailedStatus().reconnectAttempts());
  }

  @Test
  void whenPriming_shouldReadTheStoredBookings() {
    roomSync.createBooking(
        BookingRequest.confirmed("room-r", TEN, ELEVEN, "user-1"));
    availability.clear();

    assertFalse(roomSync.primeAvailability("room-r").available());
    assertTrue(roomSync.primeAvailability("room-x").available());
    assertTrue(availability.isEmpty());
  }

  @Test
  void whenStopped_shouldDisconnectAndRefuseNewFeeds() {
    roomSync.stop();
    roomSync.stop();

    assertEquals(ConnectionStatus.DISCONNECTED, roomSync.status());
    assertEquals(0, source.openChannels(RoomSync.GLOBAL_CHANNEL));
    assertThrows(IllegalStateException.class,
        () -> roomSync.subscribeAdminAlerts("admin-1", alert -> { }));
  }

  @Test
  void whenBuilding_givenClockAndLoop_shouldFail() {
    assertThrows(IllegalStateException.class, () -> RoomSync.builder()
        .clock(Clock.systemUTC())
        .eventLoop(loop)
        .build());
  }
}
