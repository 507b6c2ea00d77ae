package org.waabox.roomsync.alert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.roomsync.loop.ManualEventLoop;
import org.waabox.roomsync.metrics.RecordingMetrics;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/**
 * Tests for {@link AdminAlertRouter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AdminAlertRouterTest {

  private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

  private ManualEventLoop loop;
  private RecordingMetrics metrics;
  private AdminAlertRouter router;
  private List<AdminNotification> alerts;

  @BeforeEach
  void setUp() {
    loop = new ManualEventLoop(T0);
    metrics = new RecordingMetrics();
    router = new AdminAlertRouter(loop,
        AdminAlertRouter.DEFAULT_THROTTLE_WINDOW, metrics);
    alerts = new ArrayList<>();
    router.subscribe(alerts::add);
  }

  private static RawNotification raw(final String id, final String type,
      final String roomId) {
    return new RawNotification(id, type, "admin-1", "title " + id, "body",
        roomId, null);
  }

  @Test
  void whenClassifying_shouldFollowThePriorityTable() {
    assertEquals(new Classification(AlertPriority.CRITICAL,
        AlertSource.SYSTEM), router.classify(raw("1", "system_error",
            null)).get());
    assertEquals(new Classification(AlertPriority.HIGH,
        AlertSource.BOOKING), router.classify(raw("2", "admin_override",
            null)).get());
    assertEquals(new Classification(AlertPriority.HIGH,
        AlertSource.BOOKING), router.classify(raw("3", "booking_conflict",
            null)).get());
    assertEquals(new Classification(AlertPriority.MEDIUM,
        AlertSource.ROOM), router.classify(raw("4", "room_management",
            null)).get());
    assertEquals(new Classification(AlertPriority.LOW,
        AlertSource.BOOKING), router.classify(raw("5", "booking_cancelled",
            null)).get());
    assertEquals(new Classification(AlertPriority.LOW,
        AlertSource.BOOKING), router.classify(raw("6", "booking_modified",
            null)).get());
    assertTrue(router.classify(raw("7", "booking_confirmed", null))
        .isEmpty());
    assertTrue(router.classify(raw("8", "something_else", null)).isEmpty());
  }

  @Test
  void whenRouting_givenIrrelevantType_shouldDropIt() {
    assertFalse(router.route(raw("1", "booking_reminder", "room-a")));

    assertTrue(alerts.isEmpty());
  }

  @Test
  void whenRouting_givenBurstOfLowAlerts_shouldDeliverOnePerWindow() {
    assertTrue(router.route(raw("1", "booking_modified", "room-a")));
    assertFalse(router.route(raw("2", "booking_modified", "room-a")));
    assertFalse(router.route(raw("3", "booking_cancelled", "room-a")));
    assertTrue(router.route(raw("4", "booking_modified", "room-b")));

    loop.advance(Duration.ofMillis(4999));
    assertFalse(router.route(raw("5", "booking_modified", "room-a")));
    loop.advance(Duration.ofMillis(1));
    assertTrue(router.route(raw("6", "booking_modified", "room-a")));

    assertEquals(3, alerts.size());
    assertEquals(3, metrics.throttled.get());
  }

  @Test
  void whenRouting_givenCriticalBurst_shouldDeliverEveryAlert() {
    for (int i = 0; i < 10; i++) {
      assertTrue(router.route(raw("c-" + i, "system_error", "room-a")));
    }
    assertTrue(router.route(raw("h-1", "booking_conflict", "room-a")));
    assertTrue(router.route(raw("h-2", "booking_conflict", "room-a")));

    assertEquals(12, alerts.size());
    assertEquals(0, metrics.throttled.get());
  }

  @Test
  void whenRouting_shouldBuildTheAdminNotification() {
    router.route(new RawNotification("n-1", "booking_conflict", "admin-1",
        "Conflict", "Two bookings overlap", "room-a", "b-1"));

    final AdminNotification alert = alerts.get(0);
    assertEquals("n-1", alert.id());
    assertEquals(NotificationType.BOOKING_CONFLICT, alert.type());
    assertEquals(AlertPriority.HIGH, alert.priority());
    assertEquals(AlertSource.BOOKING, alert.source());
    assertEquals(T0, alert.timestamp());
    assertEquals("room-a", alert.roomId());
    assertEquals("b-1", alert.bookingId());
  }

  @Test
  void whenSubscribedForUser_shouldOnlyReceiveThatUsersAlerts() {
    final List<AdminNotification> mine = new ArrayList<>();
    router.subscribe("admin-2", mine::add);

    router.route(raw("1", "system_error", null));
    router.route(new RawNotification("2", "system_error", "admin-2", "t",
        "m", null, null));

    assertEquals(1, mine.size());
    assertEquals("2", mine.get(0).id());
    assertEquals(2, alerts.size());
  }

  @Test
  void whenListenerFails_shouldStillDeliverToOthers() {
    final AdminAlertRouter isolated = new AdminAlertRouter(loop,
        Duration.ZERO, metrics);
    final List<AdminNotification> others = new ArrayList<>();
    isolated.subscribe(alert -> {
      throw new IllegalStateException("boom");
    });
    isolated.subscribe(others::add);

    isolated.route(raw("1", "room_management", "room-a"));

    assertEquals(1, others.size());
    assertEquals(1, metrics.listenerFailures.get());
  }

  @Test
  void whenReceivingChange_shouldOnlyRouteNotificationInserts() {
    final Row row = Row.builder()
        .put(Columns.ID, "n-1")
        .put(Columns.TYPE, "system_error")
        .put(Columns.USER_ID, "admin-1")
        .build();

    router.onChange(ChangeEvent.update(Table.NOTIFICATIONS, row, row));
    router.onChange(ChangeEvent.insert(Table.BOOKINGS, row));
    router.onChange(ChangeEvent.insert(Table.NOTIFICATIONS, Row.builder()
        .put(Columns.ID, "n-0").build()));
    router.onChange(ChangeEvent.insert(Table.NOTIFICATIONS, row));

    assertEquals(1, alerts.size());
    assertEquals("n-1", alerts.get(0).id());
  }
}
