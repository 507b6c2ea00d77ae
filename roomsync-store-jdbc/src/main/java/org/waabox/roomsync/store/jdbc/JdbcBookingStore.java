package org.waabox.roomsync.store.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.BookingConflictException;
import org.waabox.roomsync.BookingNotFoundException;
import org.waabox.roomsync.RoomSyncException;
import org.waabox.roomsync.booking.BookingInterval;
import org.waabox.roomsync.booking.BookingRequest;
import org.waabox.roomsync.booking.BookingStatus;
import org.waabox.roomsync.booking.BookingStore;
import org.waabox.roomsync.booking.ConflictDetector;
import org.waabox.roomsync.source.ChangeEvent;
import org.waabox.roomsync.source.ChangeEventCodec;
import org.waabox.roomsync.source.Columns;
import org.waabox.roomsync.source.Row;
import org.waabox.roomsync.source.Table;

/**
 * A {@link BookingStore} backed by a JDBC database.
 *
 * <p>Every write runs in one transaction that first locks the room's row
 * in the room lock table with {@code SELECT ... FOR UPDATE}, then re-checks
 * the overlap against the committed bookings and only then writes. Two
 * concurrent writers on the same room are therefore serialized by the
 * database and the second one sees the first one's booking.
 *
 * <p>The same transaction appends the resulting {@link ChangeEvent}, as
 * JSON, to the change log table, which {@link JdbcChangeLogSource} polls.
 *
 * <p>The tables must exist, see {@link JdbcSchema#create(JdbcStoreConfig)}.
 *
 * <p>Thread safety: this class is thread-safe; it holds no mutable state
 * and every call uses its own connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcBookingStore implements BookingStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcBookingStore.class);

  /** The booking columns, in the order the statements bind them. */
  private static final String COLUMNS = "id, room_id, start_time, end_time,"
      + " status, user_id, title, updated_at";

  /** SQLState class of integrity constraint violations. */
  private static final String INTEGRITY_VIOLATION = "23";

  /** The configuration, never null. */
  private final JdbcStoreConfig config;

  /** Stamps the row versions, never null. */
  private final Clock clock;

  /**
   * Creates a store stamping row versions with the UTC system clock.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcBookingStore(final JdbcStoreConfig theConfig) {
    this(theConfig, Clock.systemUTC());
  }

  /**
   * Creates a new store.
   *
   * @param theConfig the configuration, never null
   * @param theClock  stamps the row versions, never null
   */
  public JdbcBookingStore(final JdbcStoreConfig theConfig,
      final Clock theClock) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public List<BookingInterval> findConfirmed(final String roomId,
      final Instant start, final Instant end) {
    Objects.requireNonNull(roomId, "roomId cannot be null");
    ConflictDetector.requireWindow(start, end);

    try (final Connection conn = config.dataSource().getConnection()) {
      return overlapping(conn, roomId, start, end, null);
    } catch (final SQLException e) {
      throw new RoomSyncException(
          "Failed to read the bookings of room " + roomId, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<BookingInterval> findUpcoming(final String roomId,
      final Instant from) {
    Objects.requireNonNull(roomId, "roomId cannot be null");
    Objects.requireNonNull(from, "from cannot be null");

    final String sql = "SELECT " + COLUMNS + " FROM " + config.bookingsTable()
        + " WHERE room_id = ? AND status = ? AND end_time > ?"
        + " ORDER BY start_time";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setString(1, roomId);
      ps.setString(2, BookingStatus.CONFIRMED.wireName());
      setInstant(ps, 3, from);

      final List<BookingInterval> result = new ArrayList<>();
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(read(rs).interval());
        }
      }
      return result;

    } catch (final SQLException e) {
      throw new RoomSyncException(
          "Failed to read the upcoming bookings of room " + roomId, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<BookingInterval> find(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId cannot be null");

    try (final Connection conn = config.dataSource().getConnection()) {
      return load(conn, bookingId).map(StoredBooking::interval);
    } catch (final SQLException e) {
      throw new RoomSyncException("Failed to read booking " + bookingId, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval insert(final BookingRequest request) {
    Objects.requireNonNull(request, "request cannot be null");
    ensureLockRow(request.roomId());

    return inTransaction("insert a booking in room " + request.roomId(),
        conn -> {
          lockRoom(conn, request.roomId());
          requireNoConflict(conn, request, null);

          final StoredBooking stored = new StoredBooking(
              new BookingInterval(UUID.randomUUID().toString(),
                  request.roomId(), request.startTime(), request.endTime(),
                  request.status(), now()),
              request.userId(), request.title());

          final String sql = "INSERT INTO " + config.bookingsTable()
              + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
          try (final PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, stored);
            ps.executeUpdate();
          }
          appendChange(conn, ChangeEvent.insert(Table.BOOKINGS,
              stored.toRow()));

          log.debug("Inserted booking {} in room {}",
              stored.interval().bookingId(), request.roomId());
          return stored.interval();
        });
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval update(final String bookingId,
      final BookingRequest request) {
    Objects.requireNonNull(bookingId, "bookingId cannot be null");
    Objects.requireNonNull(request, "request cannot be null");
    ensureLockRow(request.roomId());

    return inTransaction("update booking " + bookingId, conn -> {
      final StoredBooking current = require(conn, bookingId);
      lockRooms(conn, current.interval().roomId(), request.roomId());

      final StoredBooking before = require(conn, bookingId);
      requireNoConflict(conn, request, bookingId);

      final StoredBooking after = new StoredBooking(
          new BookingInterval(bookingId, request.roomId(),
              request.startTime(), request.endTime(), request.status(),
              now()),
          request.userId(), request.title());
      rewrite(conn, after);
      appendChange(conn, ChangeEvent.update(Table.BOOKINGS, before.toRow(),
          after.toRow()));

      log.debug("Updated booking {} in room {}", bookingId,
          request.roomId());
      return after.interval();
    });
  }

  /** {@inheritDoc} */
  @Override
  public BookingInterval cancel(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId cannot be null");

    return inTransaction("cancel booking " + bookingId, conn -> {
      final StoredBooking current = require(conn, bookingId);
      lockRoom(conn, current.interval().roomId());

      final StoredBooking before = require(conn, bookingId);
      final BookingInterval interval = before.interval();
      final StoredBooking after = new StoredBooking(
          new BookingInterval(bookingId, interval.roomId(),
              interval.startTime(), interval.endTime(),
              BookingStatus.CANCELLED, now()),
          before.userId(), before.title());
      rewrite(conn, after);
      appendChange(conn, ChangeEvent.update(Table.BOOKINGS, before.toRow(),
          after.toRow()));

      log.debug("Cancelled booking {}", bookingId);
      return after.interval();
    });
  }

  /**
   * Removes a booking row entirely and logs the delete.
   *
   * @param bookingId the booking id, never null
   *
   * @return true if the booking existed
   */
  public boolean delete(final String bookingId) {
    Objects.requireNonNull(bookingId, "bookingId cannot be null");

    return inTransaction("delete booking " + bookingId, conn -> {
      final Optional<StoredBooking> current = load(conn, bookingId);
      if (current.isEmpty()) {
        return false;
      }
      lockRoom(conn, current.get().interval().roomId());

      final String sql = "DELETE FROM " + config.bookingsTable()
          + " WHERE id = ?";
      try (final PreparedStatement ps = conn.prepareStatement(sql)) {
        ps.setString(1, bookingId);
        if (ps.executeUpdate() == 0) {
          return false;
        }
      }
      appendChange(conn, ChangeEvent.delete(Table.BOOKINGS,
          current.get().toRow()));
      return true;
    });
  }

  private List<BookingInterval> overlapping(final Connection conn,
      final String roomId, final Instant start, final Instant end,
      final String excludeId) throws SQLException {

    final String sql = "SELECT " + COLUMNS + " FROM " + config.bookingsTable()
        + " WHERE room_id = ? AND status = ? AND start_time < ?"
        + " AND end_time > ?";

    final List<BookingInterval> candidates = new ArrayList<>();
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, roomId);
      ps.setString(2, BookingStatus.CONFIRMED.wireName());
      setInstant(ps, 3, end);
      setInstant(ps, 4, start);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          candidates.add(read(rs).interval());
        }
      }
    }
    return ConflictDetector.findOverlaps(candidates, roomId, start, end,
        excludeId);
  }

  private void requireNoConflict(final Connection conn,
      final BookingRequest request, final String excludeId)
      throws SQLException {
    final List<BookingInterval> conflicts = overlapping(conn,
        request.roomId(), request.startTime(), request.endTime(), excludeId);
    if (!conflicts.isEmpty()) {
      throw new BookingConflictException(request.roomId(),
          request.startTime(), request.endTime(), conflicts);
    }
  }

  private Optional<StoredBooking> load(final Connection conn,
      final String bookingId) throws SQLException {
    final String sql = "SELECT " + COLUMNS + " FROM " + config.bookingsTable()
        + " WHERE id = ?";
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, bookingId);
      try (final ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(read(rs)) : Optional.empty();
      }
    }
  }

  private StoredBooking require(final Connection conn,
      final String bookingId) throws SQLException {
    return load(conn, bookingId).orElseThrow(() ->
        new BookingNotFoundException(bookingId));
  }

  private void rewrite(final Connection conn, final StoredBooking booking)
      throws SQLException {
    final String sql = "UPDATE " + config.bookingsTable()
        + " SET room_id = ?, start_time = ?, end_time = ?, status = ?,"
        + " user_id = ?, title = ?, updated_at = ? WHERE id = ?";
    final BookingInterval interval = booking.interval();
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, interval.roomId());
      setInstant(ps, 2, interval.startTime());
      setInstant(ps, 3, interval.endTime());
      ps.setString(4, interval.status().wireName());
      ps.setString(5, booking.userId());
      ps.setString(6, booking.title());
      setInstant(ps, 7, interval.updatedAt());
      ps.setString(8, interval.bookingId());
      ps.executeUpdate();
    }
  }

  private void appendChange(final Connection conn, final ChangeEvent event)
      throws SQLException {
    final String sql = "INSERT INTO " + config.changeLogTable()
        + " (table_name, payload, created_at) VALUES (?, ?, ?)";
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, event.table().tableName());
      ps.setString(2, ChangeEventCodec.serialize(event));
      setInstant(ps, 3, now());
      ps.executeUpdate();
    }
  }

  /**
   * Makes sure the lock row of a room exists, outside of any transaction.
   *
   * <p>Two writers may race to create it; the loser's duplicate key error
   * means the row is there.
   */
  private void ensureLockRow(final String roomId) {
    try (final Connection conn = config.dataSource().getConnection()) {
      if (!lockRowExists(conn, roomId)) {
        insertLockRow(conn, roomId);
      }
    } catch (final SQLException e) {
      if (!isIntegrityViolation(e)) {
        throw new RoomSyncException(
            "Failed to prepare the lock of room " + roomId, e);
      }
      log.debug("Lock row of room {} created concurrently", roomId);
    }
  }

  private void lockRooms(final Connection conn, final String first,
      final String second) throws SQLException {
    // locks are always taken in room id order.
    if (first.equals(second)) {
      lockRoom(conn, first);
    } else if (first.compareTo(second) < 0) {
      lockRoom(conn, first);
      lockRoom(conn, second);
    } else {
      lockRoom(conn, second);
      lockRoom(conn, first);
    }
  }

  private void lockRoom(final Connection conn, final String roomId)
      throws SQLException {
    final String sql = "SELECT room_id FROM " + config.roomLocksTable()
        + " WHERE room_id = ? FOR UPDATE";
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, roomId);
      try (final ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }
    // the row did not exist: the uncommitted insert locks it as well.
    insertLockRow(conn, roomId);
  }

  private boolean lockRowExists(final Connection conn, final String roomId)
      throws SQLException {
    final String sql = "SELECT room_id FROM " + config.roomLocksTable()
        + " WHERE room_id = ?";
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, roomId);
      try (final ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  private void insertLockRow(final Connection conn, final String roomId)
      throws SQLException {
    final String sql = "INSERT INTO " + config.roomLocksTable()
        + " (room_id) VALUES (?)";
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, roomId);
      ps.executeUpdate();
    }
  }

  private <T> T inTransaction(final String action, final SqlWork<T> work) {
    try (final Connection conn = config.dataSource().getConnection()) {
      final boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        final T result = work.run(conn);
        conn.commit();
        return result;
      } catch (final SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (final SQLException e) {
      throw new RoomSyncException("Failed to " + action, e);
    }
  }

  private static void rollback(final Connection conn,
      final Exception failure) {
    try {
      conn.rollback();
    } catch (final SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static boolean isIntegrityViolation(final SQLException e) {
    return e.getSQLState() != null
        && e.getSQLState().startsWith(INTEGRITY_VIOLATION);
  }

  private void bind(final PreparedStatement ps, final StoredBooking booking)
      throws SQLException {
    final BookingInterval interval = booking.interval();
    ps.setString(1, interval.bookingId());
    ps.setString(2, interval.roomId());
    setInstant(ps, 3, interval.startTime());
    setInstant(ps, 4, interval.endTime());
    ps.setString(5, interval.status().wireName());
    ps.setString(6, booking.userId());
    ps.setString(7, booking.title());
    setInstant(ps, 8, interval.updatedAt());
  }

  private static StoredBooking read(final ResultSet rs) throws SQLException {
    return new StoredBooking(
        new BookingInterval(
            rs.getString("id"),
            rs.getString("room_id"),
            instant(rs, "start_time"),
            instant(rs, "end_time"),
            BookingStatus.fromWire(rs.getString("status")),
            instant(rs, "updated_at")),
        rs.getString("user_id"),
        rs.getString("title"));
  }

  private static Instant instant(final ResultSet rs, final String column)
      throws SQLException {
    return rs.getObject(column, OffsetDateTime.class).toInstant();
  }

  private static void setInstant(final PreparedStatement ps, final int index,
      final Instant value) throws SQLException {
    ps.setObject(index, value.atOffset(ZoneOffset.UTC));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  /** A unit of work running on the transaction's connection. */
  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
  }

  /** A booking row: its interval plus owner data. */
  private record StoredBooking(
      BookingInterval interval,
      String userId,
      String title
  ) {

    Row toRow() {
      final Row.Builder row = Row.builder();
      interval.toRow().asMap().forEach(row::put);
      return row.put(Columns.USER_ID, userId)
          .put(Columns.TITLE, title)
          .build();
    }
  }
}
