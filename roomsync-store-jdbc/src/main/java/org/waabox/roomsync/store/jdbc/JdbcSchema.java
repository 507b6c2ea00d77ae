package org.waabox.roomsync.store.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.RoomSyncException;

/**
 * Creates the tables used by the JDBC module.
 *
 * <p>Uses {@code CREATE TABLE IF NOT EXISTS}, so it can run on every start.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcSchema {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(JdbcSchema.class);

  private JdbcSchema() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Creates the bookings, room lock and change log tables if missing.
   *
   * @param config the module configuration, never null
   *
   * @throws RoomSyncException if the DDL fails
   */
  public static void create(final JdbcStoreConfig config) {
    Objects.requireNonNull(config, "config cannot be null");

    final List<String> ddl = List.of(
        "CREATE TABLE IF NOT EXISTS " + config.bookingsTable() + " ("
            + "id VARCHAR(64) NOT NULL, "
            + "room_id VARCHAR(255) NOT NULL, "
            + "start_time TIMESTAMP WITH TIME ZONE NOT NULL, "
            + "end_time TIMESTAMP WITH TIME ZONE NOT NULL, "
            + "status VARCHAR(16) NOT NULL, "
            + "user_id VARCHAR(255), "
            + "title VARCHAR(255), "
            + "updated_at TIMESTAMP WITH TIME ZONE NOT NULL, "
            + "PRIMARY KEY (id)"
            + ")",
        "CREATE TABLE IF NOT EXISTS " + config.roomLocksTable() + " ("
            + "room_id VARCHAR(255) NOT NULL, "
            + "PRIMARY KEY (room_id)"
            + ")",
        "CREATE TABLE IF NOT EXISTS " + config.changeLogTable() + " ("
            + "seq BIGINT GENERATED BY DEFAULT AS IDENTITY, "
            + "table_name VARCHAR(32) NOT NULL, "
            + "payload VARCHAR(8192) NOT NULL, "
            + "created_at TIMESTAMP WITH TIME ZONE NOT NULL, "
            + "PRIMARY KEY (seq)"
            + ")");

    try (final Connection conn = config.dataSource().getConnection();
         final Statement statement = conn.createStatement()) {

      for (final String sql : ddl) {
        statement.execute(sql);
      }
      log.debug("Ensured tables {}, {} and {} exist", config.bookingsTable(),
          config.roomLocksTable(), config.changeLogTable());

    } catch (final SQLException e) {
      throw new RoomSyncException("Failed to create the room sync tables", e);
    }
  }
}
