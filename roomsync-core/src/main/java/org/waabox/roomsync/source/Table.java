package org.waabox.roomsync.source;

import java.util.Objects;

/**
 * The tables whose row changes are streamed to the engine.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Table {

  /** Room reservations. */
  BOOKINGS("bookings"),

  /** Meeting rooms and their active flag. */
  ROOMS("rooms"),

  /** Per-user notifications, the source of admin alerts. */
  NOTIFICATIONS("notifications");

  /** The table name as it appears on the wire, never null. */
  private final String tableName;

  Table(final String theTableName) {
    tableName = theTableName;
  }

  /**
   * Returns the table name as it appears on the wire.
   *
   * @return the lower case table name, never null
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Resolves a wire table name.
   *
   * @param name the table name, never null
   *
   * @return the table, never null
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Table fromName(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    for (Table table : values()) {
      if (table.tableName.equalsIgnoreCase(name)) {
        return table;
      }
    }
    throw new IllegalArgumentException("Unknown table: " + name);
  }
}
