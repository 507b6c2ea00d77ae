package org.waabox.roomsync.source;

import java.util.Objects;
import java.util.Optional;

/**
 * A row mutation pushed by the data store.
 *
 * <p>Inserts carry only the new row, deletes only the old row and updates
 * the new row plus, when the store provides it, the old one.
 *
 * @param eventType the mutation kind, never null
 * @param table     the table the row belongs to, never null
 * @param before    the row before the change, null for inserts
 * @param after     the row after the change, null for deletes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(
    ChangeType eventType,
    Table table,
    Row before,
    Row after
) {

  /**
   * Validates the row presence for the event type.
   *
   * @throws IllegalArgumentException if a required row is missing
   */
  public ChangeEvent {
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(table, "table must not be null");
    if (eventType == ChangeType.DELETE && before == null) {
      throw new IllegalArgumentException("A DELETE must carry the old row");
    }
    if (eventType != ChangeType.DELETE && after == null) {
      throw new IllegalArgumentException(
          "An " + eventType + " must carry the new row");
    }
  }

  /**
   * Creates an insert event.
   *
   * @param table the table, never null
   * @param row   the inserted row, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent insert(final Table table, final Row row) {
    return new ChangeEvent(ChangeType.INSERT, table, null, row);
  }

  /**
   * Creates an update event.
   *
   * @param table  the table, never null
   * @param before the old row, may be null
   * @param after  the new row, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent update(final Table table, final Row before,
      final Row after) {
    return new ChangeEvent(ChangeType.UPDATE, table, before, after);
  }

  /**
   * Creates a delete event.
   *
   * @param table the table, never null
   * @param row   the deleted row, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent delete(final Table table, final Row row) {
    return new ChangeEvent(ChangeType.DELETE, table, row, null);
  }

  /**
   * Returns the most recent image of the row: the new row, or the old row
   * for deletes.
   *
   * @return the row, never null
   */
  public Row current() {
    return after != null ? after : before;
  }

  /**
   * Returns the old row, if the event carries it.
   *
   * @return the old row, never null
   */
  public Optional<Row> previous() {
    return Optional.ofNullable(before);
  }
}
