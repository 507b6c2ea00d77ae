package org.waabox.roomsync.source;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What a push channel listens to: a set of tables, a set of mutation kinds
 * and an optional {@code column = value} row filter.
 *
 * <p>This class is immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChannelSpec {

  /** The tables the channel listens to, never empty. */
  private final Set<Table> tables;

  /** The mutation kinds the channel listens to, never empty. */
  private final Set<ChangeType> eventTypes;

  /** The filtered column, null when unfiltered. */
  private final String filterColumn;

  /** The expected column value, null when unfiltered. */
  private final String filterValue;

  private ChannelSpec(final Set<Table> theTables,
      final Set<ChangeType> theEventTypes, final String theFilterColumn,
      final String theFilterValue) {
    tables = theTables;
    eventTypes = theEventTypes;
    filterColumn = theFilterColumn;
    filterValue = theFilterValue;
  }

  /**
   * Creates a spec listening to every mutation on the given tables.
   *
   * @param first the first table, never null
   * @param rest  more tables, never null
   *
   * @return the spec, never null
   */
  public static ChannelSpec of(final Table first, final Table... rest) {
    Objects.requireNonNull(first, "table must not be null");
    return new ChannelSpec(
        Collections.unmodifiableSet(EnumSet.of(first, rest)),
        Collections.unmodifiableSet(EnumSet.allOf(ChangeType.class)),
        null, null);
  }

  /**
   * Returns a copy restricted to the given mutation kinds.
   *
   * @param first the first kind, never null
   * @param rest  more kinds, never null
   *
   * @return a new spec, never null
   */
  public ChannelSpec onlyEvents(final ChangeType first,
      final ChangeType... rest) {
    Objects.requireNonNull(first, "eventType must not be null");
    return new ChannelSpec(tables,
        Collections.unmodifiableSet(EnumSet.of(first, rest)),
        filterColumn, filterValue);
  }

  /**
   * Returns a copy that only matches rows where {@code column = value}.
   *
   * @param column the column name, never null
   * @param value  the expected value, never null
   *
   * @return a new spec, never null
   */
  public ChannelSpec filteredBy(final String column, final String value) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(value, "value must not be null");
    return new ChannelSpec(tables, eventTypes, column, value);
  }

  /**
   * Decides whether the channel delivers the given event.
   *
   * <p>The filter is applied to the new row, or to the old row for deletes.
   *
   * @param event the event, never null
   *
   * @return true if the event belongs to this channel
   */
  public boolean matches(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    if (!tables.contains(event.table())
        || !eventTypes.contains(event.eventType())) {
      return false;
    }
    if (filterColumn == null) {
      return true;
    }
    return event.current().optionalString(filterColumn)
        .map(filterValue::equals)
        .orElse(false);
  }

  /**
   * Returns the tables the channel listens to.
   *
   * @return an unmodifiable set, never empty
   */
  public Set<Table> tables() {
    return tables;
  }

  /**
   * Returns the mutation kinds the channel listens to.
   *
   * @return an unmodifiable set, never empty
   */
  public Set<ChangeType> eventTypes() {
    return eventTypes;
  }

  /**
   * Returns the filtered column.
   *
   * @return the column, empty when unfiltered
   */
  public Optional<String> filterColumn() {
    return Optional.ofNullable(filterColumn);
  }

  /**
   * Returns the expected filter value.
   *
   * @return the value, empty when unfiltered
   */
  public Optional<String> filterValue() {
    return Optional.ofNullable(filterValue);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ChannelSpec)) {
      return false;
    }
    final ChannelSpec that = (ChannelSpec) other;
    return tables.equals(that.tables)
        && eventTypes.equals(that.eventTypes)
        && Objects.equals(filterColumn, that.filterColumn)
        && Objects.equals(filterValue, that.filterValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tables, eventTypes, filterColumn, filterValue);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("ChannelSpec{tables=")
        .append(tables).append(", events=").append(eventTypes);
    if (filterColumn != null) {
      sb.append(", filter=").append(filterColumn).append("=eq.")
          .append(filterValue);
    }
    return sb.append('}').toString();
  }
}
