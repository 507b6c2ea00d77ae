package org.waabox.roomsync.source;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable snapshot of a table row carried by a {@link ChangeEvent}.
 *
 * <p>Columns use their snake_case database names. Values are strings,
 * booleans, numbers or instants; timestamps held as ISO-8601 strings are
 * parsed on access. A column holding null is treated as absent.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Row {

  /** The column values, never null. */
  private final Map<String, Object> columns;

  private Row(final Map<String, Object> theColumns) {
    columns = theColumns;
  }

  /**
   * Creates a row from the given column map; null values are dropped.
   *
   * @param columns the column values, never null
   *
   * @return a new row, never null
   */
  public static Row of(final Map<String, ?> columns) {
    Objects.requireNonNull(columns, "columns must not be null");
    final Map<String, Object> copy = new LinkedHashMap<>();
    columns.forEach((column, value) -> {
      if (value != null) {
        copy.put(column, value);
      }
    });
    return new Row(Collections.unmodifiableMap(copy));
  }

  /**
   * Creates a new builder.
   *
   * @return a builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether the row carries a non-null value for the column.
   *
   * @param column the column name, never null
   *
   * @return true if present
   */
  public boolean has(final String column) {
    return columns.containsKey(column);
  }

  /**
   * Returns the column value as a string.
   *
   * @param column the column name, never null
   *
   * @return the value, never null
   *
   * @throws IllegalArgumentException if the column is absent
   */
  public String string(final String column) {
    return optionalString(column).orElseThrow(() ->
        new IllegalArgumentException("Missing column: " + column));
  }

  /**
   * Returns the column value as a string, if present.
   *
   * @param column the column name, never null
   *
   * @return the value, never null
   */
  public Optional<String> optionalString(final String column) {
    final Object value = columns.get(column);
    return value == null ? Optional.empty() : Optional.of(value.toString());
  }

  /**
   * Returns the column value as an instant.
   *
   * @param column the column name, never null
   *
   * @return the value, never null
   *
   * @throws IllegalArgumentException if the column is absent or is not an
   *                                  ISO-8601 instant
   */
  public Instant instant(final String column) {
    return optionalInstant(column).orElseThrow(() ->
        new IllegalArgumentException("Missing column: " + column));
  }

  /**
   * Returns the column value as an instant, if present.
   *
   * @param column the column name, never null
   *
   * @return the value, never null
   *
   * @throws IllegalArgumentException if the value is not an instant
   */
  public Optional<Instant> optionalInstant(final String column) {
    final Object value = columns.get(column);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Instant) {
      return Optional.of((Instant) value);
    }
    try {
      return Optional.of(Instant.parse(value.toString()));
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException(
          "Column " + column + " is not an instant: " + value, e);
    }
  }

  /**
   * Returns the column value as a boolean.
   *
   * @param column       the column name, never null
   * @param defaultValue the value returned when the column is absent
   *
   * @return the value
   */
  public boolean bool(final String column, final boolean defaultValue) {
    final Object value = columns.get(column);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(value.toString());
  }

  /**
   * Returns the raw column values.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, Object> asMap() {
    return columns;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Row)) {
      return false;
    }
    return columns.equals(((Row) other).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "Row" + columns;
  }

  /** Fluent row builder, keeps column insertion order. */
  public static final class Builder {

    /** The columns collected so far. */
    private final Map<String, Object> columns = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Sets a column value; a null value leaves the column absent.
     *
     * @param column the column name, never null
     * @param value  the value, may be null
     *
     * @return this builder
     */
    public Builder put(final String column, final Object value) {
      Objects.requireNonNull(column, "column must not be null");
      if (value == null) {
        columns.remove(column);
      } else {
        columns.put(column, value);
      }
      return this;
    }

    /**
     * Builds the row.
     *
     * @return the row, never null
     */
    public Row build() {
      return Row.of(columns);
    }
  }
}
