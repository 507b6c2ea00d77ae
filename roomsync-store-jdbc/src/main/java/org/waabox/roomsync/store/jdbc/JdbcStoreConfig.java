package org.waabox.roomsync.store.jdbc;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

import javax.sql.DataSource;

/**
 * Configuration shared by the {@link JdbcBookingStore} and the
 * {@link JdbcChangeLogSource}.
 *
 * <p>Holds the {@link DataSource}, the prefix of the three tables the
 * module owns ({@code <prefix>bookings}, {@code <prefix>room_locks} and
 * {@code <prefix>change_log}) and the interval at which the change log is
 * polled.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and
 * {@link #create(DataSource, String, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcStoreConfig {

  /** Default table prefix. */
  private static final String DEFAULT_TABLE_PREFIX = "roomsync_";

  /** Default poll interval (1 second). */
  private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

  /** Table prefixes end up in SQL, so only identifiers are accepted. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The table prefix, never null. */
  private final String tablePrefix;

  /** The change log polling interval, never null. */
  private final Duration pollInterval;

  /** Private constructor; use static factories.
   *
   * @param theDataSource   the JDBC data source
   * @param theTablePrefix  the table prefix
   * @param thePollInterval the poll interval
   */
  private JdbcStoreConfig(final DataSource theDataSource,
      final String theTablePrefix, final Duration thePollInterval) {
    dataSource = theDataSource;
    tablePrefix = theTablePrefix;
    pollInterval = thePollInterval;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param dataSource   the JDBC data source, never null
   * @param tablePrefix  the prefix of the module tables, a SQL identifier
   * @param pollInterval the change log polling interval, must be positive
   *
   * @return a new configuration instance, never null
   */
  public static JdbcStoreConfig create(final DataSource dataSource,
      final String tablePrefix, final Duration pollInterval) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tablePrefix, "tablePrefix cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");

    if (!IDENTIFIER.matcher(tablePrefix).matches()) {
      throw new IllegalArgumentException(
          "tablePrefix must be a SQL identifier, got: " + tablePrefix);
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + pollInterval);
    }

    return new JdbcStoreConfig(dataSource, tablePrefix, pollInterval);
  }

  /**
   * Creates a configuration with default table prefix and poll interval.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Table prefix: {@code roomsync_}</li>
   *   <li>Poll interval: 1 second</li>
   * </ul>
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcStoreConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_PREFIX, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the bookings table name.
   *
   * @return the table name, never null
   */
  public String bookingsTable() {
    return tablePrefix + "bookings";
  }

  /**
   * Returns the name of the table holding one lock row per room.
   *
   * @return the table name, never null
   */
  public String roomLocksTable() {
    return tablePrefix + "room_locks";
  }

  /**
   * Returns the change log table name.
   *
   * @return the table name, never null
   */
  public String changeLogTable() {
    return tablePrefix + "change_log";
  }

  /**
   * Returns the change log polling interval.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }
}
