package org.waabox.roomsync.source;

/**
 * Column names used by the rows of the streamed tables.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Columns {

  /** Primary key of every table. */
  public static final String ID = "id";

  /** Room of a booking or notification. */
  public static final String ROOM_ID = "room_id";

  /** Booking start, ISO-8601. */
  public static final String START_TIME = "start_time";

  /** Booking end, ISO-8601. */
  public static final String END_TIME = "end_time";

  /** Booking status. */
  public static final String STATUS = "status";

  /** Row version, ISO-8601. */
  public static final String UPDATED_AT = "updated_at";

  /** Room active flag. */
  public static final String IS_ACTIVE = "is_active";

  /** Owner of a booking, recipient of a notification. */
  public static final String USER_ID = "user_id";

  /** Booking title. */
  public static final String TITLE = "title";

  /** Notification type. */
  public static final String TYPE = "type";

  /** Notification body. */
  public static final String MESSAGE = "message";

  /** Booking a notification refers to. */
  public static final String BOOKING_ID = "booking_id";

  /** Row creation time, ISO-8601. */
  public static final String CREATED_AT = "created_at";

  /** Private constructor to prevent instantiation. */
  private Columns() {
    throw new UnsupportedOperationException("Utility class");
  }
}
