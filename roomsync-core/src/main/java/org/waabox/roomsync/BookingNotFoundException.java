package org.waabox.roomsync;

/**
 * Thrown when a write targets a booking that the store does not know.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BookingNotFoundException extends RoomSyncException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given booking.
   *
   * @param bookingId the missing booking id, never null
   */
  public BookingNotFoundException(final String bookingId) {
    super("Booking not found: " + bookingId);
  }
}
