package org.waabox.roomsync;

/**
 * Base exception for all RoomSync-related errors.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure and
 * configuration failures that cannot be meaningfully recovered from at
 * the call site. Subclasses state whether retrying the same operation can
 * succeed through {@link #isRetryable()}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RoomSyncException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RoomSyncException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RoomSyncException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /** Whether repeating the failed operation unchanged may succeed.
   *
   * @return false by default.
   */
  public boolean isRetryable() {
    return false;
  }
}
