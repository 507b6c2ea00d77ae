package org.waabox.roomsync;

/**
 * Handle returned when a listener is attached to one of the outbound feeds.
 *
 * <p>Removing a registration is idempotent.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Registration {

  /** Detaches the listener. Calling it again has no effect. */
  void remove();
}
