package org.waabox.roomsync;

/**
 * How the delay before an automatic reconnect grows with the number of
 * attempts already made.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum BackoffStrategy {

  /** Every attempt waits the base backoff. */
  FIXED,

  /** Attempt {@code n} (zero based) waits {@code backoff * 2^n}. */
  EXPONENTIAL
}
