package org.waabox.roomsync.loop;

/**
 * A delayed or periodic task queued on the {@link EventLoop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ScheduledTask {

  /** Cancels the task. Has no effect when it already ran or was cancelled. */
  void cancel();

  /**
   * Whether {@link #cancel()} was called.
   *
   * @return true once cancelled
   */
  boolean isCancelled();
}
