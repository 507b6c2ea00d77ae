package org.waabox.roomsync.loop;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * The single thread that owns all mutable synchronization state.
 *
 * <p>Registry, engine, router and monitor state is only ever touched from
 * inside the loop. Transport callbacks from other threads are posted with
 * {@link #execute(Runnable)}; facade calls are marshalled with
 * {@link #call(Callable)}, which runs inline when already on the loop.
 *
 * <p>The loop also owns the clock every component reads, so a virtual-time
 * implementation drives timers and timestamps together.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface EventLoop {

  /**
   * Queues a task to run on the loop.
   *
   * @param task the task, never null
   */
  void execute(Runnable task);

  /**
   * Runs a task on the loop after the given delay.
   *
   * @param task  the task, never null
   * @param delay the delay, never null
   *
   * @return a handle to cancel the task, never null
   */
  ScheduledTask schedule(Runnable task, Duration delay);

  /**
   * Runs a task on the loop periodically.
   *
   * @param task         the task, never null
   * @param initialDelay the delay before the first run, never null
   * @param period       the period between runs, never null
   *
   * @return a handle to cancel the task, never null
   */
  ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay,
      Duration period);

  /**
   * Runs a task on the loop and waits for its result.
   *
   * <p>When invoked from the loop thread the task runs inline.
   *
   * @param task the task, never null
   * @param <T>  the result type
   *
   * @return the task result, may be null
   */
  <T> T call(Callable<T> task);

  /**
   * Runs an action on the loop and waits for it to complete.
   *
   * @param task the action, never null
   */
  default void run(final Runnable task) {
    call(() -> {
      task.run();
      return null;
    });
  }

  /**
   * Whether the current thread is the loop thread.
   *
   * @return true when called from inside the loop
   */
  boolean inEventLoop();

  /**
   * Returns the clock all loop-confined components read.
   *
   * @return the clock, never null
   */
  Clock clock();

  /** Stops the loop; pending tasks are discarded. */
  void shutdown();
}
