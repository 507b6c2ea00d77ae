package org.waabox.roomsync.loop;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.roomsync.RoomSyncException;

/**
 * {@link EventLoop} backed by a single daemon scheduler thread.
 *
 * <p>Every task is wrapped so that an exception is logged and never kills
 * the thread or silently cancels a periodic task.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SingleThreadEventLoop implements EventLoop {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SingleThreadEventLoop.class);

  /** The default thread name. */
  private static final String THREAD_NAME = "roomsync-event-loop";

  /** The scheduler backing the loop, never null. */
  private final ScheduledExecutorService scheduler;

  /** The clock handed to the components, never null. */
  private final Clock clock;

  /** The loop thread, assigned when the scheduler creates it. */
  private volatile Thread loopThread;

  /**
   * Creates a new event loop on the system UTC clock.
   */
  public SingleThreadEventLoop() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a new event loop.
   *
   * @param theClock the clock handed to the components, never null
   */
  public SingleThreadEventLoop(final Clock theClock) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, THREAD_NAME);
      thread.setDaemon(true);
      loopThread = thread;
      return thread;
    });
  }

  /** {@inheritDoc} */
  @Override
  public void execute(final Runnable task) {
    Objects.requireNonNull(task, "task must not be null");
    try {
      scheduler.execute(guarded(task));
    } catch (final RejectedExecutionException e) {
      log.debug("Event loop stopped, dropping task");
    }
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask schedule(final Runnable task, final Duration delay) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(delay, "delay must not be null");
    return new FutureTask(scheduler.schedule(guarded(task),
        delay.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask scheduleAtFixedRate(final Runnable task,
      final Duration initialDelay, final Duration period) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(period, "period must not be null");
    return new FutureTask(scheduler.scheduleAtFixedRate(guarded(task),
        initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** {@inheritDoc} */
  @Override
  public <T> T call(final Callable<T> task) {
    Objects.requireNonNull(task, "task must not be null");
    if (inEventLoop()) {
      try {
        return task.call();
      } catch (final RuntimeException e) {
        throw e;
      } catch (final Exception e) {
        throw new RoomSyncException("Event loop task failed", e);
      }
    }
    final Future<T> future = scheduler.submit(task);
    try {
      return future.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new RoomSyncException("Interrupted waiting for the event loop", e);
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new RoomSyncException("Event loop task failed", cause);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean inEventLoop() {
    return Thread.currentThread() == loopThread;
  }

  /** {@inheritDoc} */
  @Override
  public Clock clock() {
    return clock;
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    scheduler.shutdownNow();
    log.info("Event loop stopped");
  }

  private static Runnable guarded(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        log.error("Unhandled exception on the event loop: {}",
            e.getMessage(), e);
      }
    };
  }

  /** Adapts a {@link ScheduledFuture} to a {@link ScheduledTask}. */
  private static final class FutureTask implements ScheduledTask {

    /** The wrapped future, never null. */
    private final ScheduledFuture<?> future;

    private FutureTask(final ScheduledFuture<?> theFuture) {
      future = theFuture;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
