package queues.util;

import queues.spi.FlushTimers;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FlushTimers} backed by a {@link ScheduledExecutorService} of daemon threads.
 *
 * <p>Flush tasks, and the consumer calls they make, run on these threads. The pool
 * size bounds how many queues can be inside a synchronous consumer call at once.
 *
 * <p>{@link #close()} drops timers that have not fired yet and waits up to the drain
 * timeout for running flush tasks before interrupting them.
 */
public final class ExecutorFlushTimers implements FlushTimers, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExecutorFlushTimers.class.getName());

  /** Default time {@link #close()} waits for running flush tasks. */
  public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5000;

  private final ScheduledThreadPoolExecutor scheduler;
  private final long drainTimeoutMs;

  /**
   * @param threads number of timer threads (must be &gt; 0)
   */
  public ExecutorFlushTimers(int threads) {
    this(threads, DEFAULT_DRAIN_TIMEOUT_MS);
  }

  /**
   * @param threads number of timer threads (must be &gt; 0)
   * @param drainTimeoutMs how long {@link #close()} waits for running flush tasks (must be &gt;= 0)
   */
  public ExecutorFlushTimers(int threads, long drainTimeoutMs) {
    if (threads <= 0) {
      throw new IllegalArgumentException("threads must be > 0");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0, got: " + drainTimeoutMs);
    }
    this.drainTimeoutMs = drainTimeoutMs;
    this.scheduler = new ScheduledThreadPoolExecutor(threads, new DaemonThreadFactory("queues-flush-"));
    this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    this.scheduler.setRemoveOnCancelPolicy(true);
  }

  @Override
  public long now() {
    return System.currentTimeMillis();
  }

  @Override
  public TimerHandle schedule(Runnable task, long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    ScheduledFuture<?> future = scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  /**
   * Drops timers that have not fired, then waits up to the drain timeout for running
   * flush tasks, including the consumer calls they make. Tasks still running after
   * the timeout are interrupted.
   */
  @Override
  public void close() {
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout of {0}ms exceeded; interrupting {1} flush task(s)",
            new Object[]{String.valueOf(drainTimeoutMs), scheduler.getActiveCount()});
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
