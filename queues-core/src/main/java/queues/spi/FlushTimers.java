package queues.spi;

/**
 * Clock and cancellable one-shot timers used by the flush scheduler.
 *
 * <p>The default implementation is {@link queues.util.ExecutorFlushTimers}. Tests
 * substitute a virtual clock so batching can be driven without sleeping.
 */
public interface FlushTimers {

  /**
   * Returns the current time in epoch milliseconds. Used for message timestamps
   * and dispatch durations.
   */
  long now();

  /**
   * Runs {@code task} once after {@code delayMs} milliseconds. A delay of zero
   * runs the task on the next tick, never synchronously inside this call.
   *
   * @param task the task to run
   * @param delayMs delay in milliseconds (non-negative)
   * @return a handle for cancelling the task
   */
  TimerHandle schedule(Runnable task, long delayMs);

  /** Handle to a scheduled task. */
  interface TimerHandle {

    /** Cancels the task if it has not started. Cancelling twice is a no-op. */
    void cancel();
  }
}
