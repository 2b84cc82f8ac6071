package queues.spi;

/**
 * Observability hook for exporting broker counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages buffered on a queue.
   */
  void incrementEnqueued(String queue, int count);

  /**
   * Increments the count of messages discarded because the queue has no consumer.
   */
  void incrementDroppedUnconsumed(String queue, int count);

  /**
   * Increments the count of messages acknowledged by the consumer.
   */
  void incrementAcked(String queue, int count);

  /**
   * Increments the count of messages put back for another attempt.
   */
  void incrementRetried(String queue, int count);

  /**
   * Increments the count of messages moved to a dead-letter queue.
   */
  void incrementDeadLettered(String queue, int count);

  /**
   * Increments the count of messages dropped after exhausting their retries.
   */
  void incrementDiscarded(String queue, int count);

  /**
   * Increments the count of batches whose dispatch failed or reported a non-ok outcome.
   */
  void incrementDispatchFailure(String queue);

  /**
   * Increments the count of flush cycles that ended with an unhandled error.
   */
  default void incrementFlushFailure(String queue) {
  }

  /**
   * Records the time the consumer took to answer one batch.
   *
   * @param durationMs dispatch duration in milliseconds (always non-negative)
   */
  default void recordDispatchDurationMs(String queue, long durationMs) {
  }

  /**
   * Records the number of messages waiting in a queue's buffer.
   */
  void recordPendingDepth(String queue, int depth);

  /** No-op implementation. */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued(String queue, int count) {
    }

    @Override
    public void incrementDroppedUnconsumed(String queue, int count) {
    }

    @Override
    public void incrementAcked(String queue, int count) {
    }

    @Override
    public void incrementRetried(String queue, int count) {
    }

    @Override
    public void incrementDeadLettered(String queue, int count) {
    }

    @Override
    public void incrementDiscarded(String queue, int count) {
    }

    @Override
    public void incrementDispatchFailure(String queue) {
    }

    @Override
    public void recordPendingDepth(String queue, int depth) {
    }
  }
}
