package queues;

import java.util.Objects;

/**
 * Immutable consumer configuration of one queue: which worker receives its
 * batches and how batches are sized, timed and retried.
 *
 * <p>Create instances via {@link #builder(String, String)}.
 */
public final class QueueConsumer {
  public static final int DEFAULT_MAX_BATCH_SIZE = 5;
  public static final double DEFAULT_MAX_BATCH_TIMEOUT_SECONDS = 1;
  public static final int DEFAULT_MAX_RETRIES = 2;

  private final String queueName;
  private final String workerName;
  private final int maxBatchSize;
  private final double maxBatchTimeoutSeconds;
  private final int maxRetries;
  private final String deadLetterQueue;

  private QueueConsumer(Builder builder) {
    this.queueName = Objects.requireNonNull(builder.queueName, "queueName");
    this.workerName = Objects.requireNonNull(builder.workerName, "workerName");
    if (builder.maxBatchSize < 0 || builder.maxBatchSize > 100) {
      throw new IllegalArgumentException("maxBatchSize must be in [0, 100], got: " + builder.maxBatchSize);
    }
    if (!(builder.maxBatchTimeoutSeconds >= 0 && builder.maxBatchTimeoutSeconds <= 30)) {
      throw new IllegalArgumentException(
          "maxBatchTimeoutSeconds must be in [0, 30], got: " + builder.maxBatchTimeoutSeconds);
    }
    if (builder.maxRetries < 0 || builder.maxRetries > 100) {
      throw new IllegalArgumentException("maxRetries must be in [0, 100], got: " + builder.maxRetries);
    }
    if (builder.deadLetterQueue != null && builder.deadLetterQueue.isEmpty()) {
      throw new IllegalArgumentException("deadLetterQueue cannot be empty");
    }
    this.maxBatchSize = builder.maxBatchSize;
    this.maxBatchTimeoutSeconds = builder.maxBatchTimeoutSeconds;
    this.maxRetries = builder.maxRetries;
    this.deadLetterQueue = builder.deadLetterQueue;
  }

  /**
   * Creates a builder with default batching and retry settings.
   *
   * @param queueName the consumed queue
   * @param workerName the worker that receives the queue's batches
   * @return a new builder
   */
  public static Builder builder(String queueName, String workerName) {
    return new Builder(queueName, workerName);
  }

  public String queueName() {
    return queueName;
  }

  public String workerName() {
    return workerName;
  }

  public int maxBatchSize() {
    return maxBatchSize;
  }

  /**
   * Batch size used for flushing. A configured size of 0 still delivers one
   * message per batch.
   */
  public int effectiveBatchSize() {
    return Math.max(1, maxBatchSize);
  }

  public double maxBatchTimeoutSeconds() {
    return maxBatchTimeoutSeconds;
  }

  public long maxBatchTimeoutMs() {
    return Math.round(maxBatchTimeoutSeconds * 1000);
  }

  public int maxRetries() {
    return maxRetries;
  }

  /** Total delivery attempts per message: {@code maxRetries + 1}. */
  public int maxAttempts() {
    return maxRetries + 1;
  }

  /** Returns the dead-letter queue name, or {@code null} if none is configured. */
  public String deadLetterQueue() {
    return deadLetterQueue;
  }

  @Override
  public String toString() {
    return "QueueConsumer{queueName=" + queueName + ", workerName=" + workerName
        + ", maxBatchSize=" + maxBatchSize + ", maxBatchTimeoutSeconds=" + maxBatchTimeoutSeconds
        + ", maxRetries=" + maxRetries + ", deadLetterQueue=" + deadLetterQueue + '}';
  }

  /** Builder for {@link QueueConsumer}. */
  public static final class Builder {
    private final String queueName;
    private final String workerName;
    private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
    private double maxBatchTimeoutSeconds = DEFAULT_MAX_BATCH_TIMEOUT_SECONDS;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private String deadLetterQueue;

    private Builder(String queueName, String workerName) {
      this.queueName = queueName;
      this.workerName = workerName;
    }

    /**
     * Sets the maximum number of messages per batch.
     *
     * <p>Optional. Defaults to {@code 5}. Must be in [0, 100].
     *
     * @param maxBatchSize messages per batch
     * @return this builder
     */
    public Builder maxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    /**
     * Sets how long a partial batch waits before it is flushed.
     *
     * <p>Optional. Defaults to {@code 1} second. Must be in [0, 30].
     *
     * @param maxBatchTimeoutSeconds batch timeout in seconds
     * @return this builder
     */
    public Builder maxBatchTimeoutSeconds(double maxBatchTimeoutSeconds) {
      this.maxBatchTimeoutSeconds = maxBatchTimeoutSeconds;
      return this;
    }

    /**
     * Sets how many times a failed message is redelivered.
     *
     * <p>Optional. Defaults to {@code 2}. Must be in [0, 100].
     *
     * @param maxRetries retries per message
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the queue receiving messages that exhausted their retries.
     *
     * <p>Optional. Without one, such messages are dropped.
     *
     * @param deadLetterQueue dead-letter queue name, or {@code null}
     * @return this builder
     */
    public Builder deadLetterQueue(String deadLetterQueue) {
      this.deadLetterQueue = deadLetterQueue;
      return this;
    }

    /**
     * @return a new {@link QueueConsumer}
     * @throws NullPointerException if {@code queueName} or {@code workerName} is null
     * @throws IllegalArgumentException if a setting is out of range
     */
    public QueueConsumer build() {
      return new QueueConsumer(this);
    }
  }
}
