package queues;

import queues.spi.BatchDispatcher;
import queues.spi.FlushTimers;
import queues.spi.MetricsExporter;
import queues.util.ExecutorFlushTimers;
import queues.wire.MessageCodec;
import queues.wire.WireMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of named {@link WorkerQueue}s and the two producer entry points.
 *
 * <p>Queues are created lazily on first reference and start without a consumer; a
 * queue without a consumer accepts and discards everything sent to it. Consumers
 * are attached by orchestration via {@link #setConsumer(QueueConsumer)}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultWorkerRegistry workers = new DefaultWorkerRegistry()
 *     .register("mailer", batch -> batch.messages().forEach(this::send));
 *
 * try (QueueBroker broker = QueueBroker.builder()
 *     .dispatcher(new HandlerBatchDispatcher(workers))
 *     .build()) {
 *   broker.setConsumer(QueueConsumer.builder("emails", "mailer")
 *       .maxRetries(3)
 *       .deadLetterQueue("emails-dlq")
 *       .build());
 *   broker.getOrCreateQueue("emails").send(MessageBody.text("hello"));
 * }
 * }</pre>
 *
 * <p>This class is thread-safe. {@link #close()} cancels all pending flushes
 * without dispatching them.
 *
 * @see QueueBroker.Builder
 * @see WorkerQueue
 */
public final class QueueBroker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueBroker.class.getName());

  private final ConcurrentMap<String, WorkerQueue> queues = new ConcurrentHashMap<>();
  private final Object lifecycleLock = new Object();
  private final BatchDispatcher dispatcher;
  private final FlushTimers timers;
  private final ExecutorFlushTimers ownedTimers;
  private final MessageCodec codec;
  private final MetricsExporter metrics;
  private volatile boolean closed;

  private QueueBroker(Builder builder) {
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.codec = builder.codec != null ? builder.codec : MessageCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.timers != null) {
      this.timers = builder.timers;
      this.ownedTimers = null;
    } else {
      this.ownedTimers = new ExecutorFlushTimers(builder.flushThreads, builder.drainTimeoutMs);
      this.timers = ownedTimers;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the queue with the given name, creating an empty queue without a
   * consumer if it does not exist yet.
   *
   * @param name the queue name
   * @return the queue
   * @throws IllegalStateException if the broker has been closed
   */
  public WorkerQueue getOrCreateQueue(String name) {
    Objects.requireNonNull(name, "name");
    ensureOpen();
    WorkerQueue queue = queues.get(name);
    if (queue != null) {
      return queue;
    }
    // Creation and close() share the lock so every created queue is disposed
    synchronized (lifecycleLock) {
      ensureOpen();
      return queues.computeIfAbsent(name,
          n -> new WorkerQueue(n, this, dispatcher, timers, codec, metrics));
    }
  }

  /** Returns the names of all queues created so far, sorted. */
  public Set<String> queueNames() {
    return new TreeSet<>(queues.keySet());
  }

  /**
   * Attaches or replaces the consumer of {@code queue}. Passing {@code null}
   * detaches the consumer and cancels any pending flush. Does not trigger a flush.
   *
   * @throws IllegalArgumentException if the consumer was configured for another queue
   */
  public void setConsumer(WorkerQueue queue, QueueConsumer consumer) {
    Objects.requireNonNull(queue, "queue");
    queue.setConsumer(consumer);
  }

  /**
   * Attaches or replaces the consumer of the queue named by
   * {@link QueueConsumer#queueName()}.
   */
  public void setConsumer(QueueConsumer consumer) {
    Objects.requireNonNull(consumer, "consumer");
    setConsumer(getOrCreateQueue(consumer.queueName()), consumer);
  }

  /** Detaches every consumer and cancels every pending flush. */
  public void resetConsumers() {
    for (WorkerQueue queue : queues.values()) {
      queue.setConsumer(null);
    }
  }

  /**
   * Enqueues one message from an external producer.
   *
   * @param queueName the target queue
   * @param body the raw message body
   * @param contentType the declared content type tag, or {@code null} for {@code "opaque"}
   * @throws PayloadTooLargeException if the body exceeds the message size limit
   * @throws QueueIngressException if the content type is unknown or the body cannot be decoded
   */
  public void enqueueOne(String queueName, byte[] body, String contentType) {
    Objects.requireNonNull(body, "body");
    getOrCreateQueue(queueName).enqueueOne(body, contentType);
  }

  /**
   * Enqueues a batch from an external producer. The batch is validated against the
   * batch count and size limits and rejected as a whole if any check fails.
   *
   * @param queueName the target queue
   * @param messages the messages, in order
   * @throws PayloadTooLargeException if a batch limit is exceeded
   * @throws QueueIngressException if a message is malformed
   */
  public void enqueueBatch(String queueName, List<WireMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    getOrCreateQueue(queueName).enqueueBatch(messages, true);
  }

  /**
   * Moves messages into a dead-letter queue. Identical to
   * {@link #enqueueBatch(String, List)} but skips the batch limits, since a forward
   * may carry a full batch plus ids and timestamps.
   *
   * @param queueName the dead-letter queue
   * @param messages the messages, with their original ids and timestamps
   * @throws IllegalStateException if the broker has been closed
   */
  public void forwardToDeadLetterQueue(String queueName, List<WireMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    getOrCreateQueue(queueName).enqueueBatch(messages, false);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("QueueBroker has been closed");
    }
  }

  /**
   * Cancels all pending flushes without dispatching them and stops the broker's own
   * timer threads. In-flight dispatches are not interrupted; a broker-owned timer
   * pool waits up to the drain timeout for them to return.
   */
  @Override
  public void close() {
    List<WorkerQueue> toDispose;
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
      toDispose = new ArrayList<>(queues.values());
    }
    for (WorkerQueue queue : toDispose) {
      queue.dispose();
    }
    if (ownedTimers != null) {
      ownedTimers.close();
    }
    logger.log(Level.FINE, "QueueBroker closed with {0} queue(s)", queues.size());
  }

  /** Builder for {@link QueueBroker}. */
  public static final class Builder {
    private BatchDispatcher dispatcher;
    private FlushTimers timers;
    private int flushThreads = 4;
    private long drainTimeoutMs = ExecutorFlushTimers.DEFAULT_DRAIN_TIMEOUT_MS;
    private MessageCodec codec;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the call-out that delivers batches to consumers.
     *
     * <p><b>Required.</b>
     *
     * @param dispatcher the batch dispatcher
     * @return this builder
     */
    public Builder dispatcher(BatchDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Sets the clock and timers used for flush scheduling.
     *
     * <p>Optional. Defaults to an {@link ExecutorFlushTimers} owned, and closed, by
     * the broker.
     *
     * @param timers the timer source
     * @return this builder
     */
    public Builder timers(FlushTimers timers) {
      this.timers = timers;
      return this;
    }

    /**
     * Sets the number of threads of the default timer source.
     *
     * <p>Optional. Defaults to {@code 4}. Ignored when {@link #timers} is set.
     *
     * @param flushThreads number of flush threads
     * @return this builder
     */
    public Builder flushThreads(int flushThreads) {
      this.flushThreads = flushThreads;
      return this;
    }

    /**
     * Sets how long {@link QueueBroker#close()} waits for flush tasks that are still
     * inside a consumer call before interrupting them.
     *
     * <p>Optional. Defaults to {@code 5000}. Ignored when {@link #timers} is set.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the message codec.
     *
     * <p>Optional. Defaults to {@link MessageCodec#getDefault()}.
     *
     * @param codec the codec
     * @return this builder
     */
    public Builder codec(MessageCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @return a new {@link QueueBroker}
     * @throws NullPointerException if {@code dispatcher} is null
     * @throws IllegalArgumentException if {@code flushThreads <= 0} or
     *     {@code drainTimeoutMs < 0} and no timers were set
     */
    public QueueBroker build() {
      return new QueueBroker(this);
    }
  }
}
