package queues;

import queues.dispatch.BatchReconciler;
import queues.dispatch.BatchReconciler.Reconciliation;
import queues.dispatch.FlushScheduler;
import queues.dispatch.QueueResponse;
import queues.ingress.IngressValidator;
import queues.model.ContentType;
import queues.model.MessageBody;
import queues.model.QueueMessage;
import queues.spi.BatchDispatcher;
import queues.spi.FlushTimers;
import queues.spi.MetricsExporter;
import queues.wire.MessageCodec;
import queues.wire.WireMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named queue: the ordered buffer of pending messages, its consumer and its
 * flush scheduling.
 *
 * <p>Producers append at the tail; batches are taken from the head. Batches are
 * only produced when the {@link FlushScheduler} fires. After the consumer answers,
 * retried messages are appended at the tail again (behind anything enqueued while
 * the batch was out) and exhausted messages are moved to the dead-letter queue.
 *
 * <p>All buffer and scheduler state is guarded by the queue's lock, which is never
 * held across the consumer call, so producers (including the consumer itself) can
 * enqueue while a batch is in flight.
 *
 * <p>Obtain instances from {@link QueueBroker#getOrCreateQueue(String)}.
 */
public final class WorkerQueue {
  private static final Logger logger = Logger.getLogger(WorkerQueue.class.getName());

  private final String name;
  private final QueueBroker broker;
  private final BatchDispatcher dispatcher;
  private final FlushTimers timers;
  private final MessageCodec codec;
  private final MetricsExporter metrics;

  private final Object lock = new Object();
  private final Deque<QueueMessage> pending = new ArrayDeque<>();
  private final FlushScheduler scheduler;
  private QueueConsumer consumer;
  private boolean disposed;

  WorkerQueue(String name, QueueBroker broker, BatchDispatcher dispatcher, FlushTimers timers,
      MessageCodec codec, MetricsExporter metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.broker = broker;
    this.dispatcher = dispatcher;
    this.timers = timers;
    this.codec = codec;
    this.metrics = metrics;
    this.scheduler = new FlushScheduler(timers, this::onFlushTimer);
  }

  public String name() {
    return name;
  }

  /** Returns the current consumer, or {@code null} if nobody consumes this queue. */
  public QueueConsumer consumer() {
    synchronized (lock) {
      return consumer;
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /** Returns the ids of pending messages, head first. */
  public List<String> pendingIds() {
    synchronized (lock) {
      List<String> ids = new ArrayList<>(pending.size());
      for (QueueMessage message : pending) {
        ids.add(message.id());
      }
      return ids;
    }
  }

  public FlushScheduler.State flushState() {
    synchronized (lock) {
      return scheduler.state();
    }
  }

  /**
   * Sends one message from an in-process producer.
   *
   * @param body the message body
   * @throws PayloadTooLargeException if the encoded body exceeds the message size limit
   */
  public void send(MessageBody body) {
    byte[] raw = codec.encodeBody(body);
    IngressValidator.validateMessageSize(raw.length);
    enqueue(List.of(QueueMessage.create(timers.now(), body)));
  }

  /**
   * Sends several messages from an in-process producer. The batch is validated as a
   * whole and rejected atomically.
   *
   * @param bodies the message bodies, in order
   * @throws PayloadTooLargeException if a count or size limit is exceeded
   */
  public void sendBatch(List<? extends MessageBody> bodies) {
    long largest = 0;
    long total = 0;
    for (MessageBody body : bodies) {
      int size = codec.encodeBody(body).length;
      largest = Math.max(largest, size);
      total += size;
    }
    IngressValidator.validateBatch(bodies.size(), largest, total);
    long now = timers.now();
    List<QueueMessage> messages = new ArrayList<>(bodies.size());
    for (MessageBody body : bodies) {
      messages.add(QueueMessage.create(now, body));
    }
    enqueue(messages);
  }

  void enqueueOne(byte[] body, String contentType) {
    IngressValidator.validateMessageSize(body.length);
    ContentType type = IngressValidator.validateContentType(contentType);
    if (dropIfUnconsumed(1)) {
      return;
    }
    enqueue(List.of(QueueMessage.create(timers.now(), codec.decodeBody(type, body))));
  }

  void enqueueBatch(List<WireMessage> batch, boolean validateBatch) {
    List<byte[]> bodies = new ArrayList<>(batch.size());
    List<ContentType> types = new ArrayList<>(batch.size());
    long largest = 0;
    long total = 0;
    for (WireMessage wire : batch) {
      types.add(IngressValidator.validateContentType(wire.contentType()));
      byte[] raw = codec.rawBody(wire);
      bodies.add(raw);
      largest = Math.max(largest, raw.length);
      total += raw.length;
    }
    if (validateBatch) {
      IngressValidator.validateBatch(batch.size(), largest, total);
    }
    if (dropIfUnconsumed(batch.size())) {
      return;
    }
    long now = timers.now();
    List<QueueMessage> messages = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      WireMessage wire = batch.get(i);
      String id = wire.id() != null ? wire.id() : QueueMessage.newMessageId();
      long timestamp = wire.timestamp() != null ? wire.timestamp() : now;
      messages.add(new QueueMessage(id, timestamp, codec.decodeBody(types.get(i), bodies.get(i))));
    }
    enqueue(messages);
  }

  private boolean dropIfUnconsumed(int count) {
    if (consumer() != null) {
      return false;
    }
    logger.log(Level.FINE, "Queue \"{0}\" has no consumer; dropping {1} message(s)",
        new Object[]{name, count});
    metrics.incrementDroppedUnconsumed(name, count);
    return true;
  }

  private void enqueue(List<QueueMessage> messages) {
    if (messages.isEmpty()) {
      return;
    }
    synchronized (lock) {
      if (disposed) {
        throw new IllegalStateException("Queue \"" + name + "\" has been disposed");
      }
      if (consumer == null) {
        metrics.incrementDroppedUnconsumed(name, messages.size());
        return;
      }
      pending.addAll(messages);
      scheduler.ensurePendingFlush(pending.size(), consumer);
      metrics.incrementEnqueued(name, messages.size());
      metrics.recordPendingDepth(name, pending.size());
    }
  }

  void setConsumer(QueueConsumer consumer) {
    if (consumer != null && !name.equals(consumer.queueName())) {
      throw new IllegalArgumentException("Consumer for queue \"" + consumer.queueName()
          + "\" cannot be attached to queue \"" + name + "\"");
    }
    synchronized (lock) {
      this.consumer = consumer;
      if (consumer == null) {
        scheduler.cancel();
      }
    }
  }

  /** Cancels any pending flush without dispatching and rejects further messages. */
  void dispose() {
    synchronized (lock) {
      disposed = true;
      scheduler.cancel();
    }
  }

  private void onFlushTimer(FlushScheduler.PendingFlush flush) {
    synchronized (lock) {
      if (!scheduler.claim(flush)) {
        return;
      }
    }
    try {
      flush().whenComplete((ignored, error) -> {
        if (error != null) {
          reportFlushFailure(unwrap(error));
        }
      });
    } catch (Throwable t) {
      reportFlushFailure(t);
    }
  }

  private void reportFlushFailure(Throwable error) {
    logger.log(Level.SEVERE, "Flush cycle failed for queue \"" + name + "\"", error);
    metrics.incrementFlushFailure(name);
  }

  /**
   * Takes one batch from the head of the buffer, dispatches it and reconciles the
   * response.
   *
   * @return a future completing when the cycle, including any dead-letter forward,
   *     is done; it fails with {@link DeadLetterForwardException} if exhausted
   *     messages could not be moved
   */
  CompletableFuture<Void> flush() {
    QueueConsumer batchConsumer;
    List<QueueMessage> batch;
    synchronized (lock) {
      batchConsumer = consumer;
      if (batchConsumer == null || pending.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }
      int size = Math.min(batchConsumer.effectiveBatchSize(), pending.size());
      batch = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        batch.add(pending.pollFirst());
      }
      metrics.recordPendingDepth(name, pending.size());
    }

    long startTime = timers.now();
    CompletionStage<QueueResponse> call;
    try {
      call = Objects.requireNonNull(
          dispatcher.dispatch(name, batchConsumer.workerName(), codec.encodeAll(batch)),
          "dispatcher returned null");
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }

    return call
        .handle((response, error) -> {
          long elapsed = Math.max(0L, timers.now() - startTime);
          QueueResponse effective = response;
          if (error != null || response == null) {
            Throwable cause = error != null ? unwrap(error) : new IllegalStateException("consumer returned no response");
            logger.log(Level.SEVERE, "Consumer \"" + batchConsumer.workerName() + "\" of queue \""
                + name + "\" failed", cause);
            effective = QueueResponse.EXCEPTION_RESPONSE;
          }
          return reconcile(batchConsumer, batch, effective, elapsed);
        })
        .toCompletableFuture()
        .thenCompose(toDeadLetter -> forwardToDeadLetterQueue(batchConsumer, toDeadLetter));
  }

  private List<QueueMessage> reconcile(QueueConsumer batchConsumer, List<QueueMessage> batch,
      QueueResponse response, long elapsedMs) {
    if (!response.isOk()) {
      metrics.incrementDispatchFailure(name);
    }
    metrics.recordDispatchDurationMs(name, elapsedMs);

    Reconciliation result = BatchReconciler.reconcile(batchConsumer, batch, response);
    logger.log(Level.INFO, "QUEUE {0} {1,number,#}/{2,number,#} ({3,number,#}ms)",
        new Object[]{name, result.acked(), batch.size(), elapsedMs});
    metrics.incrementAcked(name, result.acked());
    metrics.incrementRetried(name, result.toRetry().size());
    metrics.incrementDiscarded(name, result.discarded());

    synchronized (lock) {
      pending.addAll(result.toRetry());
      if (!pending.isEmpty() && consumer != null && !disposed) {
        scheduler.ensurePendingFlush(pending.size(), consumer);
      }
      metrics.recordPendingDepth(name, pending.size());
    }
    return result.toDeadLetter();
  }

  private CompletableFuture<Void> forwardToDeadLetterQueue(QueueConsumer batchConsumer,
      List<QueueMessage> toDeadLetter) {
    if (toDeadLetter.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    String deadLetterQueue = batchConsumer.deadLetterQueue();
    try {
      broker.forwardToDeadLetterQueue(deadLetterQueue, codec.encodeAll(toDeadLetter));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(
          new DeadLetterForwardException(deadLetterQueue, toDeadLetter.size(), e));
    }
    metrics.incrementDeadLettered(name, toDeadLetter.size());
    return CompletableFuture.completedFuture(null);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  @Override
  public String toString() {
    return "WorkerQueue{name=" + name + '}';
  }
}
