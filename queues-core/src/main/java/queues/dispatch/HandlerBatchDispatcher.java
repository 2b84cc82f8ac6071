package queues.dispatch;

import queues.MessageBatch;
import queues.QueueHandler;
import queues.model.QueueMessage;
import queues.registry.WorkerRegistry;
import queues.spi.BatchDispatcher;
import queues.wire.MessageCodec;
import queues.wire.WireMessage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link BatchDispatcher} that hands batches to {@link QueueHandler}s
 * looked up in a {@link WorkerRegistry}.
 *
 * <p>Wire messages are decoded into a {@link MessageBatch}; the handler's retry and
 * ack calls become the {@link QueueResponse}. A handler that throws produces
 * outcome {@value QueueResponse#EXCEPTION}. An unknown worker fails the dispatch
 * with {@link UnroutableBatchException}.
 *
 * <p>Handlers run on the calling (flush) thread unless an {@link Executor} is given.
 */
public final class HandlerBatchDispatcher implements BatchDispatcher {
  private static final Logger logger = Logger.getLogger(HandlerBatchDispatcher.class.getName());

  private final WorkerRegistry registry;
  private final MessageCodec codec;
  private final Executor executor;

  public HandlerBatchDispatcher(WorkerRegistry registry) {
    this(registry, MessageCodec.getDefault(), null);
  }

  /**
   * @param registry worker lookup
   * @param codec codec for decoding wire messages
   * @param executor executor running handlers, or {@code null} to run them on the caller's thread
   */
  public HandlerBatchDispatcher(WorkerRegistry registry, MessageCodec codec, Executor executor) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.executor = executor;
  }

  @Override
  public CompletionStage<QueueResponse> dispatch(String queueName, String workerName,
      List<WireMessage> messages) {
    QueueHandler handler = registry.handlerFor(workerName);
    if (handler == null) {
      return CompletableFuture.failedFuture(new UnroutableBatchException(
          "No worker named \"" + workerName + "\" for queue \"" + queueName + "\""));
    }
    if (executor == null) {
      return CompletableFuture.completedFuture(invoke(handler, queueName, workerName, messages));
    }
    return CompletableFuture.supplyAsync(() -> invoke(handler, queueName, workerName, messages), executor);
  }

  private QueueResponse invoke(QueueHandler handler, String queueName, String workerName,
      List<WireMessage> messages) {
    MessageBatch batch = new MessageBatch(queueName);
    for (WireMessage wire : messages) {
      QueueMessage message = codec.decode(wire, 0L);
      batch.add(message.id(), Instant.ofEpochMilli(message.timestamp()), message.body());
    }
    try {
      handler.queue(batch);
      return batch.toResponse();
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Worker \"" + workerName + "\" failed handling a batch from queue \""
          + queueName + "\"", e);
      return QueueResponse.EXCEPTION_RESPONSE;
    }
  }
}
