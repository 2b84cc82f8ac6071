package queues;

/**
 * Worker-side callback receiving batches from the queues it consumes.
 *
 * <p>Throwing from {@link #queue(MessageBatch)} fails the whole batch: every
 * message is retried regardless of the {@link Message#retry()} and
 * {@link Message#ack()} calls made before the throw.
 *
 * @see queues.registry.WorkerRegistry
 */
@FunctionalInterface
public interface QueueHandler {

  /**
   * Handles one batch.
   *
   * @param batch the delivered messages, oldest first
   * @throws Exception to fail the batch
   */
  void queue(MessageBatch batch) throws Exception;
}
