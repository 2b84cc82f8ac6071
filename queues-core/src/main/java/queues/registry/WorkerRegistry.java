package queues.registry;

import queues.QueueHandler;

/**
 * Registry for looking up the handler of a named worker.
 *
 * <p>A queue's consumer names the worker receiving its batches; the
 * {@link queues.dispatch.HandlerBatchDispatcher} resolves that name here.
 *
 * @see DefaultWorkerRegistry
 */
public interface WorkerRegistry {

  /**
   * Returns the handler registered for the given worker.
   *
   * @param workerName the worker name
   * @return the handler, or {@code null} if no worker has that name
   */
  QueueHandler handlerFor(String workerName);
}
