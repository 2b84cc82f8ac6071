package queues.spi;

import queues.dispatch.QueueResponse;
import queues.wire.WireMessage;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Delivers a batch to the worker consuming a queue.
 *
 * <p>The broker does not care how the batch travels (in-process call, RPC, HTTP),
 * only about the returned {@link QueueResponse}. A synchronous throw and an
 * exceptionally completed stage are both treated as outcome {@code "exception"}.
 *
 * @see queues.dispatch.HandlerBatchDispatcher
 */
@FunctionalInterface
public interface BatchDispatcher {

  /**
   * @param queueName the queue the batch was taken from
   * @param workerName the worker configured as the queue's consumer
   * @param messages the batch, oldest first
   * @return the consumer's response
   */
  CompletionStage<QueueResponse> dispatch(String queueName, String workerName, List<WireMessage> messages);
}
