package queues.dispatch;

import queues.QueueConsumer;
import queues.model.QueueMessage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a consumer's {@link QueueResponse} to the batch it answered.
 *
 * <p>A message fails its attempt when the whole batch is retried (explicitly or
 * because the outcome was not {@value QueueResponse#OK}) or when its id is listed
 * in {@code explicitRetries}. Each failure increments the message's counter;
 * messages still under {@link QueueConsumer#maxAttempts()} are retried, the rest go
 * to the dead-letter queue if one is configured and are dropped otherwise. All
 * other messages are acknowledged.
 */
public final class BatchReconciler {
  private static final Logger logger = Logger.getLogger(BatchReconciler.class.getName());

  private BatchReconciler() {
  }

  /**
   * @param consumer the consumer configuration the batch was dispatched with
   * @param batch the dispatched messages, oldest first
   * @param response the consumer's response
   * @return the per-message outcomes, each list in batch order
   */
  public static Reconciliation reconcile(QueueConsumer consumer, List<QueueMessage> batch,
      QueueResponse response) {
    String queueName = consumer.queueName();
    int maxAttempts = consumer.maxAttempts();
    String attempts = maxAttempts + " failed attempt" + (maxAttempts == 1 ? "" : "s");
    boolean retryAll = response.shouldRetryAll();
    Set<String> explicitRetries = new HashSet<>(response.explicitRetries());

    List<QueueMessage> toRetry = new ArrayList<>();
    List<QueueMessage> toDeadLetter = new ArrayList<>();
    int failed = 0;
    for (QueueMessage message : batch) {
      if (!retryAll && !explicitRetries.contains(message.id())) {
        continue;
      }
      failed++;
      int failedAttempts = message.incrementFailedAttempts();
      if (failedAttempts < maxAttempts) {
        logger.log(Level.FINE, "Retrying message \"{0}\" on queue \"{1}\"...",
            new Object[]{message.id(), queueName});
        toRetry.add(message);
      } else if (consumer.deadLetterQueue() != null) {
        logger.log(Level.WARNING, "Moving message \"{0}\" on queue \"{1}\" to dead letter queue \"{2}\" after {3}...",
            new Object[]{message.id(), queueName, consumer.deadLetterQueue(), attempts});
        toDeadLetter.add(message);
      } else {
        logger.log(Level.WARNING, "Dropped message \"{0}\" on queue \"{1}\" after {2}!",
            new Object[]{message.id(), queueName, attempts});
      }
    }
    int discarded = failed - toRetry.size() - toDeadLetter.size();
    return new Reconciliation(batch.size() - failed, toRetry, toDeadLetter, discarded);
  }

  /**
   * Result of reconciling one batch.
   *
   * @param acked         number of acknowledged messages
   * @param toRetry       messages to append to the queue again
   * @param toDeadLetter  messages to move to the dead-letter queue
   * @param discarded     number of messages dropped after their last attempt
   */
  public record Reconciliation(int acked, List<QueueMessage> toRetry, List<QueueMessage> toDeadLetter,
      int discarded) {
    public Reconciliation {
      toRetry = List.copyOf(toRetry);
      toDeadLetter = List.copyOf(toDeadLetter);
    }

    public int failed() {
      return toRetry.size() + toDeadLetter.size() + discarded;
    }
  }
}
