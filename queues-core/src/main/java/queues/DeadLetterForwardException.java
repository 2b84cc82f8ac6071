package queues;

/**
 * Thrown when messages that exhausted their retries could not be moved to the
 * configured dead-letter queue.
 *
 * <p>Fails the flush cycle that produced the messages.
 */
public class DeadLetterForwardException extends RuntimeException {
  private final String deadLetterQueue;
  private final int messageCount;

  public DeadLetterForwardException(String deadLetterQueue, int messageCount, Throwable cause) {
    super("Failed to move " + messageCount + " message(s) to dead letter queue \""
        + deadLetterQueue + "\"", cause);
    this.deadLetterQueue = deadLetterQueue;
    this.messageCount = messageCount;
  }

  public String deadLetterQueue() {
    return deadLetterQueue;
  }

  public int messageCount() {
    return messageCount;
  }
}
