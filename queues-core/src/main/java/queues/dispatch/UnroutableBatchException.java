package queues.dispatch;

/**
 * Thrown when a batch names a worker that has no registered handler.
 *
 * <p>The broker treats it like any other consumer failure: the batch is retried.
 */
public class UnroutableBatchException extends RuntimeException {
  public UnroutableBatchException(String message) {
    super(message);
  }
}
