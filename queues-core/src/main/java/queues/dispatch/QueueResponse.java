package queues.dispatch;

import java.util.List;
import java.util.Objects;

/**
 * A consumer's answer for one batch.
 *
 * <p>Any {@code outcome} other than {@value #OK} is a failure of the whole batch.
 * {@code explicitAcks} and {@code ackAll} are reported for completeness; messages
 * not marked for retry are acknowledged either way.
 *
 * @param outcome          {@value #OK}, {@value #EXCEPTION} or another failure outcome
 * @param retryAll         whether every message of the batch should be retried
 * @param ackAll           whether the consumer acknowledged the whole batch
 * @param explicitRetries  ids of messages the consumer asked to retry
 * @param explicitAcks     ids of messages the consumer acknowledged
 */
public record QueueResponse(
    String outcome,
    boolean retryAll,
    boolean ackAll,
    List<String> explicitRetries,
    List<String> explicitAcks) {

  public static final String OK = "ok";
  public static final String EXCEPTION = "exception";

  /** Response used when the dispatch call itself failed. */
  public static final QueueResponse EXCEPTION_RESPONSE =
      new QueueResponse(EXCEPTION, false, false, List.of(), List.of());

  public QueueResponse {
    Objects.requireNonNull(outcome, "outcome");
    explicitRetries = List.copyOf(Objects.requireNonNull(explicitRetries, "explicitRetries"));
    explicitAcks = List.copyOf(Objects.requireNonNull(explicitAcks, "explicitAcks"));
  }

  /** A successful response acknowledging every message. */
  public static QueueResponse ok() {
    return new QueueResponse(OK, false, true, List.of(), List.of());
  }

  /** A successful response asking for every message to be retried. */
  public static QueueResponse retryAllMessages() {
    return new QueueResponse(OK, true, false, List.of(), List.of());
  }

  /** A successful response asking for the given messages to be retried. */
  public static QueueResponse retry(List<String> messageIds) {
    return new QueueResponse(OK, false, false, messageIds, List.of());
  }

  public boolean isOk() {
    return OK.equals(outcome);
  }

  /**
   * Whether every message of the batch counts as failed, either because the
   * consumer asked for it or because the batch did not complete successfully.
   */
  public boolean shouldRetryAll() {
    return retryAll || !isOk();
  }
}
