package queues;

import queues.dispatch.QueueResponse;
import queues.model.MessageBody;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A batch of messages delivered to a {@link QueueHandler}, and the retry and
 * acknowledgement decisions the handler makes about it.
 *
 * <p>Decisions are recorded, not acted on: the broker applies them once the
 * handler returns, through the {@link QueueResponse} built by {@link #toResponse()}.
 * Not thread-safe; a batch is handled by one thread.
 */
public final class MessageBatch {
  private final String queue;
  private final List<Message> messages = new ArrayList<>();
  private final Set<String> retries = new LinkedHashSet<>();
  private final Set<String> acks = new LinkedHashSet<>();
  private boolean retryAll;
  private boolean ackAll;

  /**
   * @param queue the queue the batch was taken from
   */
  public MessageBatch(String queue) {
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  /**
   * Appends a message to the batch.
   *
   * @return the appended message
   */
  public Message add(String id, Instant timestamp, MessageBody body) {
    Message message = new Message(this, id, timestamp, body);
    messages.add(message);
    return message;
  }

  public String queue() {
    return queue;
  }

  public List<Message> messages() {
    return Collections.unmodifiableList(messages);
  }

  /** Marks every message of the batch for redelivery. */
  public void retryAll() {
    retryAll = true;
    ackAll = false;
  }

  /** Acknowledges every message of the batch, cancelling an earlier {@link #retryAll()}. */
  public void ackAll() {
    ackAll = true;
    retryAll = false;
  }

  void markRetry(String id) {
    acks.remove(id);
    retries.add(id);
  }

  void markAck(String id) {
    retries.remove(id);
    acks.add(id);
  }

  /**
   * Builds the successful response reflecting the decisions made so far.
   *
   * @return a response with outcome {@value QueueResponse#OK}
   */
  public QueueResponse toResponse() {
    return new QueueResponse(QueueResponse.OK, retryAll, ackAll,
        new ArrayList<>(retries), new ArrayList<>(acks));
  }
}
