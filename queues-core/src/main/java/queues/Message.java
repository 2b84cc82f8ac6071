package queues;

import queues.model.MessageBody;

import java.time.Instant;
import java.util.Objects;

/**
 * A message as seen by a {@link QueueHandler}.
 *
 * <p>Calling {@link #retry()} marks the message for redelivery; {@link #ack()}
 * acknowledges it. The last call wins. Messages that are neither retried nor
 * acknowledged are acknowledged when the handler returns normally.
 */
public final class Message {
  private final MessageBatch batch;
  private final String id;
  private final Instant timestamp;
  private final MessageBody body;

  Message(MessageBatch batch, String id, Instant timestamp, MessageBody body) {
    this.batch = batch;
    this.id = Objects.requireNonNull(id, "id");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.body = Objects.requireNonNull(body, "body");
  }

  public String id() {
    return id;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public MessageBody body() {
    return body;
  }

  /** Marks this message for redelivery. */
  public void retry() {
    batch.markRetry(id);
  }

  /** Acknowledges this message, cancelling an earlier {@link #retry()}. */
  public void ack() {
    batch.markAck(id);
  }

  @Override
  public String toString() {
    return "Message{id=" + id + ", timestamp=" + timestamp + ", contentType=" + body.contentType().tag() + '}';
  }
}
