package queues.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * A message held in a queue's pending buffer.
 *
 * <p>Identity ({@code id}, {@code timestamp}) and body are immutable. The failed
 * attempt counter is owned by the buffer holding the message and is never sent
 * to consumers. Moving a message to another queue creates a new instance with
 * the same identity and a fresh counter.
 */
public final class QueueMessage {
  private final String id;
  private final long timestamp;
  private final MessageBody body;
  private int failedAttempts;

  public QueueMessage(String id, long timestamp, MessageBody body) {
    this.id = Objects.requireNonNull(id, "id");
    this.timestamp = timestamp;
    this.body = Objects.requireNonNull(body, "body");
  }

  /**
   * Creates a message with a freshly generated id.
   *
   * @param timestamp generation time in epoch milliseconds
   * @param body the decoded body
   * @return a new message
   */
  public static QueueMessage create(long timestamp, MessageBody body) {
    return new QueueMessage(newMessageId(), timestamp, body);
  }

  public String id() {
    return id;
  }

  public long timestamp() {
    return timestamp;
  }

  public MessageBody body() {
    return body;
  }

  public ContentType contentType() {
    return body.contentType();
  }

  public int failedAttempts() {
    return failedAttempts;
  }

  /**
   * Records one more failed delivery attempt.
   *
   * @return the updated number of failed attempts
   */
  public int incrementFailedAttempts() {
    return ++failedAttempts;
  }

  @Override
  public String toString() {
    return "QueueMessage{id=" + id + ", timestamp=" + timestamp
        + ", contentType=" + body.contentType().tag() + ", failedAttempts=" + failedAttempts + '}';
  }

  public static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
