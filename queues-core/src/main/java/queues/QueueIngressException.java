package queues;

/**
 * Thrown when a producer's message or batch is rejected at ingress.
 *
 * <p>Carries an HTTP-like status code so transports can map the rejection onto
 * a response without inspecting the message. Rejected input is never buffered
 * and never retried.
 */
public class QueueIngressException extends RuntimeException {
  public static final int BAD_REQUEST = 400;

  private final int status;

  public QueueIngressException(int status, String message) {
    super(message);
    this.status = status;
  }

  public QueueIngressException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int status() {
    return status;
  }
}
