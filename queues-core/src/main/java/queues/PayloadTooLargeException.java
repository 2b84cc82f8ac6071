package queues;

/**
 * Ingress rejection for a message or batch exceeding a size or count limit.
 */
public class PayloadTooLargeException extends QueueIngressException {
  public static final int PAYLOAD_TOO_LARGE = 413;

  public PayloadTooLargeException(String message) {
    super(PAYLOAD_TOO_LARGE, message);
  }
}
