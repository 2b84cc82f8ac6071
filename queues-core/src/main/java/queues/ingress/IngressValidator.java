package queues.ingress;

import queues.PayloadTooLargeException;
import queues.QueueIngressException;
import queues.model.ContentType;

/**
 * Synchronous, side-effect free limit checks applied before anything is buffered.
 *
 * <p>Sizes are the sizes declared by the producer. Batch limits apply to external
 * producer batches only; dead-letter forwarding skips them.
 */
public final class IngressValidator {
  public static final int MAX_MESSAGE_SIZE_BYTES = 128 * 1000;
  public static final int MAX_MESSAGE_BATCH_COUNT = 100;
  public static final int MAX_MESSAGE_BATCH_SIZE_BYTES = (256 + 32) * 1000;

  private IngressValidator() {
  }

  /**
   * @param declaredBytes declared size of a single message body
   * @throws PayloadTooLargeException if the size exceeds {@value #MAX_MESSAGE_SIZE_BYTES}
   */
  public static void validateMessageSize(long declaredBytes) {
    if (declaredBytes > MAX_MESSAGE_SIZE_BYTES) {
      throw new PayloadTooLargeException("message length of " + declaredBytes
          + " bytes exceeds limit of " + MAX_MESSAGE_SIZE_BYTES);
    }
  }

  /**
   * Resolves a declared content type tag, defaulting to {@link ContentType#DEFAULT}.
   *
   * @param tag the declared tag, may be {@code null}
   * @return the resolved content type
   * @throws QueueIngressException with status 400 if the tag is not recognised
   */
  public static ContentType validateContentType(String tag) {
    try {
      return ContentType.fromTag(tag);
    } catch (IllegalArgumentException e) {
      throw new QueueIngressException(QueueIngressException.BAD_REQUEST,
          "message content type " + tag + " is invalid; if specified, must be one of "
              + "'text', 'json', 'bytes', or 'opaque'", e);
    }
  }

  /**
   * Checks a producer batch against the count and size limits.
   *
   * @param count number of messages in the batch
   * @param largestBytes declared size of the largest message
   * @param totalBytes declared size of all messages together
   * @throws PayloadTooLargeException if any limit is exceeded
   */
  public static void validateBatch(int count, long largestBytes, long totalBytes) {
    if (count > MAX_MESSAGE_BATCH_COUNT) {
      throw new PayloadTooLargeException("batch message count of " + count
          + " exceeds limit of " + MAX_MESSAGE_BATCH_COUNT);
    }
    if (largestBytes > MAX_MESSAGE_SIZE_BYTES) {
      throw new PayloadTooLargeException("message in batch has length " + largestBytes
          + " bytes which exceeds single message size limit of " + MAX_MESSAGE_SIZE_BYTES);
    }
    if (totalBytes > MAX_MESSAGE_BATCH_SIZE_BYTES) {
      throw new PayloadTooLargeException("batch size of " + totalBytes
          + " bytes exceeds limit of " + MAX_MESSAGE_BATCH_SIZE_BYTES);
    }
  }
}
