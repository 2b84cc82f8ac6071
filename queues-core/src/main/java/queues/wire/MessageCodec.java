package queues.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import queues.QueueIngressException;
import queues.ingress.IngressValidator;
import queues.model.ContentType;
import queues.model.MessageBody;
import queues.model.QueueMessage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Converts messages between their buffered form and the {@link WireMessage}
 * transport form.
 *
 * <p>Decoding by content type:
 * <ul>
 *   <li>{@code text}: UTF-8 string</li>
 *   <li>{@code json}: UTF-8, then parsed into a {@link JsonNode}</li>
 *   <li>{@code bytes}: raw bytes</li>
 *   <li>{@code opaque}: raw bytes, never interpreted</li>
 * </ul>
 * Malformed input (bad base64, unparseable JSON) is the caller's error and is
 * reported as a {@link QueueIngressException} with status 400.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class MessageCodec {
  private static final MessageCodec DEFAULT = new MessageCodec(new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));

  private final ObjectMapper mapper;

  public MessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static MessageCodec getDefault() {
    return DEFAULT;
  }

  /**
   * Decodes raw body bytes according to the content type.
   *
   * @param contentType the content type tag
   * @param raw the raw body bytes
   * @return the decoded body
   * @throws QueueIngressException if a JSON body cannot be parsed
   */
  public MessageBody decodeBody(ContentType contentType, byte[] raw) {
    Objects.requireNonNull(contentType, "contentType");
    Objects.requireNonNull(raw, "raw");
    return switch (contentType) {
      case TEXT -> MessageBody.text(new String(raw, StandardCharsets.UTF_8));
      case JSON -> MessageBody.json(parseJson(raw));
      case BYTES -> MessageBody.bytes(raw);
      case OPAQUE -> MessageBody.opaque(raw);
    };
  }

  /**
   * Encodes a body into raw bytes. Inverse of {@link #decodeBody}.
   */
  public byte[] encodeBody(MessageBody body) {
    Objects.requireNonNull(body, "body");
    if (body instanceof MessageBody.Text text) {
      return text.value().getBytes(StandardCharsets.UTF_8);
    }
    if (body instanceof MessageBody.Json json) {
      try {
        return mapper.writeValueAsBytes(json.value());
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Failed to serialize JSON body", e);
      }
    }
    if (body instanceof MessageBody.Bytes bytes) {
      return bytes.value();
    }
    return ((MessageBody.Opaque) body).serialized();
  }

  /**
   * Converts a Java value into a JSON body.
   *
   * @param value any value Jackson can map to a tree
   * @return a JSON body
   */
  public MessageBody.Json toJsonBody(Object value) {
    JsonNode node = value instanceof JsonNode jsonNode ? jsonNode : mapper.valueToTree(value);
    return new MessageBody.Json(node);
  }

  /**
   * Returns the raw body bytes of a wire message.
   *
   * @throws QueueIngressException if the body is missing or not valid base64
   */
  public byte[] rawBody(WireMessage wire) {
    if (wire.body() == null) {
      throw new QueueIngressException(QueueIngressException.BAD_REQUEST, "message body is required");
    }
    try {
      return Base64.getDecoder().decode(wire.body());
    } catch (IllegalArgumentException e) {
      throw new QueueIngressException(QueueIngressException.BAD_REQUEST,
          "message body is not valid base64", e);
    }
  }

  /**
   * Decodes a wire message into a buffered message, generating the id and using
   * {@code now} as the timestamp when the wire message does not carry them.
   */
  public QueueMessage decode(WireMessage wire, long now) {
    ContentType contentType = IngressValidator.validateContentType(wire.contentType());
    MessageBody body = decodeBody(contentType, rawBody(wire));
    String id = wire.id() != null ? wire.id() : QueueMessage.newMessageId();
    long timestamp = wire.timestamp() != null ? wire.timestamp() : now;
    return new QueueMessage(id, timestamp, body);
  }

  /**
   * Encodes a buffered message for transport. The failed attempt counter is not
   * part of the wire form.
   */
  public WireMessage encode(QueueMessage message) {
    String body = Base64.getEncoder().encodeToString(encodeBody(message.body()));
    return new WireMessage(message.id(), message.timestamp(), message.contentType().tag(), body);
  }

  public List<WireMessage> encodeAll(List<QueueMessage> messages) {
    List<WireMessage> result = new ArrayList<>(messages.size());
    for (QueueMessage message : messages) {
      result.add(encode(message));
    }
    return result;
  }

  /**
   * Parses a {@code {"messages": [...]}} batch document.
   *
   * @throws QueueIngressException if the document is malformed
   */
  public List<WireMessage> readBatchRequest(byte[] json) {
    try {
      BatchRequest request = mapper.readValue(json, BatchRequest.class);
      if (request == null) {
        throw new QueueIngressException(QueueIngressException.BAD_REQUEST, "batch request is empty");
      }
      return request.messages();
    } catch (IOException e) {
      throw new QueueIngressException(QueueIngressException.BAD_REQUEST,
          "batch request is malformed", e);
    }
  }

  public byte[] writeBatchRequest(List<WireMessage> messages) {
    try {
      return mapper.writeValueAsBytes(new BatchRequest(messages));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize batch request", e);
    }
  }

  private JsonNode parseJson(byte[] raw) {
    try {
      JsonNode node = mapper.readTree(raw);
      if (node == null || node.isMissingNode()) {
        throw new QueueIngressException(QueueIngressException.BAD_REQUEST, "JSON message body is empty");
      }
      return node;
    } catch (IOException e) {
      throw new QueueIngressException(QueueIngressException.BAD_REQUEST,
          "JSON message body could not be parsed", e);
    }
  }
}
