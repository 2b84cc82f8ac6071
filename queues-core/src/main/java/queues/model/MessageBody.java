package queues.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded body of a queued message, tagged by its {@link ContentType}.
 *
 * <p>Byte-carrying variants copy their input on construction and on access.
 */
public sealed interface MessageBody
    permits MessageBody.Text, MessageBody.Json, MessageBody.Bytes, MessageBody.Opaque {

  ContentType contentType();

  static MessageBody text(String text) {
    return new Text(text);
  }

  static MessageBody json(JsonNode json) {
    return new Json(json);
  }

  static MessageBody bytes(byte[] bytes) {
    return new Bytes(bytes);
  }

  static MessageBody opaque(byte[] serialized) {
    return new Opaque(serialized);
  }

  /** UTF-8 text body. */
  record Text(String value) implements MessageBody {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ContentType contentType() {
      return ContentType.TEXT;
    }
  }

  /** Structured JSON body. */
  record Json(JsonNode value) implements MessageBody {
    public Json {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ContentType contentType() {
      return ContentType.JSON;
    }
  }

  /** Binary body. */
  final class Bytes implements MessageBody {
    private final byte[] value;

    private Bytes(byte[] value) {
      Objects.requireNonNull(value, "value");
      this.value = Arrays.copyOf(value, value.length);
    }

    public byte[] value() {
      return Arrays.copyOf(value, value.length);
    }

    @Override
    public ContentType contentType() {
      return ContentType.BYTES;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Bytes other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Bytes[length=" + value.length + "]";
    }
  }

  /**
   * Runtime-native serialized value. The broker never looks inside it.
   */
  final class Opaque implements MessageBody {
    private final byte[] serialized;

    private Opaque(byte[] serialized) {
      Objects.requireNonNull(serialized, "serialized");
      this.serialized = Arrays.copyOf(serialized, serialized.length);
    }

    public byte[] serialized() {
      return Arrays.copyOf(serialized, serialized.length);
    }

    @Override
    public ContentType contentType() {
      return ContentType.OPAQUE;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Opaque other && Arrays.equals(serialized, other.serialized);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(serialized);
    }

    @Override
    public String toString() {
      return "Opaque[length=" + serialized.length + "]";
    }
  }
}
