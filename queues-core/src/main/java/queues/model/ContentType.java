package queues.model;

import java.util.Locale;

/**
 * Content type tag carried with every queued message.
 *
 * <p>The tag decides how the wire body is decoded into a {@link MessageBody}.
 * Producers that do not specify a tag get {@link #OPAQUE}.
 */
public enum ContentType {
  /** UTF-8 text. */
  TEXT("text"),
  /** UTF-8 encoded JSON document. */
  JSON("json"),
  /** Raw bytes exposed as a binary buffer. */
  BYTES("bytes"),
  /** Runtime-native serialized value, passed through uninterpreted. */
  OPAQUE("opaque");

  public static final ContentType DEFAULT = OPAQUE;

  private final String tag;

  ContentType(String tag) {
    this.tag = tag;
  }

  /** Returns the lower-case wire tag, e.g. {@code "json"}. */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a wire tag. A {@code null} tag resolves to {@link #DEFAULT}.
   *
   * @param tag the wire tag, may be {@code null}
   * @return the matching content type
   * @throws IllegalArgumentException if the tag is not a known content type
   */
  public static ContentType fromTag(String tag) {
    if (tag == null) {
      return DEFAULT;
    }
    for (ContentType type : values()) {
      if (type.tag.equals(tag)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown content type: " + tag.toLowerCase(Locale.ROOT));
  }
}
