package queues.wire;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Transport form of a message: {@code { id, timestamp, contentType, body }} with a
 * base64 body.
 *
 * <p>Producers may leave {@code id}, {@code timestamp} and {@code contentType}
 * unset; the broker fills in a generated id, the current time and
 * {@code "opaque"}. Dead-letter forwarding always sets all four.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireMessage(String id, Long timestamp, String contentType, String body) {
}
