package queues.wire;

import java.util.List;
import java.util.Objects;

/**
 * JSON document carrying a batch of messages: {@code {"messages": [...]}}.
 */
public record BatchRequest(List<WireMessage> messages) {
  public BatchRequest {
    messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
  }
}
