package livefeed.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A decoded client frame.
 */
public sealed interface ClientMessage permits ClientMessage.Subscribe, ClientMessage.Unsubscribe {

  String id();

  /**
   * {@code {"type":"subscribe","id":...,"path":...,"input":...}}
   *
   * @param input raw input; {@code NullNode} when absent
   */
  record Subscribe(String id, String path, JsonNode input) implements ClientMessage {
    public Subscribe {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(input, "input");
    }
  }

  /** {@code {"type":"unsubscribe","id":...}} */
  record Unsubscribe(String id) implements ClientMessage {
    public Unsubscribe {
      Objects.requireNonNull(id, "id");
    }
  }
}
