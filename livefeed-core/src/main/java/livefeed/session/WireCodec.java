package livefeed.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import livefeed.ApiErrorCode;
import livefeed.ApiException;

import java.util.Objects;

/**
 * Jackson-based codec for the subscription wire protocol.
 *
 * <p>Client frames:
 * <pre>
 * {"type":"subscribe","id":"a1","path":"/comment/watchPostComments","input":{"postID":42}}
 * {"type":"unsubscribe","id":"a1"}
 * </pre>
 *
 * <p>Server frames:
 * <pre>
 * {"type":"subscribed","id":"a1"}
 * {"type":"message","id":"a1","message":{...}}
 * {"type":"error","id":"a1","error":{"code":"NOT_FOUND","serverStack":"..."}}
 * </pre>
 */
public final class WireCodec {
  private final ObjectMapper objectMapper;
  private final ObjectReader frameReader;

  public WireCodec() {
    this(new ObjectMapper());
  }

  public WireCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.frameReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  /**
   * Decodes one client frame.
   *
   * @throws ApiException with {@link ApiErrorCode#BAD_INPUT} for anything other than a JSON
   *     object matching one of the two client shapes
   */
  public ClientMessage decode(String text) {
    JsonNode root;
    try {
      root = frameReader.readTree(text);
    } catch (JsonProcessingException e) {
      throw new ApiException(ApiErrorCode.BAD_INPUT, "Malformed JSON frame", e);
    }
    if (root == null || !root.isObject()) {
      throw new ApiException(ApiErrorCode.BAD_INPUT, "Frame must be a JSON object");
    }
    String type = requiredText(root, "type");
    switch (type) {
      case "subscribe":
        JsonNode input = root.get("input");
        return new ClientMessage.Subscribe(
            requiredText(root, "id"),
            requiredText(root, "path"),
            input == null ? NullNode.getInstance() : input);
      case "unsubscribe":
        return new ClientMessage.Unsubscribe(requiredText(root, "id"));
      default:
        throw new ApiException(ApiErrorCode.BAD_INPUT, "Unknown frame type: " + type);
    }
  }

  public String subscribed(String id) {
    ObjectNode frame = objectMapper.createObjectNode();
    frame.put("type", "subscribed");
    frame.put("id", id);
    return write(frame);
  }

  /**
   * @throws IllegalArgumentException if {@code message} cannot be serialized
   */
  public String message(String id, Object message) {
    ObjectNode frame = objectMapper.createObjectNode();
    frame.put("type", "message");
    frame.put("id", id);
    frame.set("message", objectMapper.valueToTree(message));
    return write(frame);
  }

  /**
   * @param id subscription id the error refers to, or {@code null}
   * @param serverStack stack trace text, or {@code null} to omit it
   */
  public String error(String id, ApiErrorCode code, String serverStack) {
    ObjectNode frame = objectMapper.createObjectNode();
    frame.put("type", "error");
    if (id != null) {
      frame.put("id", id);
    }
    ObjectNode error = frame.putObject("error");
    error.put("code", code.name());
    if (serverStack != null) {
      error.put("serverStack", serverStack);
    }
    return write(frame);
  }

  private String write(ObjectNode frame) {
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to encode frame", e);
    }
  }

  private static String requiredText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.isTextual() || node.asText().isEmpty()) {
      throw new ApiException(ApiErrorCode.BAD_INPUT, "Missing or empty '" + field + "'");
    }
    return node.asText();
  }
}
