package livefeed.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.ApiErrorCode;
import livefeed.ApiException;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Validates a subscribe frame's raw {@code input} and converts it to the handler's input type.
 *
 * @param <I> validated input type
 */
@FunctionalInterface
public interface InputReader<I> {

  /**
   * @throws ApiException with {@link ApiErrorCode#BAD_INPUT} if the input is invalid
   */
  I read(JsonNode input);

  /**
   * Returns a reader that binds the input with Jackson. Missing or null input is rejected.
   */
  static <I> InputReader<I> json(ObjectMapper objectMapper, Class<I> type) {
    Objects.requireNonNull(objectMapper, "objectMapper");
    Objects.requireNonNull(type, "type");
    return input -> {
      if (input == null || input.isNull() || input.isMissingNode()) {
        throw new ApiException(ApiErrorCode.BAD_INPUT, "Missing input");
      }
      try {
        I value = objectMapper.treeToValue(input, type);
        if (value == null) {
          throw new ApiException(ApiErrorCode.BAD_INPUT, "Missing input");
        }
        return value;
      } catch (JsonProcessingException | IllegalArgumentException e) {
        throw new ApiException(ApiErrorCode.BAD_INPUT, "Invalid input for " + type.getSimpleName(), e);
      }
    };
  }

  /**
   * Returns a reader that additionally rejects values failing {@code check}.
   */
  default InputReader<I> validate(Predicate<? super I> check, String message) {
    Objects.requireNonNull(check, "check");
    return input -> {
      I value = read(input);
      if (!check.test(value)) {
        throw new ApiException(ApiErrorCode.BAD_INPUT, message);
      }
      return value;
    };
  }
}
