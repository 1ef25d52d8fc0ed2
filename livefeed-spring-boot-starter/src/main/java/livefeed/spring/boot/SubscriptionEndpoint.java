package livefeed.spring.boot;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of one subscription path.
 *
 * <p>The annotated bean must implement {@link livefeed.session.SubscriptionHandler}; its
 * input type is read from the subscribe frame's {@code input} with the application's
 * {@code ObjectMapper}.
 *
 * <pre>{@code
 * @Component
 * @SubscriptionEndpoint(path = "/comment/watchPostComments", input = WatchPostComments.class)
 * public class WatchPostCommentsHandler implements SubscriptionHandler<WatchPostComments> {
 *   public Unsubscribe subscribe(SubscriptionContext<Object> ctx, WatchPostComments input) { ... }
 * }
 * }</pre>
 *
 * @see SubscriptionEndpointRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SubscriptionEndpoint {

    /**
     * Subscription path, starting with {@code /}.
     */
    String path();

    /**
     * Input type. Defaults to the raw JSON tree.
     */
    Class<?> input() default JsonNode.class;
}
