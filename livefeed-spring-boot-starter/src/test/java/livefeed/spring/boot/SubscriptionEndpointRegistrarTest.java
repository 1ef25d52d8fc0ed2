package livefeed.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.context.SubscriptionContext;
import livefeed.session.SubscriptionHandler;
import livefeed.session.SubscriptionRouter;
import livefeed.session.Unsubscribe;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionEndpointRegistrarTest {

    record WatchPost(long postID) {}

    @SubscriptionEndpoint(path = "/post/watch", input = WatchPost.class)
    static class WatchPostEndpoint implements SubscriptionHandler<WatchPost> {
        @Override
        public Unsubscribe subscribe(SubscriptionContext<Object> ctx, WatchPost input) {
            return Unsubscribe.NOOP;
        }
    }

    @SubscriptionEndpoint(path = "/post/watch")
    static class DuplicateEndpoint implements SubscriptionHandler<Object> {
        @Override
        public Unsubscribe subscribe(SubscriptionContext<Object> ctx, Object input) {
            return Unsubscribe.NOOP;
        }
    }

    @SubscriptionEndpoint(path = "/not/a/handler")
    static class NotAHandler {
    }

    @SubscriptionEndpoint(path = "relative")
    static class RelativePathEndpoint implements SubscriptionHandler<Object> {
        @Override
        public Unsubscribe subscribe(SubscriptionContext<Object> ctx, Object input) {
            return Unsubscribe.NOOP;
        }
    }

    private SubscriptionRouter registerAll(Class<?>... beanClasses) {
        SubscriptionRouter router = new SubscriptionRouter();
        try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext()) {
            for (Class<?> beanClass : beanClasses) {
                ctx.registerBean(beanClass);
            }
            ctx.refresh();
            new SubscriptionEndpointRegistrar(ctx, router, new ObjectMapper()).afterSingletonsInstantiated();
        }
        return router;
    }

    @Test
    void registersTypedEndpoint() {
        SubscriptionRouter router = registerAll(WatchPostEndpoint.class);
        assertTrue(router.route("/post/watch").isPresent());
        assertEquals(1, router.paths().size());
    }

    @Test
    void rejectsBeanThatIsNotAHandler() {
        BeanCreationException e = assertThrows(BeanCreationException.class,
                () -> registerAll(NotAHandler.class));
        assertTrue(e.getMessage().contains("must implement SubscriptionHandler"));
    }

    @Test
    void rejectsDuplicatePath() {
        BeanCreationException e = assertThrows(BeanCreationException.class,
                () -> registerAll(WatchPostEndpoint.class, DuplicateEndpoint.class));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void rejectsRelativePath() {
        assertThrows(BeanCreationException.class, () -> registerAll(RelativePathEndpoint.class));
    }
}
