package livefeed.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.session.InputReader;
import livefeed.session.SubscriptionHandler;
import livefeed.session.SubscriptionRouter;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link SubscriptionEndpoint} and registers them in the
 * {@link SubscriptionRouter}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the subscription server accepts connections.
 *
 * @see SubscriptionEndpoint
 */
public class SubscriptionEndpointRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final SubscriptionRouter router;
    private final ObjectMapper objectMapper;

    public SubscriptionEndpointRegistrar(ListableBeanFactory beanFactory, SubscriptionRouter router,
            ObjectMapper objectMapper) {
        this.beanFactory = beanFactory;
        this.router = router;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SubscriptionEndpoint.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof SubscriptionHandler<?> handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @SubscriptionEndpoint must implement SubscriptionHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            SubscriptionEndpoint annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), SubscriptionEndpoint.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @SubscriptionEndpoint annotation on " + bean.getClass().getName());
            }

            try {
                register(annotation.path(), annotation.input(), handler);
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName,
                        "Invalid @SubscriptionEndpoint on " + bean.getClass().getName(), e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <I> void register(String path, Class<I> inputType, SubscriptionHandler<?> handler) {
        router.register(path, InputReader.json(objectMapper, inputType), (SubscriptionHandler<I>) handler);
    }
}
