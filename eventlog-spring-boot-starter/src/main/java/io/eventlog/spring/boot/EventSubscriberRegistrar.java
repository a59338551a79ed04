package io.eventlog.spring.boot;

import io.eventlog.bus.BusListener;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.KeyExpression;
import io.eventlog.bus.SubscriptionOptions;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link EventSubscriber} and subscribes them to the
 * {@link EventBus}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Subscriptions end when the bus is closed.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final EventBus eventBus;
    private final SubscriptionOptions defaults;

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, EventBus eventBus,
            SubscriptionOptions defaults) {
        this.beanFactory = beanFactory;
        this.eventBus = eventBus;
        this.defaults = defaults;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof BusListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement BusListener, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            // Proxy may hide annotation; search the class hierarchy
            EventSubscriber annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscriber.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + bean.getClass().getName());
            }

            KeyExpression pattern;
            try {
                pattern = KeyExpression.parse(annotation.value());
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName,
                        "Invalid @EventSubscriber pattern: " + annotation.value(), e);
            }
            eventBus.subscribe(pattern, optionsFor(annotation), listener);
        }
    }

    private SubscriptionOptions optionsFor(EventSubscriber annotation) {
        if (annotation.capacity() <= 0) {
            return defaults;
        }
        return new SubscriptionOptions(annotation.capacity(), defaults.overflow(), defaults.blockTimeout());
    }
}
