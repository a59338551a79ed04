package io.eventlog.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a live subscriber of the event bus.
 *
 * <p>The annotated bean must implement {@link io.eventlog.bus.BusListener}. The pattern is a
 * key expression over {@code events/{aggregateType}/{aggregateId}}.
 *
 * <pre>{@code
 * @Component
 * @EventSubscriber("events/Todo/**")
 * public class TodoCacheInvalidator implements BusListener {
 *   public void onEvent(StoredEvent event) { cache.evict(event.aggregateId()); }
 * }
 * }</pre>
 *
 * @see io.eventlog.bus.KeyExpression
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Key pattern, e.g. {@code events/Todo/**}.
     */
    String value();

    /**
     * Buffer capacity. {@code 0} uses {@code eventlog.bus.buffer-capacity}.
     */
    int capacity() default 0;
}
