package com.myorg.saga.eventing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method of a {@code @Component} as the handler of one event type.
 *
 * <pre>
 * &#64;SagaEventHandler(value = FulfillmentEventTypes.ORDER_PLACED, payload = OrderPlacedEvent.class)
 * public void on(EventEnvelope env, OrderPlacedEvent e) { ... }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SagaEventHandler {
    // event type / routing key, e.g. "order.placed"
    String value();

    Class<?> payload();
}
