package com.intteq.fluent.broker.annotation;

import java.lang.annotation.*;

/**
 * Declares default routing metadata on a message class.
 *
 * <p>When a subscription or publication builder is given a data type, unset identity fields are
 * filled from this annotation before falling back to the class name:
 *
 * <pre>
 * {@code
 * @MessagingRoute(topic = "greeting.created", channel = "greetings")
 * public record GreetingEvent(String text) { }
 *
 * rabbit.useSubscriptions(subs -> subs
 *         .addSubscription(sub -> sub.setDataType(GreetingEvent.class)));
 * // subscription = GreetingEvent's class name, channel = "greetings", routingKey = "greeting.created"
 * }
 * </pre>
 *
 * <p>Empty attributes are treated as unset.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessagingRoute {

    /**
     * Routing key (topic) the message is published to and subscribed from.
     */
    String topic() default "";

    /**
     * Channel (queue, Service Bus subscription, Redis list, table queue) consumers read from.
     */
    String channel() default "";

    /**
     * Subscription name. Defaults to the fully-qualified class name when empty.
     */
    String subscription() default "";

    /**
     * Optional human-readable description for documentation tools.
     */
    String description() default "";
}
