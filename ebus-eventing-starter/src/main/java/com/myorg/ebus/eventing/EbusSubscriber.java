package com.myorg.ebus.eventing;

import java.lang.annotation.*;

/**
 * Marks an {@link EventHandler} or {@link BatchEventHandler} bean as a subscriber.
 * The registry is filled from these at startup.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EbusSubscriber {
    // routing key bound to the queue; empty -> payload class name
    String eventType() default "";
    // queue name; empty -> handler class name
    String queue() default "";
    Class<?> payload();
    // batch handlers only: max deliveries pulled per iteration
    int batchSize() default 50;
}
