package com.ivamare.messagebus.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a message handler.
 *
 * <p>Methods annotated with @Handler are automatically discovered and registered
 * by the HandlerRegistry when it runs as a Spring bean post-processor. The
 * handled type is the method's single parameter, which must be a Command or an
 * Event subtype.
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class OrderHandlers {
 *
 *     {@literal @}Handler
 *     public void createOrder(CreateOrder command) {
 *         // Process command...
 *     }
 *
 *     {@literal @}Handler
 *     public void notifyWarehouse(OrderCreated event) {
 *         // React to event...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Handler {
}
