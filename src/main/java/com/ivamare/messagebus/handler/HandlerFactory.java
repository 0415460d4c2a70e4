package com.ivamare.messagebus.handler;

import com.ivamare.messagebus.model.Message;

/**
 * Builds a handler from an explicit dependency object at registration time.
 *
 * <p>Example:
 * <pre>
 * record OrderDependencies(Repository&lt;Order, UUID&gt; orders, MessageBroker broker) {}
 *
 * HandlerFactory&lt;OrderDependencies, CreateOrder&gt; createOrder =
 *     deps -&gt; command -&gt; deps.orders().add(Order.create(command));
 *
 * registry.register(CreateOrder.class, createOrder, dependencies);
 * </pre>
 *
 * @param <D> The dependency type
 * @param <M> The message type handled
 */
@FunctionalInterface
public interface HandlerFactory<D, M extends Message> {

    MessageHandler<M> create(D dependencies);
}
