package com.ivamare.messagebus.handler;

import com.ivamare.messagebus.model.Command;
import com.ivamare.messagebus.model.Event;
import com.ivamare.messagebus.model.Message;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for command and event handlers.
 *
 * <p>A command type maps to at most one handler; registering another replaces
 * it. An event type maps to an ordered list of handlers that grows with every
 * registration. Lookups use the exact message class.
 */
public interface HandlerRegistry {

    /**
     * Register a handler. Replaces the handler of a command type, appends to the
     * handlers of an event type.
     *
     * @param messageType A Command or Event subtype
     * @param handler The handler
     * @throws com.ivamare.messagebus.exception.InvalidMessageTypeException if the
     *         type is neither a Command nor an Event
     */
    <M extends Message> void register(Class<M> messageType, MessageHandler<? super M> handler);

    /**
     * Register a handler built from a dependency object.
     *
     * @param messageType A Command or Event subtype
     * @param factory Builds the handler
     * @param dependencies Passed to the factory
     */
    default <D, M extends Message> void register(
            Class<M> messageType, HandlerFactory<? super D, M> factory, D dependencies) {
        register(messageType, factory.create(dependencies));
    }

    /**
     * Get the handler for a command type.
     *
     * @param commandType The exact command class
     * @return Optional containing the handler if found
     */
    Optional<MessageHandler<Message>> getCommandHandler(Class<? extends Command> commandType);

    /**
     * Get the handler for a command type, throwing if not found.
     *
     * @param commandType The exact command class
     * @return The handler
     * @throws com.ivamare.messagebus.exception.HandlerNotFoundException if not found
     */
    MessageHandler<Message> getCommandHandlerOrThrow(Class<? extends Command> commandType);

    /**
     * Get the handlers for an event type, in registration order.
     *
     * @param eventType The exact event class
     * @return The handlers, empty when none are registered
     */
    List<MessageHandler<Message>> getEventHandlers(Class<? extends Event> eventType);

    /**
     * Check if at least one handler is registered for a type.
     */
    boolean hasHandler(Class<? extends Message> messageType);

    /**
     * @return A snapshot of the command table
     */
    Map<Class<? extends Command>, MessageHandler<Message>> commandHandlers();

    /**
     * @return A snapshot of the event table
     */
    Map<Class<? extends Event>, List<MessageHandler<Message>>> eventHandlers();

    /**
     * Copy every handler of another registry into this one, with the usual
     * replace/append rules.
     *
     * @param other The registry to merge
     */
    void merge(HandlerRegistry other);

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @Handler annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return The message types registered
     */
    List<Class<? extends Message>> registerBean(Object bean);
}
