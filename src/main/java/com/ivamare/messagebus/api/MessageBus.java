package com.ivamare.messagebus.api;

import com.ivamare.messagebus.handler.MessageHandler;
import com.ivamare.messagebus.model.Message;
import com.ivamare.messagebus.model.MessageQueue;
import com.ivamare.messagebus.uow.UnitOfWork;

/**
 * Synchronous command/event bus.
 *
 * <p>Commands are matched to a single handler and their failures reach the
 * caller. Events are broadcast to every subscribed handler and their failures
 * are logged and swallowed. Events recorded while a message is handled are
 * collected from the unit of work and handled before {@link #handle} returns.
 *
 * <p>A bus has one thread of control: {@link #handle} must not be called from
 * a handler that the same bus is dispatching, and concurrent callers need their
 * own mutual exclusion.
 */
public interface MessageBus {

    /**
     * Handle a message and every message it leads to.
     *
     * @param message The command or event to handle
     * @throws com.ivamare.messagebus.exception.InvalidMessageTypeException if the
     *         message is null or neither a command nor an event
     * @throws com.ivamare.messagebus.exception.HandlerNotFoundException if a
     *         command has no handler
     * @throws RuntimeException whatever a command handler threw, checked
     *         exceptions wrapped in a MessageHandlingException
     */
    void handle(Message message);

    /**
     * Handle a message, then run a callback once the queue is empty.
     *
     * @param message The command or event to handle
     * @param callback Run after draining; may be null
     */
    void handle(Message message, Runnable callback);

    /**
     * Subscribe a handler. A command type gets its handler replaced, an event
     * type gets one more handler.
     *
     * @param messageType A Command or Event subtype
     * @param handler The handler
     * @throws com.ivamare.messagebus.exception.InvalidMessageTypeException if the
     *         type is neither a Command nor an Event
     */
    <M extends Message> void subscribe(Class<M> messageType, MessageHandler<? super M> handler);

    UnitOfWork getUnitOfWork();

    /**
     * @return The working queue, empty whenever the bus is idle
     */
    MessageQueue<Message> getQueue();
}
