package com.ivamare.messagebus.handler;

import com.ivamare.messagebus.model.Message;

/**
 * Functional interface for command and event handlers.
 *
 * <p>A command handler failure reaches the caller of the bus; an event handler
 * failure is logged and swallowed.
 *
 * @param <M> The message type handled
 */
@FunctionalInterface
public interface MessageHandler<M extends Message> {

    /**
     * Process a message.
     *
     * @param message The message to process
     * @throws Exception on processing failure
     */
    void handle(M message) throws Exception;
}
