package com.ivamare.messagebus.exception;

import com.ivamare.messagebus.model.Message;

/**
 * Wraps a checked exception thrown by a command handler so that it can reach
 * the caller of {@code MessageBus.handle}. Unchecked handler exceptions are
 * never wrapped.
 */
public class MessageHandlingException extends MessageBusException {

    private final transient Message failedMessage;

    public MessageHandlingException(Message failedMessage, Throwable cause) {
        super("Error handling " + failedMessage, cause);
        this.failedMessage = failedMessage;
    }

    public Message getFailedMessage() {
        return failedMessage;
    }
}
