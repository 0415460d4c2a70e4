package com.ivamare.messagebus.exception;

/**
 * Thrown when no handler is registered for a command type.
 */
public class HandlerNotFoundException extends MessageBusException {

    private final Class<?> messageType;

    public HandlerNotFoundException(Class<?> messageType) {
        super("No handler registered for " + messageType.getName());
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
