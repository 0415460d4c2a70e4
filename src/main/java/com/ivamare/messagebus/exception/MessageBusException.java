package com.ivamare.messagebus.exception;

/**
 * Base exception for all Message Bus errors.
 */
public class MessageBusException extends RuntimeException {

    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
