package com.ivamare.messagebus.exception;

/**
 * Thrown when a broker channel name is null or blank.
 */
public class InvalidChannelException extends MessageBusException {

    public InvalidChannelException(String channel) {
        super("Channel name must be a non-empty string, got "
            + (channel == null ? "null" : "'" + channel + "'"));
    }
}
