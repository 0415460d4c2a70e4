package com.ivamare.messagebus.exception;

/**
 * Thrown when a value of the wrong kind reaches a typed entry point: a null or
 * foreign element offered to a message queue, or a subscription for a type that
 * is neither a command nor an event.
 */
public class InvalidMessageTypeException extends MessageBusException {

    private final Class<?> expectedType;
    private final Class<?> actualType;

    public InvalidMessageTypeException(Class<?> expectedType, Object actual) {
        this(expectedType, actual == null ? null : actual.getClass());
    }

    public InvalidMessageTypeException(Class<?> expectedType, Class<?> actualType) {
        this("expected type '" + expectedType.getSimpleName() + "', got "
            + (actualType == null ? "null" : actualType.getName()) + " instead",
            expectedType, actualType);
    }

    public InvalidMessageTypeException(String message, Class<?> expectedType, Class<?> actualType) {
        super(message);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    /**
     * @return the offending type, or null when the offending value was null
     */
    public Class<?> getActualType() {
        return actualType;
    }
}
