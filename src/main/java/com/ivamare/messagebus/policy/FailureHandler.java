package com.ivamare.messagebus.policy;

import com.ivamare.messagebus.exception.MessageBusException;
import com.ivamare.messagebus.exception.MessageHandlingException;
import com.ivamare.messagebus.model.Message;
import com.ivamare.messagebus.support.RuntimeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Logs handler and subscriber failures and applies an {@link ErrorPolicy}.
 *
 * <p>Failures raised to the caller are always logged with their stack trace.
 * Ignored failures carry the stack trace everywhere except in production.
 */
public class FailureHandler {

    private static final Logger log = LoggerFactory.getLogger(FailureHandler.class);

    private final RuntimeEnvironment environment;

    public FailureHandler() {
        this(RuntimeEnvironment.current());
    }

    public FailureHandler(RuntimeEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment is required");
    }

    public RuntimeEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Log a failure, then rethrow it under {@link ErrorPolicy#RAISE}.
     *
     * @param subject The message or channel being handled
     * @param error The failure
     * @param policy What to do after logging
     * @throws RuntimeException the failure itself, or a {@link MessageBusException}
     *         wrapping it when it is checked, under {@link ErrorPolicy#RAISE}
     */
    public void handle(Object subject, Exception error, ErrorPolicy policy) {
        if (policy == ErrorPolicy.RAISE || !environment.isProduction()) {
            log.error("Error handling {}", subject, error);
        } else {
            log.error("Error handling {}: {}", subject, error.toString());
        }

        if (policy == ErrorPolicy.RAISE) {
            throw propagate(subject, error);
        }
    }

    /**
     * The exception to throw for a failure raised to the caller.
     *
     * @param subject The message or channel being handled
     * @param error The failure
     * @return The failure itself when unchecked, otherwise a wrapper carrying it
     */
    public static RuntimeException propagate(Object subject, Exception error) {
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (subject instanceof Message message) {
            return new MessageHandlingException(message, error);
        }
        return new MessageBusException("Error handling " + subject, error);
    }
}
