package com.ivamare.messagebus.policy;

/**
 * What happens to a handler or subscriber failure once it has been logged.
 */
public enum ErrorPolicy {

    /**
     * Propagate the failure to the caller. Used for commands.
     */
    RAISE,

    /**
     * Swallow the failure and carry on. Used for events and broker fan-out.
     */
    IGNORE
}
