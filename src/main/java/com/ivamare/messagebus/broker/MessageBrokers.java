package com.ivamare.messagebus.broker;

import com.ivamare.messagebus.support.SingletonRegistry;

/**
 * Process-wide broker instances for code running outside a Spring context.
 *
 * <p>Every call returns the same instance until it is discarded from
 * {@link SingletonRegistry#global()}. A closed concurrent broker is replaced on
 * the next lookup.
 */
public final class MessageBrokers {

    private MessageBrokers() {
    }

    public static DefaultMessageBroker inProcess() {
        return SingletonRegistry.global().getOrCreate(DefaultMessageBroker.class);
    }

    public static synchronized ConcurrentMessageBroker concurrent() {
        SingletonRegistry registry = SingletonRegistry.global();
        ConcurrentMessageBroker broker = registry.getOrCreate(ConcurrentMessageBroker.class);
        if (!broker.isRunning()) {
            registry.discard(ConcurrentMessageBroker.class);
            broker = registry.getOrCreate(ConcurrentMessageBroker.class);
        }
        return broker;
    }
}
