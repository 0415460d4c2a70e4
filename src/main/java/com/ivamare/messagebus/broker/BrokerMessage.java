package com.ivamare.messagebus.broker;

import java.time.Instant;

/**
 * Envelope delivered to broker subscribers.
 *
 * @param data The published payload, usually JSON
 * @param createdAt When the payload was published
 */
public record BrokerMessage(String data, Instant createdAt) {

    public BrokerMessage {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static BrokerMessage of(String data) {
        return new BrokerMessage(data, Instant.now());
    }
}
