package com.ivamare.messagebus.health;

import com.ivamare.messagebus.broker.ConcurrentMessageBroker;
import com.ivamare.messagebus.broker.MessageBroker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the message broker.
 *
 * <p>Reports the broker type, its channels with their subscriber counts, and
 * for a concurrent broker whether its pool is running and how many deliveries
 * are in flight. A closed concurrent broker is reported down.
 */
public class BrokerHealthIndicator implements HealthIndicator {

    private final MessageBroker broker;

    public BrokerHealthIndicator(MessageBroker broker) {
        this.broker = broker;
    }

    @Override
    public Health health() {
        if (broker == null) {
            return Health.unknown()
                .withDetail("message", "No broker registered")
                .build();
        }

        Health.Builder builder = Health.up();
        if (broker instanceof ConcurrentMessageBroker concurrent) {
            builder = concurrent.isRunning() ? Health.up() : Health.down();
            builder
                .withDetail("concurrency", concurrent.getConcurrency())
                .withDetail("inFlight", concurrent.inFlightCount());
        }

        return builder
            .withDetail("type", broker.getClass().getSimpleName())
            .withDetail("channels", broker.channels().stream()
                .map(channel -> new ChannelStatus(channel, broker.subscribers(channel).size()))
                .toList())
            .build();
    }

    record ChannelStatus(String name, int subscribers) {}
}
