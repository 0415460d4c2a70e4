package com.ivamare.messagebus.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.messagebus.broker.MessageBroker;
import com.ivamare.messagebus.exception.MessageBusException;
import com.ivamare.messagebus.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes events as JSON on a broker channel.
 *
 * <p>Typically called from an event handler to notify subscribers outside the
 * bus, e.g. {@code publisher.publish("orders", event)}.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final MessageBroker broker;
    private final ObjectMapper objectMapper;

    public EventPublisher(MessageBroker broker, ObjectMapper objectMapper) {
        this.broker = Objects.requireNonNull(broker, "broker is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    /**
     * Serialize an event and publish it.
     *
     * @param channel The broker channel
     * @param event The event
     * @throws MessageBusException if the event cannot be serialized
     * @throws com.ivamare.messagebus.exception.InvalidChannelException if the
     *         channel name is null or blank
     */
    public void publish(String channel, Event event) {
        Objects.requireNonNull(event, "event is required");
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new MessageBusException("Failed to serialize " + event, e);
        }

        log.info("Publishing {} on channel {}", event, channel);
        broker.publish(channel, payload);
    }

    public MessageBroker getBroker() {
        return broker;
    }
}
