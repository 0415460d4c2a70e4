package com.ivamare.messagebus.broker;

import com.ivamare.messagebus.exception.InvalidChannelException;
import com.ivamare.messagebus.policy.ErrorPolicy;
import com.ivamare.messagebus.policy.FailureHandler;
import com.ivamare.messagebus.support.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-process broker that calls each subscriber synchronously on the publishing
 * thread.
 *
 * <p>The channel table is not synchronized; subscribe from one thread or guard
 * the calls externally.
 */
@Singleton
public class DefaultMessageBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessageBroker.class);

    private final Map<String, List<Subscriber>> subscribers = new LinkedHashMap<>();
    private final FailureHandler failureHandler;

    public DefaultMessageBroker() {
        this(new FailureHandler());
    }

    public DefaultMessageBroker(FailureHandler failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler is required");
    }

    @Override
    public List<String> channels() {
        return List.copyOf(subscribers.keySet());
    }

    @Override
    public List<Subscriber> subscribers(String channel) {
        return List.copyOf(subscribers.getOrDefault(channel, List.of()));
    }

    @Override
    public void subscribe(String channel, Subscriber subscriber) {
        validateChannel(channel);
        Objects.requireNonNull(subscriber, "subscriber is required");
        channel(channel).add(subscriber);
        log.debug("Subscribed {} to channel {}", subscriber, channel);
    }

    @Override
    public void publish(String channel, String payload) {
        validateChannel(channel);
        sendMessage(channel, BrokerMessage.of(payload));
    }

    @Override
    public void sendMessage(String channel, BrokerMessage message) {
        validateChannel(channel);
        for (Subscriber subscriber : new ArrayList<>(channel(channel))) {
            log.debug("Sending message on channel {} to subscriber {}", channel, subscriber);
            deliver(channel, subscriber, message);
        }
    }

    /**
     * Hand one message to one subscriber. Failures are logged and swallowed.
     */
    protected void deliver(String channel, Subscriber subscriber, BrokerMessage message) {
        try {
            subscriber.receive(message);
        } catch (Exception e) {
            failureHandler.handle(channel, e, ErrorPolicy.IGNORE);
        }
    }

    protected FailureHandler getFailureHandler() {
        return failureHandler;
    }

    protected static void validateChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new InvalidChannelException(channel);
        }
    }

    private List<Subscriber> channel(String channel) {
        return subscribers.computeIfAbsent(channel, name -> new ArrayList<>());
    }
}
