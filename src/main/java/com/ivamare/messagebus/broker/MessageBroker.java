package com.ivamare.messagebus.broker;

import java.util.List;

/**
 * Publish/subscribe fan-out keyed by channel name.
 *
 * <p>Independent of the message bus: handlers use a broker to notify
 * subscribers outside the bus. Delivery is best-effort; a failing subscriber is
 * logged and never affects the others. Channels come into existence on first
 * subscribe or publish.
 */
public interface MessageBroker {

    /**
     * @return Every known channel name
     */
    List<String> channels();

    /**
     * @param channel The channel name
     * @return The channel's subscribers in subscription order, empty if none
     */
    List<Subscriber> subscribers(String channel);

    /**
     * Add a subscriber to a channel.
     *
     * @param channel The channel name
     * @param subscriber Called for every message on the channel
     * @throws com.ivamare.messagebus.exception.InvalidChannelException if the
     *         channel name is null or blank
     */
    void subscribe(String channel, Subscriber subscriber);

    /**
     * Wrap a payload in a {@link BrokerMessage} stamped now and send it.
     *
     * @param channel The channel name
     * @param payload The payload, usually JSON
     * @throws com.ivamare.messagebus.exception.InvalidChannelException if the
     *         channel name is null or blank
     */
    void publish(String channel, String payload);

    /**
     * Deliver a message to every subscriber of a channel. A channel without
     * subscribers is a no-op.
     *
     * @param channel The channel name
     * @param message The message
     * @throws com.ivamare.messagebus.exception.InvalidChannelException if the
     *         channel name is null or blank
     */
    void sendMessage(String channel, BrokerMessage message);
}
