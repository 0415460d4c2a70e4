package com.ivamare.messagebus.broker;

/**
 * Receives the messages published on a broker channel.
 */
@FunctionalInterface
public interface Subscriber {

    void receive(BrokerMessage message) throws Exception;
}
