package com.kafkacascade.broker;

/**
 * Entry point to the message broker. Hands out independent producer,
 * consumer and admin clients, each with its own connection lifecycle.
 */
public interface Broker {

    BrokerProducer producer();

    BrokerConsumer consumer(String groupId);

    BrokerAdmin admin();
}
