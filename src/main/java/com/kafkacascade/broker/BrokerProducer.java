package com.kafkacascade.broker;

import com.kafkacascade.model.CascadeMessage;

import java.util.concurrent.CompletableFuture;

public interface BrokerProducer {

    CompletableFuture<Void> connect();

    /**
     * Publishes the message's key, payload and headers to the given topic.
     * The message's own topic/partition/offset are ignored.
     */
    CompletableFuture<Void> publish(String topic, CascadeMessage message);

    /** Blocks until every pending publish has been handed to the broker. */
    void flush();

    /** Safe to call repeatedly. */
    CompletableFuture<Void> disconnect();
}
