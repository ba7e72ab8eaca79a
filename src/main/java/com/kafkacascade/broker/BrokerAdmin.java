package com.kafkacascade.broker;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface BrokerAdmin {

    CompletableFuture<Void> connect();

    /** Creates the topics. Topics that already exist are not an error. */
    CompletableFuture<Void> createTopics(List<TopicSpec> topics);

    CompletableFuture<Set<String>> listTopics();

    CompletableFuture<Void> disconnect();
}
