package com.kafkacascade.broker.kafka;

import com.kafkacascade.broker.BrokerConsumer;
import com.kafkacascade.broker.MessageHandler;
import com.kafkacascade.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * Consumes a topic pattern with a spring-kafka listener container.
 *
 * FLOW:
 *   poll → ConsumerRecord → CascadeMessage → handler.handle(...)
 *                                                  ↓
 *                          listener thread waits for the routing future
 *                                                  ↓
 *                          container acks the record (offset commit)
 *
 * Waiting on the future keeps delivery at-least-once: a record is only
 * committed after the cascade has routed it somewhere.
 */
@Slf4j
public class KafkaBrokerConsumer implements BrokerConsumer {

    private final ConsumerFactory<String, String> consumerFactory;
    private final String groupId;
    private final KafkaClusterProbe probe;
    private final Executor executor;

    private volatile boolean connected;
    private volatile ConcurrentMessageListenerContainer<String, String> container;

    KafkaBrokerConsumer(ConsumerFactory<String, String> consumerFactory, String groupId,
                        KafkaClusterProbe probe, Executor executor) {
        this.consumerFactory = consumerFactory;
        this.groupId = groupId;
        this.probe = probe;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> connect() {
        return probe.probe("consumer group " + groupId).thenRun(() -> {
            connected = true;
            log.info("Kafka consumer connected: groupId={}", groupId);
        });
    }

    @Override
    public CompletableFuture<Void> subscribe(Pattern topics, MessageHandler handler) {
        if (!connected) {
            return CompletableFuture.failedFuture(
                    new ConnectionException("Consumer " + groupId + " is not connected"));
        }
        return CompletableFuture.runAsync(() -> {
            ContainerProperties containerProperties = new ContainerProperties(topics);
            containerProperties.setGroupId(groupId);
            containerProperties.setMessageListener((MessageListener<String, String>) record ->
                    handler.handle(KafkaMessageMapper.fromRecord(record)).toCompletableFuture().join());

            ConcurrentMessageListenerContainer<String, String> listenerContainer =
                    new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
            listenerContainer.setBeanName("cascade-" + groupId);
            listenerContainer.start();
            container = listenerContainer;
            log.info("Subscribed to {} as groupId={}", topics.pattern(), groupId);
        }, executor);
    }

    @Override
    public CompletableFuture<Void> pause() {
        ConcurrentMessageListenerContainer<String, String> current = container;
        if (current != null) {
            current.pause();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> resume() {
        ConcurrentMessageListenerContainer<String, String> current = container;
        if (current != null) {
            current.resume();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> stop() {
        ConcurrentMessageListenerContainer<String, String> current = container;
        if (current == null || !current.isRunning()) {
            return CompletableFuture.completedFuture(null);
        }
        // stop() blocks until the listener threads have finished their current record
        return CompletableFuture.runAsync(() -> {
            current.stop();
            log.info("Kafka consumer stopped: groupId={}", groupId);
        }, executor);
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        return stop().thenRun(() -> {
            container = null;
            if (connected) {
                connected = false;
                log.info("Kafka consumer disconnected: groupId={}", groupId);
            }
        });
    }
}
