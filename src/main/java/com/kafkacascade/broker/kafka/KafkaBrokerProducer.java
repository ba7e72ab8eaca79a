package com.kafkacascade.broker.kafka;

import com.kafkacascade.broker.BrokerProducer;
import com.kafkacascade.exception.PublishException;
import com.kafkacascade.model.CascadeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes cascade messages through a KafkaTemplate.
 *
 * The template is created on connect and dropped on disconnect; the underlying
 * producer belongs to the shared ProducerFactory and is not closed here.
 */
@Slf4j
public class KafkaBrokerProducer implements BrokerProducer {

    private final ProducerFactory<String, String> producerFactory;
    private final KafkaClusterProbe probe;

    private volatile KafkaTemplate<String, String> template;

    KafkaBrokerProducer(ProducerFactory<String, String> producerFactory, KafkaClusterProbe probe) {
        this.producerFactory = producerFactory;
        this.probe = probe;
    }

    @Override
    public CompletableFuture<Void> connect() {
        return probe.probe("producer").thenRun(() -> {
            template = new KafkaTemplate<>(producerFactory);
            log.info("Kafka producer connected");
        });
    }

    @Override
    public CompletableFuture<Void> publish(String topic, CascadeMessage message) {
        KafkaTemplate<String, String> current = template;
        if (current == null) {
            return CompletableFuture.failedFuture(
                    new PublishException(topic, "Producer is not connected", null));
        }
        try {
            return current.send(KafkaMessageMapper.toRecord(topic, message))
                    .thenAccept(result -> log.debug("Published to {}-{}@{}",
                            topic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new PublishException(topic, "Publish to " + topic + " failed: " + e.getMessage(), e));
        }
    }

    @Override
    public void flush() {
        KafkaTemplate<String, String> current = template;
        if (current != null) {
            current.flush();
        }
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        if (template != null) {
            template.flush();
            template = null;
            log.info("Kafka producer disconnected");
        }
        return CompletableFuture.completedFuture(null);
    }
}
