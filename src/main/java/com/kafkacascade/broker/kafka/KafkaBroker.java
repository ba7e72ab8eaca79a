package com.kafkacascade.broker.kafka;

import com.kafkacascade.broker.Broker;
import com.kafkacascade.broker.BrokerAdmin;
import com.kafkacascade.broker.BrokerConsumer;
import com.kafkacascade.broker.BrokerProducer;
import com.kafkacascade.config.CascadeProperties;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.ProducerFactory;

import java.util.concurrent.Executor;

/**
 * Broker backed by the Spring Boot managed Kafka factories.
 */
public class KafkaBroker implements Broker {

    private final ProducerFactory<String, String> producerFactory;
    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaAdmin kafkaAdmin;
    private final CascadeProperties properties;
    private final Executor executor;
    private final KafkaClusterProbe probe;

    public KafkaBroker(ProducerFactory<String, String> producerFactory,
                       ConsumerFactory<String, String> consumerFactory,
                       KafkaAdmin kafkaAdmin,
                       CascadeProperties properties,
                       Executor executor) {
        this.producerFactory = producerFactory;
        this.consumerFactory = consumerFactory;
        this.kafkaAdmin = kafkaAdmin;
        this.properties = properties;
        this.executor = executor;
        this.probe = new KafkaClusterProbe(kafkaAdmin.getConfigurationProperties(),
                properties.getConnectTimeout(), executor);
    }

    @Override
    public BrokerProducer producer() {
        return new KafkaBrokerProducer(producerFactory, probe);
    }

    @Override
    public BrokerConsumer consumer(String groupId) {
        return new KafkaBrokerConsumer(consumerFactory, groupId, probe, executor);
    }

    @Override
    public BrokerAdmin admin() {
        return new KafkaBrokerAdmin(kafkaAdmin.getConfigurationProperties(),
                properties.getProvisioning(), executor);
    }
}
