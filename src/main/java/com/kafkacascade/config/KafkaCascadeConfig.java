package com.kafkacascade.config;

import com.kafkacascade.broker.Broker;
import com.kafkacascade.broker.kafka.KafkaBroker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.ProducerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds the cascade broker abstraction to the Kafka factories that Spring Boot
 * auto-configures from "spring.kafka.*".
 */
@Configuration
public class KafkaCascadeConfig {

    /** Runs blocking Kafka client calls (cluster probes, container stop, admin close). */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService cascadeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "cascade-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Broker kafkaBroker(ProducerFactory<String, String> producerFactory,
                              ConsumerFactory<String, String> consumerFactory,
                              KafkaAdmin kafkaAdmin,
                              CascadeProperties properties,
                              ExecutorService cascadeExecutor) {
        return new KafkaBroker(producerFactory, consumerFactory, kafkaAdmin, properties, cascadeExecutor);
    }
}
