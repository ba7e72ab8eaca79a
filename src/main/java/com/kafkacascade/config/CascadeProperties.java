package com.kafkacascade.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralizes all cascade configuration.
 *
 * Bound from application.yml under the "cascade" prefix:
 *   cascade:
 *     topic: orders
 *     group-id: orders-cascade
 *     retry-levels: 3
 *     dead-letter-topic: orders-dlq
 *     service-timeout: 30s
 *     provisioning:
 *       timeout-limit: [5000, 10000]
 *       batch-limit: [10, 10]
 *     publish:
 *       max-attempts: 3
 *
 * Broker connection settings (bootstrap servers, serializers, security) stay
 * under Spring Boot's own "spring.kafka" prefix.
 */
@Component
@ConfigurationProperties(prefix = "cascade")
@Getter
@Setter
public class CascadeProperties {

    private String topic = "cascade-topic";
    private String groupId = "cascade-group";
    private int retryLevels = 3;

    /** Optional topic that receives dead-lettered messages; blank means callback only. */
    private String deadLetterTopic;

    /** Upper bound on one service callback invocation; null waits forever. */
    private Duration serviceTimeout;

    /** How long disconnect waits for in-flight messages before failing. */
    private Duration drainTimeout = Duration.ofSeconds(30);

    /** Bound on the cluster probe performed by connect(). */
    private Duration connectTimeout = Duration.ofSeconds(10);

    private Provisioning provisioning = new Provisioning();
    private Publish publish = new Publish();
    private Demo demo = new Demo();

    @Getter
    @Setter
    public static class Provisioning {
        private List<Integer> timeoutLimit = new ArrayList<>();
        private List<Integer> batchLimit = new ArrayList<>();
        private Integer partitions;
        private Short replicationFactor;
        private int requestTimeoutMs = 30_000;
    }

    @Getter
    @Setter
    public static class Publish {
        private int maxAttempts = 3;
        private long initialIntervalMs = 200;
        private double multiplier = 2.0;
        private long maxIntervalMs = 2_000;
    }

    @Getter
    @Setter
    public static class Demo {
        private boolean enabled = false;
        private long messageIntervalMs = 100;
        private double successProbability = 0.3;
    }
}
