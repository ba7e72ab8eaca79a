package com.kafkacascade.broker.kafka;

import com.kafkacascade.broker.BrokerAdmin;
import com.kafkacascade.broker.TopicSpec;
import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.exception.ConnectionException;
import com.kafkacascade.exception.ProvisioningException;
import com.kafkacascade.support.Futures;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.TopicExistsException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Topic administration on top of the Kafka AdminClient.
 *
 * createTopics() is idempotent: a TopicExistsException for one topic is
 * logged and ignored, any other failure fails the whole call.
 *
 * Per-level limits: the timeout limit becomes the CreateTopics request
 * timeout (largest of the batch). Kafka has no topic-level batch setting,
 * so batch limits are only logged.
 */
@Slf4j
public class KafkaBrokerAdmin implements BrokerAdmin {

    private final Map<String, Object> adminConfig;
    private final CascadeProperties.Provisioning provisioning;
    private final Executor executor;
    private final Function<Map<String, Object>, Admin> adminFactory;

    private volatile Admin adminClient;

    KafkaBrokerAdmin(Map<String, Object> adminConfig, CascadeProperties.Provisioning provisioning,
                     Executor executor) {
        this(adminConfig, provisioning, executor, Admin::create);
    }

    KafkaBrokerAdmin(Map<String, Object> adminConfig, CascadeProperties.Provisioning provisioning,
                     Executor executor, Function<Map<String, Object>, Admin> adminFactory) {
        this.adminConfig = adminConfig;
        this.provisioning = provisioning;
        this.executor = executor;
        this.adminFactory = adminFactory;
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            try {
                adminClient = adminFactory.apply(adminConfig);
            } catch (KafkaException e) {
                throw new ConnectionException("Failed to create admin client: " + e.getMessage(), e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> createTopics(List<TopicSpec> topics) {
        Admin client = adminClient;
        if (client == null) {
            return CompletableFuture.failedFuture(
                    new ProvisioningException("Admin client is not connected", null));
        }
        if (topics.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        List<NewTopic> newTopics = topics.stream().map(this::toNewTopic).toList();
        CreateTopicsOptions options = new CreateTopicsOptions().timeoutMs(requestTimeoutMs(topics));
        CreateTopicsResult result = client.createTopics(newTopics, options);

        CompletableFuture<?>[] perTopic = result.values().entrySet().stream()
                .map(entry -> toCompletableFuture(entry.getValue())
                        .handle((ignored, error) -> {
                            if (error == null) {
                                log.info("Created topic {}", entry.getKey());
                                return null;
                            }
                            Throwable cause = Futures.unwrap(error);
                            if (cause instanceof TopicExistsException) {
                                log.debug("Topic {} already exists", entry.getKey());
                                return null;
                            }
                            throw new ProvisioningException(
                                    "Failed to create topic " + entry.getKey() + ": " + cause.getMessage(), cause);
                        }))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(perTopic);
    }

    @Override
    public CompletableFuture<Set<String>> listTopics() {
        Admin client = adminClient;
        if (client == null) {
            return CompletableFuture.failedFuture(
                    new ProvisioningException("Admin client is not connected", null));
        }
        return toCompletableFuture(client.listTopics().names());
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        Admin client = adminClient;
        adminClient = null;
        if (client == null) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> client.close(Duration.ofSeconds(5)), executor);
    }

    private NewTopic toNewTopic(TopicSpec spec) {
        if (spec.getBatchLimit() != null) {
            log.debug("Batch limit {} for {} has no Kafka topic equivalent, keeping broker default",
                    spec.getBatchLimit(), spec.getName());
        }
        return new NewTopic(spec.getName(),
                Optional.ofNullable(provisioning.getPartitions()),
                Optional.ofNullable(provisioning.getReplicationFactor()));
    }

    private int requestTimeoutMs(List<TopicSpec> topics) {
        return topics.stream()
                .map(TopicSpec::getTimeoutLimit)
                .filter(Objects::nonNull)
                .max(Integer::compare)
                .orElse(provisioning.getRequestTimeoutMs());
    }

    // toCompletionStage() refuses toCompletableFuture(), so results are bridged into a plain future
    private static <T> CompletableFuture<T> toCompletableFuture(KafkaFuture<T> kafkaFuture) {
        CompletableFuture<T> future = new CompletableFuture<>();
        kafkaFuture.toCompletionStage().whenComplete((value, error) -> {
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(value);
            }
        });
        return future;
    }
}
