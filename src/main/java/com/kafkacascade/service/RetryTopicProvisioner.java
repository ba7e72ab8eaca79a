package com.kafkacascade.service;

import com.kafkacascade.broker.Broker;
import com.kafkacascade.broker.BrokerAdmin;
import com.kafkacascade.broker.TopicSpec;
import com.kafkacascade.exception.ProvisioningException;
import com.kafkacascade.model.RetryLevel;
import com.kafkacascade.support.Futures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Pre-registers retry-level topics with the broker.
 *
 * FLOW:
 *   admin.connect → createTopics(levels) → listTopics → filter → admin.disconnect
 *
 * createTopics is idempotent, so re-provisioning an unchanged list is safe.
 * The listing step is a best-effort check: missing topics are logged, not failed.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryTopicProvisioner {

    private final Broker broker;

    /**
     * @return the source topic and retry topics visible on the broker afterwards
     */
    public CompletableFuture<Set<String>> provision(String sourceTopic, List<RetryLevel> levels) {
        BrokerAdmin admin = broker.admin();
        List<TopicSpec> specs = levels.stream()
                .map(level -> TopicSpec.builder()
                        .name(level.getTopic())
                        .timeoutLimit(level.getTimeoutLimit())
                        .batchLimit(level.getBatchLimit())
                        .build())
                .toList();

        CompletableFuture<Set<String>> registered = Futures.invoke(admin::connect)
                .thenCompose(ignored -> admin.createTopics(specs))
                .thenCompose(ignored -> admin.listTopics())
                .thenApply(topics -> verify(sourceTopic, levels, topics));

        CompletableFuture<Set<String>> result = new CompletableFuture<>();
        registered.whenComplete((topics, error) ->
                Futures.invoke(admin::disconnect).whenComplete((ignored, closeError) -> {
                    if (closeError != null) {
                        log.warn("Failed to disconnect admin client: {}", Futures.unwrap(closeError).getMessage());
                    }
                    if (error != null) {
                        result.completeExceptionally(toProvisioningException(sourceTopic, error));
                    } else {
                        result.complete(topics);
                    }
                }));
        return result;
    }

    private Set<String> verify(String sourceTopic, List<RetryLevel> levels, Set<String> topics) {
        Pattern retryPattern = RetryTopics.retryTopicPattern(sourceTopic);
        Set<String> registered = new TreeSet<>();
        for (String name : topics) {
            if (name.equals(sourceTopic) || retryPattern.matcher(name).matches()) {
                registered.add(name);
            }
        }
        List<String> missing = levels.stream()
                .map(RetryLevel::getTopic)
                .filter(name -> !registered.contains(name))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Retry topics not yet visible on the broker: {}", missing);
        }
        log.info("Topics registered = {}", registered);
        return registered;
    }

    private static ProvisioningException toProvisioningException(String sourceTopic, Throwable error) {
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof ProvisioningException provisioningException) {
            return provisioningException;
        }
        return new ProvisioningException(
                "Failed to provision retry topics for " + sourceTopic + ": " + cause.getMessage(), cause);
    }
}
