package com.kafkacascade.broker.kafka;

import com.kafkacascade.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks that the cluster answers before a client reports itself connected.
 *
 * Kafka producers and consumers connect lazily, so without this probe an
 * unreachable broker would only surface on the first publish or poll.
 */
@Slf4j
class KafkaClusterProbe {

    private final Map<String, Object> adminConfig;
    private final Duration timeout;
    private final Executor executor;

    KafkaClusterProbe(Map<String, Object> adminConfig, Duration timeout, Executor executor) {
        this.adminConfig = adminConfig;
        this.timeout = timeout;
        this.executor = executor;
    }

    CompletableFuture<Void> probe(String client) {
        return CompletableFuture.runAsync(() -> {
            try (AdminClient admin = AdminClient.create(adminConfig)) {
                Collection<Node> nodes = admin.describeCluster().nodes()
                        .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                log.debug("Cluster reachable for {}: {} broker(s)", client, nodes.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while connecting " + client, e);
            } catch (ExecutionException | TimeoutException | KafkaException e) {
                throw new ConnectionException("Broker unreachable for " + client + ": " + e.getMessage(), e);
            }
        }, executor);
    }
}
