package com.kafkacascade.service;

import com.kafkacascade.broker.BrokerProducer;
import com.kafkacascade.exception.CascadeException;
import com.kafkacascade.exception.PublishException;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.RetryLevel;
import com.kafkacascade.support.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes failed messages to the next retry level or to the dead-letter route.
 *
 * ROUTING:
 *   retries = message.retries (0 when absent)
 *          ┌──── retries < levels ────┴──── otherwise ────┐
 *          ↓                                               ↓
 *   publish to levels[retries]                 publish to dead-letter topic (if any)
 *   with retries + 1                           emit "dlq"
 *   emit "retry"                               invoke dead-letter callback
 *
 * The retry-level list is an immutable list behind an AtomicReference: each
 * send() routes against one snapshot, never a half-updated list.
 *
 * Failures are retried with the configured backoff, then emitted as "error".
 * send() itself never completes exceptionally.
 */
@Slf4j
public class CascadeProducer {

    private final BrokerProducer producer;
    private final RouteCallback deadLetterCallback;
    private final String deadLetterTopic;
    private final BackOff publishBackOff;
    private final CascadeEventEmitter events = new CascadeEventEmitter();
    private final AtomicReference<List<RetryLevel>> retryLevels = new AtomicReference<>(List.of());

    public CascadeProducer(BrokerProducer producer, RouteCallback deadLetterCallback,
                           String deadLetterTopic, BackOff publishBackOff) {
        this.producer = producer;
        this.deadLetterCallback = deadLetterCallback != null ? deadLetterCallback : RouteCallback.noop();
        this.deadLetterTopic = deadLetterTopic == null || deadLetterTopic.isBlank() ? null : deadLetterTopic;
        this.publishBackOff = publishBackOff;
    }

    public void on(CascadeEvent event, CascadeEventListener listener) {
        events.on(event, listener);
    }

    public CompletableFuture<Void> connect() {
        return Futures.invoke(producer::connect);
    }

    public CompletableFuture<Void> disconnect() {
        return Futures.invoke(producer::disconnect);
    }

    /** Hands every pending publish to the broker. */
    public CompletableFuture<Void> stop() {
        return Futures.invoke(() -> {
            producer.flush();
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Flushes pending retry publishes so nothing routed before the pause is
     * left buffered. The pause flag itself lives in CascadeService.
     */
    public void pause() {
        producer.flush();
        log.debug("Cascade producer flushed for pause");
    }

    public void resume() {
        log.debug("Cascade producer resumed");
    }

    public void setRetryTopics(List<RetryLevel> levels) {
        retryLevels.set(List.copyOf(levels));
        log.info("Retry levels set: {}", getRetryTopics());
    }

    public List<RetryLevel> getRetryLevels() {
        return retryLevels.get();
    }

    public List<String> getRetryTopics() {
        return retryLevels.get().stream().map(RetryLevel::getTopic).toList();
    }

    public CompletableFuture<Void> send(CascadeMessage message) {
        List<RetryLevel> levels = retryLevels.get();
        int retries = message.getRetries();

        CompletableFuture<Void> routed = retries < levels.size()
                ? retry(message, levels.get(retries))
                : deadLetter(message, retries);

        return routed.exceptionally(error -> {
            CascadeException failure = toPublishException(error);
            log.error("Failed to route message from {}: {}", message.getTopic(), failure.getMessage());
            events.emit(CascadeEvent.ERROR, failure);
            return null;
        });
    }

    private CompletableFuture<Void> retry(CascadeMessage message, RetryLevel level) {
        CascadeMessage outgoing = message.withRetries(message.getRetries() + 1);
        return publish(level.getTopic(), outgoing).thenRun(() -> {
            log.info("Routed message to retry level {}: topic={}, key={}",
                    level.getLevel(), level.getTopic(), outgoing.getKey());
            events.emit(CascadeEvent.RETRY, outgoing);
        });
    }

    private CompletableFuture<Void> deadLetter(CascadeMessage message, int retries) {
        CompletableFuture<Void> published = deadLetterTopic == null
                ? CompletableFuture.completedFuture(null)
                : publish(deadLetterTopic, message);

        return published.thenCompose(ignored -> {
            log.warn("Message exhausted {} retry level(s), routing to dead letter: topic={}, key={}",
                    retries, message.getTopic(), message.getKey());
            events.emit(CascadeEvent.DLQ, message);
            return Futures.invoke(() -> deadLetterCallback.route(message).toCompletableFuture());
        });
    }

    private CompletableFuture<Void> publish(String topic, CascadeMessage message) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(topic, message, publishBackOff.start(), 1, result);
        return result;
    }

    private void attempt(String topic, CascadeMessage message, BackOffExecution backOff,
                         int attempt, CompletableFuture<Void> result) {
        Futures.invoke(() -> producer.publish(topic, message)).whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            long delay = backOff.nextBackOff();
            if (delay == BackOffExecution.STOP) {
                result.completeExceptionally(new PublishException(topic,
                        "Publish to " + topic + " failed after " + attempt + " attempt(s): " + cause.getMessage(),
                        cause));
                return;
            }
            log.warn("Publish to {} failed (attempt {}), retrying in {}ms: {}",
                    topic, attempt, delay, cause.getMessage());
            CompletableFuture.runAsync(() -> attempt(topic, message, backOff, attempt + 1, result),
                    CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS));
        });
    }

    private static CascadeException toPublishException(Throwable error) {
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof PublishException publishException) {
            return publishException;
        }
        return new PublishException(null, "Dead-letter callback failed: " + cause.getMessage(), cause);
    }
}
