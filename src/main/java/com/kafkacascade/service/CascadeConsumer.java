package com.kafkacascade.service;

import com.kafkacascade.broker.BrokerConsumer;
import com.kafkacascade.exception.CascadeException;
import com.kafkacascade.exception.DisconnectException;
import com.kafkacascade.exception.ServiceException;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.ServiceOutcome;
import com.kafkacascade.support.Futures;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Consumes the source topic and its retry levels and classifies every message.
 *
 * FLOW:
 *   message → emit "receive" → serviceCallback.process(message)
 *                                     ↓
 *          ┌──── success ─────────────┴──────────── failure ────┐
 *          ↓                                                    ↓
 *    onSuccess(message)                                onFailure(message)
 *
 * A callback that throws, fails, or outlives the service timeout emits
 * "serviceError" and is routed as a failure. The future handed back to the
 * broker completes only after routing, and never exceptionally.
 */
@Slf4j
public class CascadeConsumer {

    private final BrokerConsumer consumer;
    private final String topic;
    private final String groupId;
    private final Duration serviceTimeout;
    private final Duration drainTimeout;
    private final CascadeEventEmitter events = new CascadeEventEmitter();

    private final Object drainLock = new Object();
    private int inFlight;

    public CascadeConsumer(BrokerConsumer consumer, String topic, String groupId,
                           Duration serviceTimeout, Duration drainTimeout) {
        this.consumer = consumer;
        this.topic = topic;
        this.groupId = groupId;
        this.serviceTimeout = serviceTimeout;
        this.drainTimeout = drainTimeout != null ? drainTimeout : Duration.ZERO;
    }

    public void on(CascadeEvent event, CascadeEventListener listener) {
        events.on(event, listener);
    }

    public CompletableFuture<Void> connect() {
        return Futures.invoke(consumer::connect);
    }

    /**
     * Starts consuming. Completes once the subscription is active; consumption
     * continues in the background.
     */
    public CompletableFuture<Void> run(ServiceCallback serviceCallback,
                                       RouteCallback onSuccess,
                                       RouteCallback onFailure) {
        return Futures.invoke(() -> consumer.subscribe(RetryTopics.subscriptionPattern(topic),
                message -> process(message, serviceCallback, onSuccess, onFailure)));
    }

    public CompletableFuture<Void> pause() {
        return Futures.invoke(consumer::pause);
    }

    public CompletableFuture<Void> resume() {
        return Futures.invoke(consumer::resume);
    }

    public CompletableFuture<Void> stop() {
        return Futures.invoke(consumer::stop);
    }

    /**
     * Stops consuming, waits up to the drain timeout for in-flight messages,
     * then releases the connection.
     *
     * @return a future failing with DisconnectException if messages are still in flight
     */
    public CompletableFuture<Void> disconnect() {
        return stop()
                .thenCompose(ignored -> drain())
                .thenCompose(ignored -> consumer.disconnect());
    }

    public int getInFlight() {
        synchronized (drainLock) {
            return inFlight;
        }
    }

    private CompletionStage<Void> process(CascadeMessage message, ServiceCallback serviceCallback,
                                          RouteCallback onSuccess, RouteCallback onFailure) {
        begin();
        events.emit(CascadeEvent.RECEIVE, message);

        return invokeService(serviceCallback, message)
                .thenCompose(outcome -> {
                    RouteCallback route = outcome.isSuccess() ? onSuccess : onFailure;
                    return Futures.invoke(() -> route.route(outcome.getMessage()).toCompletableFuture());
                })
                .exceptionally(error -> {
                    Throwable cause = Futures.unwrap(error);
                    log.error("Failed to route message from {}: {}", message.getTopic(), cause.getMessage(), cause);
                    events.emit(CascadeEvent.ERROR, new CascadeException("Routing failed: " + cause.getMessage(), cause));
                    return null;
                })
                .whenComplete((ignored, error) -> end());
    }

    private CompletableFuture<ServiceOutcome> invokeService(ServiceCallback serviceCallback, CascadeMessage message) {
        CompletableFuture<ServiceOutcome> outcome;
        try {
            CompletionStage<ServiceOutcome> stage = serviceCallback.process(message);
            outcome = stage != null
                    ? stage.toCompletableFuture()
                    : CompletableFuture.failedFuture(new IllegalStateException("Service callback returned no result"));
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        if (serviceTimeout != null && !serviceTimeout.isZero() && !serviceTimeout.isNegative()) {
            // copy() so the caller's own future is not completed by the timeout
            outcome = outcome.copy().orTimeout(serviceTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return outcome.handle((result, error) -> {
            if (error == null && result != null) {
                return result;
            }
            Throwable cause = error != null
                    ? Futures.unwrap(error)
                    : new IllegalStateException("Service callback completed without an outcome");
            String reason = cause instanceof TimeoutException
                    ? "Service callback did not complete within " + serviceTimeout
                    : "Service callback failed: " + cause.getMessage();
            log.warn("{} (topic={}, offset={})", reason, message.getTopic(), message.getOffset());
            events.emit(CascadeEvent.SERVICE_ERROR, new ServiceException(reason, message, cause));
            return ServiceOutcome.failure(message);
        });
    }

    private CompletableFuture<Void> drain() {
        if (getInFlight() == 0) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                if (!awaitDrained(drainTimeout)) {
                    int remaining = getInFlight();
                    throw new DisconnectException("Cannot disconnect consumer " + groupId + " with "
                            + remaining + " message(s) still in flight", remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DisconnectException("Interrupted while draining consumer " + groupId, getInFlight());
            }
        });
    }

    private boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainLock) {
            while (inFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(drainLock, remaining);
            }
            return true;
        }
    }

    private void begin() {
        synchronized (drainLock) {
            inFlight++;
        }
    }

    private void end() {
        synchronized (drainLock) {
            inFlight--;
            drainLock.notifyAll();
        }
    }
}
