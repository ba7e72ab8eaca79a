package com.kafkacascade.service;

import com.kafkacascade.exception.CascadeException;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.PauseState;
import com.kafkacascade.model.RetryLevel;
import com.kafkacascade.model.RetryProvisioningOptions;
import com.kafkacascade.model.ServiceState;
import com.kafkacascade.support.Futures;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.IntStream;

/**
 * Wires a CascadeConsumer to a CascadeProducer and coordinates their lifecycle.
 *
 * TYPICAL USE:
 *   service.setRetryLevels(3)   → provisions t-cascade-retry-1..3
 *   service.connect()           → producer first, then consumer
 *   service.run()               → consume t and its retry levels
 *   ...
 *   service.disconnect()
 *
 * Every lifecycle call returns a future. On failure the future completes
 * exceptionally AND an "error" event is emitted; nothing is thrown
 * synchronously except by on(String, ...) for unknown event names.
 *
 * The pause flag is owned here; consumer and producer only act on it.
 */
@Slf4j
public class CascadeService {

    private final String topic;
    private final ServiceCallback serviceCallback;
    private final RouteCallback successCallback;
    private final CascadeProducer producer;
    private final CascadeConsumer consumer;
    private final RetryTopicProvisioner provisioner;
    private final CascadeEventEmitter events = new CascadeEventEmitter();

    private final Object stateLock = new Object();
    private ServiceState state = ServiceState.DISCONNECTED;
    private PauseState pauseState = PauseState.RUNNING;

    private final Object retryLock = new Object();
    private List<String> retryTopics = List.of();

    public CascadeService(String topic,
                          CascadeProducer producer,
                          CascadeConsumer consumer,
                          RetryTopicProvisioner provisioner,
                          ServiceCallback serviceCallback,
                          RouteCallback successCallback) {
        this.topic = topic;
        this.producer = producer;
        this.consumer = consumer;
        this.provisioner = provisioner;
        this.serviceCallback = serviceCallback;
        this.successCallback = successCallback != null ? successCallback : RouteCallback.noop();

        producer.on(CascadeEvent.RETRY, message -> events.emit(CascadeEvent.RETRY, message));
        producer.on(CascadeEvent.DLQ, message -> events.emit(CascadeEvent.DLQ, message));
        producer.on(CascadeEvent.ERROR, error -> events.emit(CascadeEvent.ERROR,
                qualify("Error in cascade producer: ", error)));
        consumer.on(CascadeEvent.RECEIVE, message -> events.emit(CascadeEvent.RECEIVE, message));
        consumer.on(CascadeEvent.SERVICE_ERROR, error -> events.emit(CascadeEvent.SERVICE_ERROR, error));
        consumer.on(CascadeEvent.ERROR, error -> events.emit(CascadeEvent.ERROR,
                qualify("Error in cascade consumer: ", error)));
    }

    /**
     * Registers a listener by event name.
     *
     * @throws com.kafkacascade.exception.UnknownEventException if the name is not a cascade event;
     *         nothing is registered in that case
     */
    public void on(String eventName, CascadeEventListener listener) {
        events.on(CascadeEvent.fromName(eventName), listener);
    }

    public void on(CascadeEvent event, CascadeEventListener listener) {
        events.on(event, listener);
    }

    public CompletableFuture<Void> connect() {
        synchronized (stateLock) {
            if (state != ServiceState.DISCONNECTED) {
                log.warn("cascade.connect() called while service is {}", state);
                return CompletableFuture.completedFuture(null);
            }
        }
        // The producer must be able to take retries before the consumer can hand it failures
        return lifecycle("connect", producer.connect()
                .thenCompose(ignored -> consumer.connect())
                .thenRun(() -> {
                    synchronized (stateLock) {
                        state = ServiceState.CONNECTED;
                        pauseState = PauseState.RUNNING;
                    }
                    log.info("Cascade service connected: topic={}", topic);
                    events.emit(CascadeEvent.CONNECT);
                }));
    }

    public CompletableFuture<Void> setRetryLevels(int count) {
        return setRetryLevels(count, RetryProvisioningOptions.none());
    }

    /**
     * Resizes the retry-level list, hands it to the producer and provisions the
     * topics. Must complete before {@link #run()}.
     */
    public CompletableFuture<Void> setRetryLevels(int count, RetryProvisioningOptions options) {
        CompletableFuture<Void> provisioned;
        try {
            List<RetryLevel> levels = resizeRetryLevels(count,
                    options != null ? options : RetryProvisioningOptions.none());
            provisioned = provisioner.provision(topic, levels)
                    .thenAccept(topics -> log.info("Registered {} retry level(s) for {}", levels.size(), topic));
        } catch (RuntimeException e) {
            provisioned = CompletableFuture.failedFuture(e);
        }
        return lifecycle("setRetryLevels", provisioned);
    }

    /**
     * Starts consuming. The RUNNING state is claimed before subscribing, so a
     * concurrent second call is rejected instead of opening another subscription;
     * a failed subscription restores the previous state.
     */
    public CompletableFuture<Void> run() {
        ServiceState previous;
        synchronized (stateLock) {
            previous = state;
            if (previous == ServiceState.CONNECTED || previous == ServiceState.STOPPED) {
                state = ServiceState.RUNNING;
            }
        }
        if (previous != ServiceState.CONNECTED && previous != ServiceState.STOPPED) {
            return lifecycle("run", CompletableFuture.failedFuture(
                    new IllegalStateException("Cannot run while service is " + previous)));
        }
        return lifecycle("run", Futures.invoke(() ->
                        consumer.run(serviceCallback, this::routeSuccess, this::routeFailure))
                .thenCompose(ignored -> isPaused() ? consumer.pause() : CompletableFuture.completedFuture(null))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        synchronized (stateLock) {
                            if (state == ServiceState.RUNNING) {
                                state = previous;
                            }
                        }
                        return;
                    }
                    log.info("Cascade service running: topic={}, retryLevels={}", topic, getRetryTopics().size());
                    events.emit(CascadeEvent.RUN);
                }));
    }

    public CompletableFuture<Void> pause() {
        synchronized (stateLock) {
            if (pauseState == PauseState.PAUSED) {
                log.warn("cascade.pause() called while service is already paused!");
                return CompletableFuture.completedFuture(null);
            }
            pauseState = PauseState.PAUSED;
        }
        return lifecycle("pause", consumer.pause()
                .thenRun(producer::pause)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        setPauseState(PauseState.RUNNING);
                    } else {
                        log.info("Cascade service paused: topic={}", topic);
                        events.emit(CascadeEvent.PAUSE);
                    }
                }));
    }

    public CompletableFuture<Void> resume() {
        synchronized (stateLock) {
            if (pauseState == PauseState.RUNNING) {
                log.warn("cascade.resume() called while service is already running!");
                return CompletableFuture.completedFuture(null);
            }
            pauseState = PauseState.RUNNING;
        }
        return lifecycle("resume", consumer.resume()
                .thenRun(producer::resume)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        setPauseState(PauseState.PAUSED);
                    } else {
                        log.info("Cascade service resumed: topic={}", topic);
                        events.emit(CascadeEvent.RESUME);
                    }
                }));
    }

    /** Stops consumption before production so no failure is routed into a stopped producer. */
    public CompletableFuture<Void> stop() {
        return lifecycle("stop", consumer.stop()
                .thenCompose(ignored -> producer.stop())
                .thenRun(() -> {
                    synchronized (stateLock) {
                        if (state != ServiceState.DISCONNECTED) {
                            state = ServiceState.STOPPED;
                        }
                    }
                    log.info("Cascade service stopped: topic={}", topic);
                    events.emit(CascadeEvent.STOP);
                }));
    }

    public CompletableFuture<Void> disconnect() {
        return lifecycle("disconnect", producer.stop()
                .thenCompose(ignored -> producer.disconnect())
                .thenCompose(ignored -> consumer.disconnect())
                .thenRun(() -> {
                    synchronized (stateLock) {
                        state = ServiceState.DISCONNECTED;
                    }
                    log.info("Cascade service disconnected: topic={}", topic);
                    events.emit(CascadeEvent.DISCONNECT);
                }));
    }

    public ServiceState getState() {
        synchronized (stateLock) {
            if (state == ServiceState.RUNNING && pauseState == PauseState.PAUSED) {
                return ServiceState.PAUSED;
            }
            return state;
        }
    }

    public PauseState getPauseState() {
        synchronized (stateLock) {
            return pauseState;
        }
    }

    public boolean isPaused() {
        return getPauseState() == PauseState.PAUSED;
    }

    int listenerCount(CascadeEvent event) {
        return events.listenerCount(event);
    }

    public String getTopic() {
        return topic;
    }

    public List<String> getRetryTopics() {
        synchronized (retryLock) {
            return retryTopics;
        }
    }

    private List<RetryLevel> resizeRetryLevels(int count, RetryProvisioningOptions options) {
        synchronized (retryLock) {
            retryTopics = RetryTopics.resize(retryTopics, topic, count);
            List<String> names = retryTopics;
            List<RetryLevel> levels = IntStream.rangeClosed(1, count)
                    .mapToObj(level -> RetryLevel.builder()
                            .level(level)
                            .topic(names.get(level - 1))
                            .timeoutLimit(options.timeoutLimitFor(level))
                            .batchLimit(options.batchLimitFor(level))
                            .build())
                    .toList();
            producer.setRetryTopics(levels);
            return levels;
        }
    }

    private CompletionStage<Void> routeSuccess(CascadeMessage message) {
        events.emit(CascadeEvent.SUCCESS, message);
        return Futures.invoke(() -> successCallback.route(message).toCompletableFuture())
                .exceptionally(error -> {
                    events.emit(CascadeEvent.ERROR, qualify("Error in cascade success callback: ", error));
                    return null;
                });
    }

    // A single message's publish failure must not stop the consume loop
    private CompletionStage<Void> routeFailure(CascadeMessage message) {
        return Futures.invoke(() -> producer.send(message))
                .exceptionally(error -> {
                    events.emit(CascadeEvent.ERROR, qualify("Error in cascade producer.send(): ", error));
                    return null;
                });
    }

    private void setPauseState(PauseState value) {
        synchronized (stateLock) {
            pauseState = value;
        }
    }

    private <T> CompletableFuture<T> lifecycle(String operation, CompletableFuture<T> future) {
        return future.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                log.error("Error in cascade.{}(): {}", operation, cause.getMessage());
                events.emit(CascadeEvent.ERROR,
                        new CascadeException("Error in cascade." + operation + "(): " + cause.getMessage(), cause));
            }
        });
    }

    private static CascadeException qualify(String prefix, Object error) {
        if (error instanceof Throwable throwable) {
            Throwable cause = Futures.unwrap(throwable);
            return new CascadeException(prefix + cause.getMessage(), cause);
        }
        return new CascadeException(prefix + error);
    }
}
