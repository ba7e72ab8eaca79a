package com.kafkacascade.demo;

import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.service.CascadeService;
import com.kafkacascade.service.CascadeServiceFactory;
import com.kafkacascade.service.RouteCallback;
import com.kafkacascade.support.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;

/**
 * Starts a cascade over cascade.topic when the application context is up
 * and disconnects it on shutdown.
 *
 * startup: setRetryLevels → connect → run
 */
@Component
@ConditionalOnProperty(name = "cascade.demo.enabled", havingValue = "true")
@Slf4j
public class DemoCascadeRunner implements SmartLifecycle {

    private final CascadeServiceFactory serviceFactory;
    private final SimulatedServiceCallback serviceCallback;
    private final RetryLevelStatistics statistics;
    private final CascadeProperties properties;

    private volatile CascadeService service;
    private volatile boolean running = false;

    public DemoCascadeRunner(CascadeServiceFactory serviceFactory,
                             SimulatedServiceCallback serviceCallback,
                             RetryLevelStatistics statistics,
                             CascadeProperties properties) {
        this.serviceFactory = serviceFactory;
        this.serviceCallback = serviceCallback;
        this.statistics = statistics;
        this.properties = properties;
    }

    @Override
    public void start() {
        CascadeService cascade = serviceFactory.create(serviceCallback,
                RouteCallback.of(statistics::recordSuccess),
                RouteCallback.of(message -> statistics.recordDeadLetter()));
        cascade.on(CascadeEvent.ERROR, error -> log.warn("Cascade error: {}", error));
        cascade.on(CascadeEvent.SERVICE_ERROR, error -> log.debug("Service error: {}", error));

        try {
            cascade.setRetryLevels(properties.getRetryLevels(), serviceFactory.provisioningOptions())
                    .thenCompose(ignored -> cascade.connect())
                    .thenCompose(ignored -> cascade.run())
                    .join();
        } catch (CompletionException e) {
            // Failing here stops application startup, which is what we want for the demo
            throw new IllegalStateException("Cascade demo failed to start", Futures.unwrap(e));
        }

        this.service = cascade;
        this.running = true;
        log.info("Cascade demo listening on {}", properties.getTopic());
    }

    @Override
    public void stop() {
        CascadeService cascade = service;
        if (cascade != null) {
            try {
                cascade.disconnect().join();
            } catch (CompletionException e) {
                log.error("Cascade demo did not disconnect cleanly: {}", Futures.unwrap(e).getMessage());
            }
        }
        this.running = false;
        log.info("Cascade demo stopped. Final counts: {}", statistics.snapshot());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Start last, stop first. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public CascadeService getService() {
        return service;
    }
}
