package com.kafkacascade.demo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.ServiceOutcome;
import com.kafkacascade.service.ServiceCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Stands in for a real downstream service.
 *
 * Each payload carries its own success probability:
 *   {"success": 0.3}  → succeeds on roughly 30% of attempts
 *
 * Payloads without the field use cascade.demo.success-probability.
 * Unparseable payloads fail the callback and surface as serviceError.
 */
@Component
@ConditionalOnProperty(name = "cascade.demo.enabled", havingValue = "true")
public class SimulatedServiceCallback implements ServiceCallback {

    private final ObjectMapper objectMapper;
    private final CascadeProperties properties;
    private final DoubleSupplier random;

    @Autowired
    public SimulatedServiceCallback(ObjectMapper objectMapper, CascadeProperties properties) {
        this(objectMapper, properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    SimulatedServiceCallback(ObjectMapper objectMapper, CascadeProperties properties, DoubleSupplier random) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.random = random;
    }

    @Override
    public CompletionStage<ServiceOutcome> process(CascadeMessage message) {
        try {
            JsonNode payload = objectMapper.readTree(message.getPayload());
            double probability = payload.path("success")
                    .asDouble(properties.getDemo().getSuccessProbability());

            return CompletableFuture.completedFuture(random.getAsDouble() < probability
                    ? ServiceOutcome.success(message)
                    : ServiceOutcome.failure(message));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
