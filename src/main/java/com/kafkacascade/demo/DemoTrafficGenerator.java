package com.kafkacascade.demo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kafkacascade.config.CascadeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Feeds the demo cascade with a steady stream of messages and periodically
 * logs where they ended up.
 */
@Component
@ConditionalOnProperty(name = "cascade.demo.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoTrafficGenerator {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CascadeProperties properties;
    private final DemoCascadeRunner runner;
    private final RetryLevelStatistics statistics;

    @Scheduled(fixedDelayString = "${cascade.demo.message-interval-ms:100}")
    public void publishDemoMessage() {
        if (!runner.isRunning() || runner.getService().isPaused()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(Map.of(
                    "success", properties.getDemo().getSuccessProbability(),
                    "time", System.currentTimeMillis()));
            kafkaTemplate.send(properties.getTopic(), payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize demo message: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelay = 10_000)
    public void reportStatistics() {
        if (runner.isRunning()) {
            log.info("Cascade demo counts (by retries, last = dlq): {}", statistics.snapshot());
        }
    }
}
