package com.kafkacascade.service;

import com.kafkacascade.broker.Broker;
import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.model.RetryProvisioningOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOff;

/**
 * Builds CascadeService instances against the configured broker.
 *
 * Each service gets its own producer and consumer clients; timeouts, the
 * optional dead-letter topic and the publish backoff come from "cascade.*".
 */
@Component
@RequiredArgsConstructor
public class CascadeServiceFactory {

    private final Broker broker;
    private final CascadeProperties properties;

    public CascadeService create(String topic, String groupId,
                                 ServiceCallback serviceCallback,
                                 RouteCallback successCallback,
                                 RouteCallback deadLetterCallback) {
        CascadeProducer producer = new CascadeProducer(broker.producer(), deadLetterCallback,
                properties.getDeadLetterTopic(), publishBackOff());
        CascadeConsumer consumer = new CascadeConsumer(broker.consumer(groupId), topic, groupId,
                properties.getServiceTimeout(), properties.getDrainTimeout());
        return new CascadeService(topic, producer, consumer, new RetryTopicProvisioner(broker),
                serviceCallback, successCallback);
    }

    /** Uses cascade.topic and cascade.group-id. */
    public CascadeService create(ServiceCallback serviceCallback,
                                 RouteCallback successCallback,
                                 RouteCallback deadLetterCallback) {
        return create(properties.getTopic(), properties.getGroupId(),
                serviceCallback, successCallback, deadLetterCallback);
    }

    public RetryProvisioningOptions provisioningOptions() {
        return RetryProvisioningOptions.builder()
                .timeoutLimit(properties.getProvisioning().getTimeoutLimit())
                .batchLimit(properties.getProvisioning().getBatchLimit())
                .build();
    }

    BackOff publishBackOff() {
        CascadeProperties.Publish publish = properties.getPublish();
        ExponentialBackOffWithMaxRetries backOff =
                new ExponentialBackOffWithMaxRetries(Math.max(0, publish.getMaxAttempts() - 1));
        backOff.setInitialInterval(publish.getInitialIntervalMs());
        backOff.setMultiplier(publish.getMultiplier());
        backOff.setMaxInterval(publish.getMaxIntervalMs());
        return backOff;
    }
}
