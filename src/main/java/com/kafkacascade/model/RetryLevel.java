package com.kafkacascade.model;

import lombok.Builder;
import lombok.Value;

/**
 * One topic in the cascade. Levels are 1-indexed; the limits are optional
 * provisioning hints and are never read by the routing logic.
 */
@Value
@Builder
public class RetryLevel {

    int level;
    String topic;
    Integer timeoutLimit;
    Integer batchLimit;
}
