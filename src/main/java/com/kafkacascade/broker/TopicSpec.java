package com.kafkacascade.broker;

import lombok.Builder;
import lombok.Value;

/**
 * A topic to provision. Null limits mean broker defaults.
 */
@Value
@Builder
public class TopicSpec {

    String name;
    Integer timeoutLimit;
    Integer batchLimit;
}
