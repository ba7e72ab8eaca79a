package com.kafkacascade.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Naming rules for retry-level topics.
 *
 * Level N of source topic "orders" is always "orders-cascade-retry-N"
 * (1-indexed). Out-of-band tooling relies on this exact format.
 */
public final class RetryTopics {

    static final String RETRY_INFIX = "-cascade-retry-";

    private RetryTopics() {
    }

    public static String topicName(String sourceTopic, int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Retry levels are 1-indexed, got " + level);
        }
        return sourceTopic + RETRY_INFIX + level;
    }

    /**
     * Resizes a retry-level list. Shrinking truncates from the tail, growing
     * appends; existing entries are kept as they are.
     */
    public static List<String> resize(List<String> current, String sourceTopic, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Retry level count must not be negative: " + count);
        }
        List<String> resized = new ArrayList<>(current.subList(0, Math.min(count, current.size())));
        for (int level = resized.size() + 1; level <= count; level++) {
            resized.add(topicName(sourceTopic, level));
        }
        return List.copyOf(resized);
    }

    /** Matches the retry-level topics of a source topic, not the source itself. */
    public static Pattern retryTopicPattern(String sourceTopic) {
        return Pattern.compile("^" + Pattern.quote(sourceTopic) + Pattern.quote(RETRY_INFIX) + "\\d+$");
    }

    /** Matches the source topic and every one of its retry levels. */
    public static Pattern subscriptionPattern(String sourceTopic) {
        return Pattern.compile("^" + Pattern.quote(sourceTopic) + "(" + Pattern.quote(RETRY_INFIX) + "\\d+)?$");
    }
}
