package com.kafkacascade.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A message travelling through the cascade.
 *
 * Carries the broker-supplied metadata (topic, partition, offset, headers) and
 * the opaque payload. Headers are kept as raw bytes in broker order, duplicates
 * included. The cascade only ever touches one header, "retries", which counts
 * the retry hops already taken:
 *
 *   t                      → retries absent (0)
 *   t-cascade-retry-1      → retries = 1
 *   t-cascade-retry-2      → retries = 2
 *
 * Instances are immutable; {@link #withRetries(int)} returns an annotated copy.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "payload")
public class CascadeMessage {

    public static final String RETRIES_HEADER = "retries";

    private final String topic;
    private final Integer partition;
    private final Long offset;
    private final String key;
    private final String payload;

    @Singular
    private final List<MessageHeader> headers;

    /**
     * Number of retry hops already taken. Absent or malformed headers count as 0.
     */
    public int getRetries() {
        String value = headerValue(RETRIES_HEADER);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Last header with the given key, or null if there is none.
     */
    public MessageHeader lastHeader(String headerKey) {
        MessageHeader last = null;
        for (MessageHeader header : headers) {
            if (header.getKey().equals(headerKey)) {
                last = header;
            }
        }
        return last;
    }

    /** UTF-8 view of {@link #lastHeader(String)}. */
    public String headerValue(String headerKey) {
        MessageHeader header = lastHeader(headerKey);
        if (header == null || header.getValue() == null) {
            return null;
        }
        return new String(header.getValue(), StandardCharsets.UTF_8);
    }

    /**
     * Copy with every "retries" header replaced by a single one; all other
     * headers keep their bytes and order.
     */
    public CascadeMessage withRetries(int retries) {
        List<MessageHeader> kept = headers.stream()
                .filter(header -> !header.getKey().equals(RETRIES_HEADER))
                .toList();
        return toBuilder()
                .clearHeaders()
                .headers(kept)
                .header(MessageHeader.of(RETRIES_HEADER, Integer.toString(retries)))
                .build();
    }
}
