package com.kafkacascade.model;

import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * One broker header, value kept as the raw bytes the broker delivered.
 * A null value is a valid header value and is preserved as null.
 */
@Value
public class MessageHeader {

    String key;
    byte[] value;

    public static MessageHeader of(String key, String value) {
        return new MessageHeader(key, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }
}
