package com.kafkacascade.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CascadeMessageTest {

    private CascadeMessage.CascadeMessageBuilder message() {
        return CascadeMessage.builder()
                .topic("orders")
                .partition(0)
                .offset(42L)
                .key("order-1")
                .payload("{\"id\":1}");
    }

    @Test
    @DisplayName("Missing retries header counts as zero")
    void getRetries_absent() {
        assertEquals(0, message().build().getRetries());
    }

    @Test
    @DisplayName("Malformed or negative retries header counts as zero")
    void getRetries_malformed() {
        assertEquals(0, message().header(MessageHeader.of("retries", "abc")).build().getRetries());
        assertEquals(0, message().header(MessageHeader.of("retries", "-2")).build().getRetries());
        assertEquals(0, message().header(MessageHeader.of("retries", " ")).build().getRetries());
        assertEquals(3, message().header(MessageHeader.of("retries", " 3 ")).build().getRetries());
    }

    @Test
    @DisplayName("withRetries returns a copy and leaves the original untouched")
    void withRetries_copies() {
        CascadeMessage original = message().header(MessageHeader.of("trace-id", "abc")).build();

        CascadeMessage retried = original.withRetries(2);

        assertEquals(2, retried.getRetries());
        assertEquals(0, original.getRetries());
        assertEquals("abc", retried.headerValue("trace-id"));
        assertEquals(original.getPayload(), retried.getPayload());
        assertEquals(original.getKey(), retried.getKey());
    }

    @Test
    @DisplayName("withRetries replaces an existing retries header")
    void withRetries_replaces() {
        CascadeMessage retried = message().header(MessageHeader.of("retries", "1")).build().withRetries(2);

        assertEquals("2", retried.headerValue(CascadeMessage.RETRIES_HEADER));
    }

    @Test
    @DisplayName("withRetries collapses repeated retries headers and keeps the others in order")
    void withRetries_keepsOtherHeaders() {
        byte[] traceId = {-1, -2, 0, 1};
        CascadeMessage original = message()
                .header(new MessageHeader("trace", traceId))
                .header(MessageHeader.of("retries", "1"))
                .header(new MessageHeader("tag", null))
                .header(MessageHeader.of("retries", "2"))
                .header(MessageHeader.of("tag", "b"))
                .build();

        CascadeMessage retried = original.withRetries(3);

        assertEquals(List.of(
                new MessageHeader("trace", traceId),
                new MessageHeader("tag", null),
                MessageHeader.of("tag", "b"),
                MessageHeader.of("retries", "3")), retried.getHeaders());
        assertEquals(2, original.getRetries());
    }
}
