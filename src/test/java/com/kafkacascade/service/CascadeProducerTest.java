package com.kafkacascade.service;

import com.kafkacascade.broker.BrokerProducer;
import com.kafkacascade.exception.PublishException;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.MessageHeader;
import com.kafkacascade.model.RetryLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.backoff.FixedBackOff;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for CascadeProducer, the retry routing decision.
 *
 * Verifies:
 *   - retries = k < N publishes to level k+1 with retries = k+1
 *   - retries >= N goes to the dead-letter route, never to a retry topic
 *   - Publish failures are retried, then surfaced as "error" without failing send()
 *   - Replacing the retry list changes routing for later sends
 */
@ExtendWith(MockitoExtension.class)
class CascadeProducerTest {

    @Mock private BrokerProducer brokerProducer;
    @Mock private RouteCallback deadLetterCallback;

    private CascadeProducer producer;
    private final List<Object> retryEvents = new ArrayList<>();
    private final List<Object> dlqEvents = new ArrayList<>();
    private final List<Object> errorEvents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        producer = newProducer(null, new FixedBackOff(0L, 0L));
        producer.setRetryTopics(levels("orders", 3));
    }

    private CascadeProducer newProducer(String deadLetterTopic, FixedBackOff backOff) {
        CascadeProducer created = new CascadeProducer(brokerProducer, deadLetterCallback, deadLetterTopic, backOff);
        created.on(CascadeEvent.RETRY, retryEvents::add);
        created.on(CascadeEvent.DLQ, dlqEvents::add);
        created.on(CascadeEvent.ERROR, errorEvents::add);
        return created;
    }

    private static List<RetryLevel> levels(String topic, int count) {
        List<RetryLevel> levels = new ArrayList<>();
        for (int level = 1; level <= count; level++) {
            levels.add(RetryLevel.builder().level(level).topic(RetryTopics.topicName(topic, level)).build());
        }
        return levels;
    }

    private static CascadeMessage message(int retries) {
        CascadeMessage message = CascadeMessage.builder()
                .topic("orders")
                .key("order-1")
                .payload("{\"id\":1}")
                .header(MessageHeader.of("trace-id", "abc"))
                .build();
        return retries == 0 ? message : message.withRetries(retries);
    }

    @Test
    @DisplayName("First failure is published to level 1 with retries = 1")
    void firstFailure_goesToLevelOne() {
        when(brokerProducer.publish(anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        producer.send(message(0)).join();

        ArgumentCaptor<CascadeMessage> sent = ArgumentCaptor.forClass(CascadeMessage.class);
        verify(brokerProducer).publish(eq("orders-cascade-retry-1"), sent.capture());
        assertEquals(1, sent.getValue().getRetries());
        assertEquals("{\"id\":1}", sent.getValue().getPayload());
        assertEquals("abc", sent.getValue().headerValue("trace-id"));
        assertEquals(List.of(sent.getValue()), retryEvents);
        verifyNoInteractions(deadLetterCallback);
    }

    @Test
    @DisplayName("Message with retries = k is published to level k+1")
    void retriedMessage_goesToNextLevel() {
        when(brokerProducer.publish(anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        producer.send(message(2)).join();

        ArgumentCaptor<CascadeMessage> sent = ArgumentCaptor.forClass(CascadeMessage.class);
        verify(brokerProducer).publish(eq("orders-cascade-retry-3"), sent.capture());
        assertEquals(3, sent.getValue().getRetries());
    }

    @Test
    @DisplayName("Message that used every level goes to the dead-letter callback")
    void exhaustedMessage_goesToDeadLetter() {
        CascadeMessage exhausted = message(3);
        when(deadLetterCallback.route(exhausted)).thenReturn(CompletableFuture.completedFuture(null));

        producer.send(exhausted).join();

        verify(deadLetterCallback).route(exhausted);
        verify(brokerProducer, never()).publish(anyString(), any());
        assertEquals(List.of(exhausted), dlqEvents);
        assertTrue(retryEvents.isEmpty());
    }

    @Test
    @DisplayName("Dead-letter topic, when configured, is published before the callback runs")
    void deadLetterTopic_isPublishedFirst() {
        CascadeProducer withTopic = newProducer("orders-dlq", new FixedBackOff(0L, 0L));
        CascadeMessage exhausted = message(0);
        when(brokerProducer.publish("orders-dlq", exhausted)).thenReturn(CompletableFuture.completedFuture(null));
        when(deadLetterCallback.route(exhausted)).thenReturn(CompletableFuture.completedFuture(null));

        // no retry levels configured on this producer
        withTopic.send(exhausted).join();

        InOrder inOrder = inOrder(brokerProducer, deadLetterCallback);
        inOrder.verify(brokerProducer).publish("orders-dlq", exhausted);
        inOrder.verify(deadLetterCallback).route(exhausted);
    }

    @Test
    @DisplayName("Publish failure is emitted as error and send() still completes normally")
    void publishFailure_isReportedNotThrown() {
        when(brokerProducer.publish(anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> producer.send(message(0)).join());

        assertEquals(1, errorEvents.size());
        PublishException error = assertInstanceOf(PublishException.class, errorEvents.get(0));
        assertEquals("orders-cascade-retry-1", error.getTopic());
        assertTrue(retryEvents.isEmpty());
    }

    @Test
    @DisplayName("Synchronous throw from the broker client is treated like a failed publish")
    void publishThrowing_isReported() {
        when(brokerProducer.publish(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        producer.send(message(0)).join();

        assertEquals(1, errorEvents.size());
    }

    @Test
    @DisplayName("Transient publish failure is retried with backoff")
    void transientFailure_isRetried() throws Exception {
        CascadeProducer retrying = newProducer(null, new FixedBackOff(0L, 2L));
        retrying.setRetryTopics(levels("orders", 1));
        when(brokerProducer.publish(anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("leader not available")))
                .thenReturn(CompletableFuture.completedFuture(null));

        retrying.send(message(0)).get(5, TimeUnit.SECONDS);

        verify(brokerProducer, times(2)).publish(eq("orders-cascade-retry-1"), any());
        assertEquals(1, retryEvents.size());
        assertTrue(errorEvents.isEmpty());
    }

    @Test
    @DisplayName("Failing dead-letter callback is emitted as error")
    void failingDeadLetterCallback_isReported() {
        CascadeMessage exhausted = message(3);
        when(deadLetterCallback.route(exhausted))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("sink closed")));

        producer.send(exhausted).join();

        assertEquals(1, errorEvents.size());
        assertEquals(1, dlqEvents.size());
    }

    @Test
    @DisplayName("Shrinking the retry list re-routes later sends against the new list")
    void setRetryTopics_replacesList() {
        CascadeMessage second = message(1);
        when(deadLetterCallback.route(second)).thenReturn(CompletableFuture.completedFuture(null));

        producer.setRetryTopics(levels("orders", 1));
        producer.send(second).join();

        verify(deadLetterCallback).route(second);
        assertEquals(List.of("orders-cascade-retry-1"), producer.getRetryTopics());
    }

    @Test
    @DisplayName("Pause flushes pending publishes")
    void pause_flushesProducer() {
        producer.pause();

        verify(brokerProducer).flush();
    }
}
