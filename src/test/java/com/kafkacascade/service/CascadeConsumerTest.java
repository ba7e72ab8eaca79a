package com.kafkacascade.service;

import com.kafkacascade.broker.BrokerConsumer;
import com.kafkacascade.broker.MessageHandler;
import com.kafkacascade.exception.DisconnectException;
import com.kafkacascade.exception.ServiceException;
import com.kafkacascade.model.CascadeEvent;
import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.ServiceOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for CascadeConsumer, the success/failure classification.
 *
 * The broker consumer is a mock; the handler it receives on subscribe is
 * captured and fed messages directly.
 */
@ExtendWith(MockitoExtension.class)
class CascadeConsumerTest {

    @Mock private BrokerConsumer brokerConsumer;

    private final List<CascadeMessage> successes = new CopyOnWriteArrayList<>();
    private final List<CascadeMessage> failures = new CopyOnWriteArrayList<>();
    private final List<Object> received = new CopyOnWriteArrayList<>();
    private final List<Object> serviceErrors = new CopyOnWriteArrayList<>();

    private CascadeMessage message;

    @BeforeEach
    void setUp() {
        message = CascadeMessage.builder().topic("orders").offset(42L).payload("{}").build();
    }

    private CascadeConsumer newConsumer(Duration serviceTimeout, Duration drainTimeout) {
        CascadeConsumer consumer = new CascadeConsumer(brokerConsumer, "orders", "orders-group",
                serviceTimeout, drainTimeout);
        consumer.on(CascadeEvent.RECEIVE, received::add);
        consumer.on(CascadeEvent.SERVICE_ERROR, serviceErrors::add);
        return consumer;
    }

    private MessageHandler run(CascadeConsumer consumer, ServiceCallback callback) {
        when(brokerConsumer.subscribe(any(Pattern.class), any(MessageHandler.class)))
                .thenReturn(CompletableFuture.completedFuture(null));

        consumer.run(callback, RouteCallback.of(successes::add), RouteCallback.of(failures::add)).join();

        ArgumentCaptor<MessageHandler> handler = ArgumentCaptor.forClass(MessageHandler.class);
        verify(brokerConsumer).subscribe(any(Pattern.class), handler.capture());
        return handler.getValue();
    }

    @Test
    @DisplayName("Subscription covers the source topic and its retry levels only")
    void run_subscribesToSourceAndRetryTopics() {
        when(brokerConsumer.subscribe(any(Pattern.class), any(MessageHandler.class)))
                .thenReturn(CompletableFuture.completedFuture(null));

        newConsumer(null, Duration.ZERO).run(m -> null, RouteCallback.noop(), RouteCallback.noop()).join();

        ArgumentCaptor<Pattern> pattern = ArgumentCaptor.forClass(Pattern.class);
        verify(brokerConsumer).subscribe(pattern.capture(), any(MessageHandler.class));
        assertTrue(pattern.getValue().matcher("orders").matches());
        assertTrue(pattern.getValue().matcher("orders-cascade-retry-7").matches());
        assertFalse(pattern.getValue().matcher("orders-archive").matches());
    }

    @Test
    @DisplayName("Resolved message goes to onSuccess after a receive event")
    void resolved_routesToSuccess() {
        MessageHandler handler = run(newConsumer(null, Duration.ZERO),
                m -> CompletableFuture.completedFuture(ServiceOutcome.success(m)));

        handler.handle(message).toCompletableFuture().join();

        assertEquals(List.of(message), received);
        assertEquals(List.of(message), successes);
        assertTrue(failures.isEmpty());
    }

    @Test
    @DisplayName("Rejected message goes to onFailure")
    void rejected_routesToFailure() {
        MessageHandler handler = run(newConsumer(null, Duration.ZERO),
                m -> CompletableFuture.completedFuture(ServiceOutcome.failure(m)));

        handler.handle(message).toCompletableFuture().join();

        assertEquals(List.of(message), failures);
        assertTrue(serviceErrors.isEmpty());
    }

    @Test
    @DisplayName("Continuation-style callback is adapted to the same routing")
    void continuationCallback_isSupported() {
        MessageHandler handler = run(newConsumer(null, Duration.ZERO),
                ServiceCallback.fromContinuation((m, resolve, reject) -> reject.accept(m)));

        handler.handle(message).toCompletableFuture().join();

        assertEquals(List.of(message), failures);
    }

    @Test
    @DisplayName("Callback throwing synchronously emits serviceError and counts as failure")
    void throwingCallback_isServiceError() {
        MessageHandler handler = run(newConsumer(null, Duration.ZERO), m -> {
            throw new IllegalArgumentException("bad payload");
        });

        assertDoesNotThrow(() -> handler.handle(message).toCompletableFuture().join());

        assertEquals(List.of(message), failures);
        ServiceException error = assertInstanceOf(ServiceException.class, serviceErrors.get(0));
        assertSame(message, error.getCascadeMessage());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    @DisplayName("Callback completing exceptionally emits serviceError and counts as failure")
    void failedCallback_isServiceError() {
        MessageHandler handler = run(newConsumer(null, Duration.ZERO),
                m -> CompletableFuture.failedFuture(new IllegalStateException("downstream 503")));

        handler.handle(message).toCompletableFuture().join();

        assertEquals(1, serviceErrors.size());
        assertEquals(List.of(message), failures);
    }

    @Test
    @DisplayName("Callback that never completes times out when a service timeout is set")
    void hangingCallback_timesOut() throws Exception {
        MessageHandler handler = run(newConsumer(Duration.ofMillis(50), Duration.ZERO),
                m -> new CompletableFuture<>());

        handler.handle(message).toCompletableFuture().get(5, TimeUnit.SECONDS);

        ServiceException error = assertInstanceOf(ServiceException.class, serviceErrors.get(0));
        assertInstanceOf(TimeoutException.class, error.getCause());
        assertEquals(List.of(message), failures);
    }

    @Test
    @DisplayName("Failing success route is reported as error, never thrown to the broker")
    void failingRoute_isReported() {
        List<Object> errors = new CopyOnWriteArrayList<>();
        CascadeConsumer consumer = newConsumer(null, Duration.ZERO);
        consumer.on(CascadeEvent.ERROR, errors::add);
        when(brokerConsumer.subscribe(any(Pattern.class), any(MessageHandler.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
        consumer.run(m -> CompletableFuture.completedFuture(ServiceOutcome.success(m)),
                m -> CompletableFuture.failedFuture(new IllegalStateException("sink down")),
                RouteCallback.noop()).join();
        ArgumentCaptor<MessageHandler> handler = ArgumentCaptor.forClass(MessageHandler.class);
        verify(brokerConsumer).subscribe(any(Pattern.class), handler.capture());

        assertDoesNotThrow(() -> handler.getValue().handle(message).toCompletableFuture().join());

        assertEquals(1, errors.size());
        assertEquals(0, consumer.getInFlight());
    }

    @Test
    @DisplayName("Disconnect stops consumption before releasing the connection")
    void disconnect_stopsThenDisconnects() {
        when(brokerConsumer.stop()).thenReturn(CompletableFuture.completedFuture(null));
        when(brokerConsumer.disconnect()).thenReturn(CompletableFuture.completedFuture(null));

        newConsumer(null, Duration.ZERO).disconnect().join();

        InOrder inOrder = inOrder(brokerConsumer);
        inOrder.verify(brokerConsumer).stop();
        inOrder.verify(brokerConsumer).disconnect();
    }

    @Test
    @DisplayName("Disconnect fails with DisconnectException while a message is in flight")
    void disconnect_withInFlight_fails() {
        CascadeConsumer consumer = newConsumer(null, Duration.ofMillis(50));
        MessageHandler handler = run(consumer, m -> new CompletableFuture<>());
        handler.handle(message);
        when(brokerConsumer.stop()).thenReturn(CompletableFuture.completedFuture(null));

        CompletionException error = assertThrows(CompletionException.class, () -> consumer.disconnect().join());

        DisconnectException cause = assertInstanceOf(DisconnectException.class, error.getCause());
        assertEquals(1, cause.getInFlight());
        verify(brokerConsumer, never()).disconnect();
    }
}
