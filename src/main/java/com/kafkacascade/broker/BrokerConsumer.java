package com.kafkacascade.broker;

import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * A consumer bound to one consumer group.
 *
 * The handler's future must complete before the broker treats the record as
 * processed; delivery stays at-least-once.
 */
public interface BrokerConsumer {

    CompletableFuture<Void> connect();

    /** Completes once the subscription is active, not when consumption ends. */
    CompletableFuture<Void> subscribe(Pattern topics, MessageHandler handler);

    CompletableFuture<Void> pause();

    CompletableFuture<Void> resume();

    /** Stops delivery; the record currently being handled is allowed to finish. */
    CompletableFuture<Void> stop();

    /** Safe to call repeatedly. */
    CompletableFuture<Void> disconnect();
}
