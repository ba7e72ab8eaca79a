package com.kafkacascade.service;

import com.kafkacascade.model.CascadeMessage;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Terminal sink for a routed message (success or dead letter).
 */
@FunctionalInterface
public interface RouteCallback {

    CompletionStage<Void> route(CascadeMessage message);

    static RouteCallback of(Consumer<CascadeMessage> action) {
        return message -> {
            action.accept(message);
            return CompletableFuture.completedFuture(null);
        };
    }

    static RouteCallback noop() {
        return message -> CompletableFuture.completedFuture(null);
    }
}
