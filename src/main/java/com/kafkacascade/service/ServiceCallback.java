package com.kafkacascade.service;

import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.ServiceOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * The business processing applied to every consumed message.
 *
 * The returned stage may complete at any later time. A synchronous throw or
 * an exceptional completion is reported as a serviceError and routed as a
 * failure.
 */
@FunctionalInterface
public interface ServiceCallback {

    CompletionStage<ServiceOutcome> process(CascadeMessage message);

    /**
     * Adapts a callback written against explicit resolve/reject continuations:
     *
     *   ServiceCallback.fromContinuation((msg, resolve, reject) -> {
     *       if (handled(msg)) resolve.accept(msg); else reject.accept(msg);
     *   });
     *
     * The first continuation invoked wins; later calls are ignored.
     */
    static ServiceCallback fromContinuation(ContinuationCallback callback) {
        return message -> {
            CompletableFuture<ServiceOutcome> outcome = new CompletableFuture<>();
            try {
                callback.process(message,
                        resolved -> outcome.complete(ServiceOutcome.success(resolved != null ? resolved : message)),
                        rejected -> outcome.complete(ServiceOutcome.failure(rejected != null ? rejected : message)));
            } catch (Exception e) {
                outcome.completeExceptionally(e);
            }
            return outcome;
        };
    }

    @FunctionalInterface
    interface ContinuationCallback {

        void process(CascadeMessage message,
                     Consumer<CascadeMessage> resolve,
                     Consumer<CascadeMessage> reject) throws Exception;
    }
}
