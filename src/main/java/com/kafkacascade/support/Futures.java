package com.kafkacascade.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers for composing CompletableFuture chains.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the CompletionException / ExecutionException wrappers added by
     * CompletableFuture and KafkaFuture.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Invokes an async operation, turning a synchronous throw into a failed future.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
