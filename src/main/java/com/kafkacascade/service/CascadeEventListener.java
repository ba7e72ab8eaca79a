package com.kafkacascade.service;

/**
 * Receives one cascade event. The payload depends on the event:
 * a CascadeMessage for receive/success/retry/dlq, a CascadeException for
 * error/serviceError, and null for lifecycle events.
 */
@FunctionalInterface
public interface CascadeEventListener {

    void onEvent(Object payload);
}
