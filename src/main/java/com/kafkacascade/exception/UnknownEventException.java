package com.kafkacascade.exception;

/**
 * Thrown synchronously when subscribing to an event name outside the fixed set.
 */
public class UnknownEventException extends CascadeException {

    public UnknownEventException(String eventName) {
        super("Unknown event: " + eventName);
    }
}
