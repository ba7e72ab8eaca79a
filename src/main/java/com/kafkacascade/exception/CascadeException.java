package com.kafkacascade.exception;

/**
 * Base type for every failure raised by the cascade engine.
 *
 * Lifecycle operations complete their futures exceptionally with one of the
 * subclasses AND emit it on the "error" event, so callers get both signals.
 */
public class CascadeException extends RuntimeException {

    public CascadeException(String message) {
        super(message);
    }

    public CascadeException(String message, Throwable cause) {
        super(message, cause);
    }
}
