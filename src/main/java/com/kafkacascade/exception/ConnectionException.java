package com.kafkacascade.exception;

/**
 * Broker unreachable or rejected the client while connecting or disconnecting.
 */
public class ConnectionException extends CascadeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
