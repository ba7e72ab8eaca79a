package com.kafkacascade.exception;

/**
 * Raised when a consumer is asked to disconnect while messages are still in flight.
 */
public class DisconnectException extends ConnectionException {

    private final int inFlight;

    public DisconnectException(String message, int inFlight) {
        super(message);
        this.inFlight = inFlight;
    }

    public int getInFlight() {
        return inFlight;
    }
}
