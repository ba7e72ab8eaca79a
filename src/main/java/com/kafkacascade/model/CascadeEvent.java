package com.kafkacascade.model;

import com.kafkacascade.exception.UnknownEventException;

import java.util.Arrays;

/**
 * The closed set of events a CascadeService publishes.
 *
 * Lifecycle:  connect, disconnect, run, stop, pause, resume
 * Per message: receive, success, retry, dlq
 * Failures:   error, serviceError
 */
public enum CascadeEvent {
    CONNECT("connect"),
    DISCONNECT("disconnect"),
    RUN("run"),
    STOP("stop"),
    PAUSE("pause"),
    RESUME("resume"),
    RECEIVE("receive"),
    SUCCESS("success"),
    RETRY("retry"),
    DLQ("dlq"),
    ERROR("error"),
    SERVICE_ERROR("serviceError");

    private final String eventName;

    CascadeEvent(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }

    /**
     * Resolves an event by its published name ("serviceError", not "SERVICE_ERROR").
     *
     * @throws UnknownEventException if the name is not one of the twelve events
     */
    public static CascadeEvent fromName(String name) {
        return Arrays.stream(values())
                .filter(e -> e.eventName.equals(name))
                .findFirst()
                .orElseThrow(() -> new UnknownEventException(name));
    }
}
