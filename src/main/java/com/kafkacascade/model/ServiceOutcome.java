package com.kafkacascade.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Result of one service callback invocation: the message either succeeded or failed.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ServiceOutcome {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    private final Status status;
    private final CascadeMessage message;

    public static ServiceOutcome success(CascadeMessage message) {
        return new ServiceOutcome(Status.SUCCESS, message);
    }

    public static ServiceOutcome failure(CascadeMessage message) {
        return new ServiceOutcome(Status.FAILURE, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
