package com.kafkacascade.exception;

import com.kafkacascade.model.CascadeMessage;

/**
 * The user service callback threw, failed, or did not complete within the
 * configured service timeout. The message is routed as a failure.
 */
public class ServiceException extends CascadeException {

    private final transient CascadeMessage cascadeMessage;

    public ServiceException(String message, CascadeMessage cascadeMessage, Throwable cause) {
        super(message, cause);
        this.cascadeMessage = cascadeMessage;
    }

    public CascadeMessage getCascadeMessage() {
        return cascadeMessage;
    }
}
