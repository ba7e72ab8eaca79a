package com.kafkacascade.exception;

/**
 * A retry or dead-letter publish failed after all attempts.
 */
public class PublishException extends CascadeException {

    private final String topic;

    public PublishException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
