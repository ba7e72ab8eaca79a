package com.kafkacascade.exception;

/**
 * Creating or listing retry-level topics through the admin client failed.
 */
public class ProvisioningException extends CascadeException {

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
