package com.kafkacascade.model;

/**
 * Lifecycle of a CascadeService.
 * DISCONNECTED → CONNECTED → RUNNING ⇄ PAUSED → STOPPED → DISCONNECTED
 */
public enum ServiceState {
    DISCONNECTED,
    CONNECTED,
    RUNNING,
    PAUSED,
    STOPPED
}
