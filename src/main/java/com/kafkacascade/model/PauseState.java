package com.kafkacascade.model;

public enum PauseState {
    RUNNING,
    PAUSED
}
