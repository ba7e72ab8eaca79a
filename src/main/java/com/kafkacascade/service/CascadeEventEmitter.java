package com.kafkacascade.service;

import com.kafkacascade.model.CascadeEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener registry keyed by the closed CascadeEvent set.
 *
 * The map is filled once in the constructor and never restructured, so
 * registration and emission are safe from any thread. A failing listener is
 * logged and does not stop delivery to the others.
 */
@Slf4j
public class CascadeEventEmitter {

    private final Map<CascadeEvent, List<CascadeEventListener>> listeners =
            new EnumMap<>(CascadeEvent.class);

    public CascadeEventEmitter() {
        for (CascadeEvent event : CascadeEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public void on(CascadeEvent event, CascadeEventListener listener) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(listener, "listener");
        listeners.get(event).add(listener);
    }

    public void emit(CascadeEvent event) {
        emit(event, null);
    }

    public void emit(CascadeEvent event, Object payload) {
        for (CascadeEventListener listener : listeners.get(event)) {
            try {
                listener.onEvent(payload);
            } catch (RuntimeException e) {
                log.error("Listener for '{}' failed: {}", event.eventName(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount(CascadeEvent event) {
        return listeners.get(event).size();
    }
}
