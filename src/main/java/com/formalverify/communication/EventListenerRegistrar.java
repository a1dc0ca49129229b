package com.formalverify.communication;

import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class EventListenerRegistrar {

    private final EventBus eventBus;
    private final List<VerificationEventListener> listeners;

    public EventListenerRegistrar(
            EventBus eventBus,
            List<VerificationEventListener> listeners) {
        this.eventBus = eventBus;
        this.listeners = listeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerListeners() {
        for (VerificationEventListener listener : listeners) {
            eventBus.subscribe(listener);
        }
    }
}
