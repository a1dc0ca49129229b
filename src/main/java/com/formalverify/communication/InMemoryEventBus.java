package com.formalverify.communication;

import com.formalverify.core.event.Event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<VerificationEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (VerificationEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                // a broken listener must not fail the request that published
                log.error("[EventBus] Listener {} failed on {}", listener.getClass().getSimpleName(),
                        event.getType(), e);
            }
        }
    }

    @Override
    public void subscribe(VerificationEventListener listener) {
        listeners.add(listener);
    }
}
