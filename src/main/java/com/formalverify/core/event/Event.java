package com.formalverify.core.event;

import java.time.Instant;
import java.util.UUID;

public class Event {

    private final String eventId;
    private final EventType type;
    private final String source;

    // started: action count, completed: the report, rejected: the reason
    private final Object payload;

    private final Instant timestamp;

    public Event(EventType type, String source, Object payload) {
        this.eventId = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
