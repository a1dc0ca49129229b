package com.formalverify.communication;

import com.formalverify.core.event.Event;

public interface EventBus {

    void publish(Event event);

    void subscribe(VerificationEventListener listener);
}
