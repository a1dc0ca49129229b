package com.formalverify.communication;

import com.formalverify.core.event.Event;

public interface VerificationEventListener {

    void onEvent(Event event);
}
