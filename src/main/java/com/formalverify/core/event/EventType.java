package com.formalverify.core.event;

public enum EventType {
    VERIFICATION_STARTED,
    VERIFICATION_COMPLETED,
    VERIFICATION_REJECTED
}
