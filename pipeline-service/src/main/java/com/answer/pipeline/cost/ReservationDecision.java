package com.answer.pipeline.cost;

public enum ReservationDecision {
    ALLOWED,
    DENIED;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
