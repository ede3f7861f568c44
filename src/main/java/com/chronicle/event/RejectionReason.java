package com.chronicle.event;

public enum RejectionReason {
    INVALID_INPUT("invalid_input"),
    TOO_LARGE("too_large"),
    UNKNOWN_EVENT("unknown_event");

    private final String tag;

    RejectionReason(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
