package com.chronicle.event;

import java.util.Map;

public final class NotificationEvent extends HookEvent {

    private final String message;

    public NotificationEvent(EventHeader header, String message) {
        super(header);
        this.message = message != null ? message : "";
    }

    public String getMessage() {
        return message;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("message", message);
    }
}
