package com.chronicle.event;

import java.util.Map;

public final class SessionStartEvent extends HookEvent {

    private final String source;

    public SessionStartEvent(EventHeader header, String source) {
        super(header);
        this.source = source != null ? source : "unknown";
    }

    /** startup, resume, clear or unknown. */
    public String getSource() {
        return source;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("source", source);
    }
}
