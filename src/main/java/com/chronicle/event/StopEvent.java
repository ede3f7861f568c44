package com.chronicle.event;

import java.util.Map;

public final class StopEvent extends HookEvent {

    private final String reason;
    private final boolean stopHookActive;

    public StopEvent(EventHeader header, String reason, boolean stopHookActive) {
        super(header);
        this.reason = reason != null ? reason : "normal";
        this.stopHookActive = stopHookActive;
    }

    public String getReason() {
        return reason;
    }

    public boolean isStopHookActive() {
        return stopHookActive;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("reason", reason);
        data.put("stop_hook_active", stopHookActive);
    }
}
