package com.chronicle.event;

import java.util.Map;

public final class SubagentStopEvent extends HookEvent {

    private final boolean stopHookActive;

    public SubagentStopEvent(EventHeader header, boolean stopHookActive) {
        super(header);
        this.stopHookActive = stopHookActive;
    }

    public boolean isStopHookActive() {
        return stopHookActive;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("stop_hook_active", stopHookActive);
    }
}
