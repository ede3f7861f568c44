package com.chronicle.event;

import java.util.Map;

public final class PreCompactEvent extends HookEvent {

    private final String trigger;
    private final String customInstructions;

    public PreCompactEvent(EventHeader header, String trigger, String customInstructions) {
        super(header);
        this.trigger = trigger != null ? trigger : "auto";
        this.customInstructions = customInstructions;
    }

    /** manual or auto. */
    public String getTrigger() {
        return trigger;
    }

    public String getCustomInstructions() {
        return customInstructions;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("trigger", trigger);
        putIfPresent(data, "custom_instructions", customInstructions);
    }
}
