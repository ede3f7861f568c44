package com.chronicle.event;

import java.util.Map;

public final class PromptEvent extends HookEvent {

    private final String prompt;

    public PromptEvent(EventHeader header, String prompt) {
        super(header);
        this.prompt = prompt != null ? prompt : "";
    }

    public String getPrompt() {
        return prompt;
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("prompt", prompt);
    }
}
