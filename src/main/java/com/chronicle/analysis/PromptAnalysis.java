package com.chronicle.analysis;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class PromptAnalysis {

    private final PromptIntent intent;
    private final String securityFlag;
    private final String additionalContext;
    private final String sanitizedPrompt;
    private final int promptLength;

    public PromptAnalysis(PromptIntent intent, String securityFlag, String additionalContext,
            String sanitizedPrompt, int promptLength) {
        this.intent = intent;
        this.securityFlag = securityFlag;
        this.additionalContext = additionalContext;
        this.sanitizedPrompt = sanitizedPrompt;
        this.promptLength = promptLength;
    }

    public PromptIntent getIntent() { return intent; }
    public boolean isDangerous() { return securityFlag != null; }
    public Optional<String> getSecurityFlag() { return Optional.ofNullable(securityFlag); }
    public Optional<String> getAdditionalContext() { return Optional.ofNullable(additionalContext); }
    public String getSanitizedPrompt() { return sanitizedPrompt; }
    public int getPromptLength() { return promptLength; }

    /** Event data stored for a prompt, replacing the raw text. */
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("prompt", sanitizedPrompt);
        data.put("prompt_length", promptLength);
        data.put("intent", intent.getValue());
        data.put("security_flagged", isDangerous());
        getSecurityFlag().ifPresent(f -> data.put("security_reason", f));
        data.put("context_injected", additionalContext != null);
        return data;
    }
}
