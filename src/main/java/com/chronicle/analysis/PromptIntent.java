package com.chronicle.analysis;

public enum PromptIntent {
    CODE_GENERATION("code_generation"),
    CODE_MODIFICATION("code_modification"),
    DEBUGGING("debugging"),
    EXPLANATION("explanation"),
    CONFIGURATION("configuration"),
    GENERAL("general");

    private final String value;

    PromptIntent(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
