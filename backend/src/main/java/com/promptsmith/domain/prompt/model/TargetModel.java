package com.promptsmith.domain.prompt.model;

/**
 * Model family an improved prompt is tuned for.
 */
public enum TargetModel {
    CLAUDE("claude"),
    GPT("gpt"),
    GEMINI("gemini");

    private final String id;

    TargetModel(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
