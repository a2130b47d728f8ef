package com.promptsmith.domain.prompt.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of candidate-generation strategies.
 */
public enum ImprovementMethod {
    GENERAL_OPTIMIZER("general-optimizer", TargetModel.CLAUDE),
    FRONTEND_SPECIALIST("frontend-specialist", TargetModel.CLAUDE),
    API_EXPERT("api-expert", TargetModel.GPT),
    LLM_COORDINATOR("llm-coordinator", TargetModel.CLAUDE);

    private final String id;
    private final TargetModel targetModel;

    ImprovementMethod(String id, TargetModel targetModel) {
        this.id = id;
        this.targetModel = targetModel;
    }

    public String id() {
        return id;
    }

    public TargetModel targetModel() {
        return targetModel;
    }

    /**
     * Accepts either the enum name or the external id, case-insensitively.
     */
    public static ImprovementMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Improvement method must not be blank");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(normalized) || m.id.equals(normalized.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown improvement method: " + value));
    }
}
