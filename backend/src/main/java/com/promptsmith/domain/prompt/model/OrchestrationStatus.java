package com.promptsmith.domain.prompt.model;

public enum OrchestrationStatus {
    /** All phases ran; the only status with {@code success == true}. */
    COMPLETED,
    /** Scoring was delegated to an external judge; nothing was generated. */
    DEFERRED,
    /** Classification or scoring failed; a fallback entry was recorded. */
    FALLBACK,
    /** Unexpected internal error. */
    FAILED
}
