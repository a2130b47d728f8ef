package com.promptsmith.domain.prompt.model;

import java.time.Instant;

/**
 * Payload handed to a {@code Recorder}.
 *
 * @param score            null for INITIAL entries, which are recorded before scoring finishes
 * @param method           winning method for FINAL entries of improved prompts (nullable)
 * @param scoreImprovement measured or estimated delta, 0 when not improved
 * @param context          nullable for FALLBACK entries
 */
public record RecordEntry(
        Kind kind,
        String text,
        Double score,
        ImprovementMethod method,
        double scoreImprovement,
        PromptContext context,
        Instant timestamp
) {
    public enum Kind {
        INITIAL,
        FINAL,
        FALLBACK
    }
}
