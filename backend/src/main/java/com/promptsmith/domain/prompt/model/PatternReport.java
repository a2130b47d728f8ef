package com.promptsmith.domain.prompt.model;

import java.util.List;

/**
 * Result of analyzing high-scoring history entries.
 */
public record PatternReport(
        List<PromptPattern> patterns,
        int totalAnalyzed,
        double averageScore,
        List<String> recommendations
) {
    public PatternReport {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static PatternReport empty() {
        return new PatternReport(List.of(), 0, 0.0, List.of());
    }
}
