package com.promptsmith.domain.prompt.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Completed evaluation of a prompt.
 *
 * @param overallScore    weighted score in [0, 100]
 * @param scores          per-criterion detail
 * @param recommendations improvement hints, most impactful first
 */
public record EvaluationResult(
        double overallScore,
        Map<Criterion, CriterionScore> scores,
        List<String> recommendations
) implements EvaluationOutcome {

    public EvaluationResult {
        if (overallScore < 0.0 || overallScore > 100.0) {
            throw new IllegalArgumentException("overallScore must be within [0, 100]: " + overallScore);
        }
        scores = scores == null || scores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scores));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Score-only result, used by collaborators that do not report criterion detail.
     */
    public static EvaluationResult ofScore(double overallScore) {
        return new EvaluationResult(overallScore, Map.of(), List.of());
    }
}
