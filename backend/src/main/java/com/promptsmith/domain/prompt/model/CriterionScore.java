package com.promptsmith.domain.prompt.model;

/**
 * @param rawScore    normalized score in [0, 1]
 * @param weight      weight of the criterion in the overall score
 * @param description what the criterion measures
 */
public record CriterionScore(double rawScore, double weight, String description) {

    public CriterionScore {
        if (rawScore < 0.0 || rawScore > 1.0) {
            throw new IllegalArgumentException("rawScore must be within [0, 1]: " + rawScore);
        }
    }
}
