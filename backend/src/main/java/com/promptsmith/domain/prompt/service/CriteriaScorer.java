package com.promptsmith.domain.prompt.service;

import com.promptsmith.domain.prompt.model.EvaluationOutcome;

/**
 * Scores prompt text against the evaluation criteria.
 */
public interface CriteriaScorer {

    /**
     * @return a finished {@code EvaluationResult}, or a {@code DeferredEvaluation}
     *         when scoring must be delegated to an external judge
     */
    EvaluationOutcome evaluate(String text);
}
