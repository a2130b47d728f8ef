package com.promptsmith.domain.prompt.model;

/**
 * What a {@code CriteriaScorer} returns: either a finished score or a request
 * to delegate scoring to an external judge.
 */
public sealed interface EvaluationOutcome permits EvaluationResult, DeferredEvaluation {
}
