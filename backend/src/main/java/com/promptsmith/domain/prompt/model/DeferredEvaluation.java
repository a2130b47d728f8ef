package com.promptsmith.domain.prompt.model;

import java.util.Map;

/**
 * Scoring that could not complete synchronously and must be resolved by an external delegate.
 *
 * @param delegate    identifier of the judge expected to resolve it
 * @param instruction human-readable instruction for the delegate
 * @param payload     opaque task description forwarded untouched
 */
public record DeferredEvaluation(
        String delegate,
        String instruction,
        Map<String, Object> payload
) implements EvaluationOutcome, ComparisonOutcome {

    public DeferredEvaluation {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
