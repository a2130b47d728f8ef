package com.promptsmith.domain.prompt.model;

/**
 * Externally visible outcome of one orchestration.
 *
 * @param success       true only for {@link OrchestrationStatus#COMPLETED}
 * @param context       nullable when analysis failed
 * @param evaluation    original evaluation, nullable unless analysis completed
 * @param deferred      delegation request when scoring was deferred, otherwise null
 * @param error         failure message for FALLBACK and FAILED, otherwise null
 */
public record OrchestrationResult(
        boolean success,
        OrchestrationStatus status,
        String originalText,
        String finalText,
        double originalScore,
        double finalScore,
        boolean improved,
        PromptContext context,
        EvaluationResult evaluation,
        DeferredEvaluation deferred,
        String error,
        long durationMs,
        PhaseMetadata phaseMetadata
) {

    public double improvement() {
        return finalScore - originalScore;
    }

    public static OrchestrationResult deferred(String text, PromptContext context, DeferredEvaluation deferred,
                                               long durationMs, PhaseMetadata metadata) {
        return new OrchestrationResult(false, OrchestrationStatus.DEFERRED, text, text, 0.0, 0.0, false,
                context, null, deferred, null, durationMs, metadata);
    }

    public static OrchestrationResult failure(OrchestrationStatus status, String text, String error,
                                              long durationMs, PhaseMetadata metadata) {
        return new OrchestrationResult(false, status, text, text, 0.0, 0.0, false,
                null, null, null, error, durationMs, metadata);
    }
}
