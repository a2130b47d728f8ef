package com.promptsmith.domain.prompt.model;

import java.util.List;

/**
 * What happened in each phase of one orchestration. Phases that did not run are null.
 */
public record PhaseMetadata(
        AnalysisPhase analysis,
        ImprovementPhase improvement,
        FinalizationPhase finalization,
        boolean learningTriggered
) {

    public static PhaseMetadata analysisOnly(AnalysisPhase analysis) {
        return new PhaseMetadata(analysis, null, null, false);
    }

    public record AnalysisPhase(boolean initialRecorded, long durationMs) {}

    /**
     * @param skipped         true when the original score met the improvement trigger
     * @param selectedMethods methods chosen for the context, in selection order
     * @param attempted       number of generator calls dispatched
     * @param succeeded       number of calls that produced a positive improvement
     * @param winningMethod   nullable when nothing improved
     */
    public record ImprovementPhase(
            boolean skipped,
            List<ImprovementMethod> selectedMethods,
            int attempted,
            int succeeded,
            ImprovementMethod winningMethod,
            List<MethodAttempt> attempts
    ) {
        public ImprovementPhase {
            selectedMethods = selectedMethods == null ? List.of() : List.copyOf(selectedMethods);
            attempts = attempts == null ? List.of() : List.copyOf(attempts);
        }

        public static ImprovementPhase skippedPhase() {
            return new ImprovementPhase(true, List.of(), 0, 0, null, List.of());
        }
    }

    /**
     * @param calls number of generator invocations, at most 2
     */
    public record MethodAttempt(
            ImprovementMethod method,
            AttemptStatus status,
            int calls,
            boolean timedOut,
            double scoreImprovement
    ) {}

    public enum AttemptStatus {
        SUCCEEDED,
        NO_IMPROVEMENT,
        FAILED
    }

    public record FinalizationPhase(boolean rescored, boolean recorded, int historySize) {}
}
