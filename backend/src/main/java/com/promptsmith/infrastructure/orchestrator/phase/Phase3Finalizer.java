package com.promptsmith.infrastructure.orchestrator.phase;

import com.promptsmith.domain.prompt.model.EvaluationOutcome;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.model.HistoryEntry;
import com.promptsmith.domain.prompt.model.ImprovementCandidate;
import com.promptsmith.domain.prompt.model.PhaseMetadata.FinalizationPhase;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.model.RecordEntry;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.infrastructure.orchestrator.BestEffortRecorder;
import com.promptsmith.infrastructure.orchestrator.HistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Phase 3: re-scores the winning candidate, records the outcome and appends it to history.
 */
@Slf4j
@RequiredArgsConstructor
public class Phase3Finalizer {

    private static final double MAX_SCORE = 100.0;

    private final CriteriaScorer criteriaScorer;
    private final BestEffortRecorder recorder;
    private final HistoryStore historyStore;
    private final Clock clock;

    /**
     * @param finalEvaluation evaluation of the winning candidate, null if not improved or re-scoring failed
     */
    public record FinalizationResult(
            String finalText,
            double finalScore,
            EvaluationResult finalEvaluation,
            FinalizationPhase metadata
    ) {}

    public FinalizationResult execute(String originalText, double originalScore, PromptContext context,
                                      Phase2Improver.ImprovementDecision decision) {
        String finalText = originalText;
        double finalScore = originalScore;
        EvaluationResult finalEvaluation = null;
        boolean rescored = false;

        ImprovementCandidate winner = decision.winner();
        if (winner != null) {
            finalText = winner.text();
            finalEvaluation = rescore(winner);
            if (finalEvaluation != null) {
                finalScore = finalEvaluation.overallScore();
                rescored = true;
            } else {
                finalScore = Math.min(MAX_SCORE, originalScore + winner.scoreImprovement());
                log.info("[Phase3] Using estimated score {} for {}", finalScore, winner.method());
            }
        }

        Instant now = clock.instant();
        boolean recorded = recorder.record(new RecordEntry(
                RecordEntry.Kind.FINAL,
                finalText,
                finalScore,
                winner == null ? null : winner.method(),
                finalScore - originalScore,
                context,
                now));

        int historySize = historyStore.append(new HistoryEntry(finalText, finalScore, now, context));

        log.info("[Phase3] Final score {} ({}{})", finalScore,
                finalScore >= originalScore ? "+" : "", finalScore - originalScore);
        return new FinalizationResult(finalText, finalScore, finalEvaluation,
                new FinalizationPhase(rescored, recorded, historySize));
    }

    private EvaluationResult rescore(ImprovementCandidate winner) {
        try {
            EvaluationOutcome outcome = criteriaScorer.evaluate(winner.text());
            if (outcome instanceof EvaluationResult result) {
                return result;
            }
            log.info("[Phase3] Re-scoring of {} was deferred", winner.method());
        } catch (RuntimeException e) {
            log.warn("[Phase3] Re-scoring of {} failed", winner.method(), e);
        }
        return null;
    }
}
