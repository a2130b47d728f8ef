package com.promptsmith.infrastructure.orchestrator.phase;

import com.promptsmith.domain.prompt.model.EvaluationOutcome;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.model.RecordEntry;
import com.promptsmith.domain.prompt.service.ContextClassifier;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.infrastructure.orchestrator.BestEffortRecorder;
import com.promptsmith.infrastructure.orchestrator.MdcPropagation;
import com.promptsmith.infrastructure.orchestrator.OrchestrationException;
import com.promptsmith.infrastructure.orchestrator.OrchestratorConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Phase 1: classification, scoring and (optionally) initial recording, run in parallel.
 */
@Slf4j
@RequiredArgsConstructor
public class Phase1Analyzer {

    private final ContextClassifier contextClassifier;
    private final CriteriaScorer criteriaScorer;
    private final BestEffortRecorder recorder;
    private final Executor executor;
    private final Clock clock;

    public record AnalysisResult(
            PromptContext context,
            EvaluationOutcome evaluation,
            boolean initialRecorded,
            long durationMs
    ) {}

    /**
     * @throws OrchestrationException if classification or scoring fails or returns nothing
     */
    public AnalysisResult execute(String text, OrchestratorConfig config) {
        long start = System.currentTimeMillis();
        log.info("[Phase1] Parallel analysis");

        CompletableFuture<PromptContext> contextFuture = CompletableFuture.supplyAsync(
                MdcPropagation.supplier(() -> contextClassifier.classify(text)), executor);
        CompletableFuture<EvaluationOutcome> evaluationFuture = CompletableFuture.supplyAsync(
                MdcPropagation.supplier(() -> criteriaScorer.evaluate(text)), executor);
        CompletableFuture<Boolean> recordFuture = config.recordInitial()
                ? CompletableFuture.supplyAsync(MdcPropagation.supplier(() -> recorder.record(
                        new RecordEntry(RecordEntry.Kind.INITIAL, text, null, null, 0.0, null, clock.instant()))),
                        executor)
                : CompletableFuture.completedFuture(false);

        PromptContext context;
        EvaluationOutcome evaluation;
        try {
            CompletableFuture.allOf(contextFuture, evaluationFuture).join();
            context = contextFuture.join();
            evaluation = evaluationFuture.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OrchestrationException("Analysis failed: " + cause.getMessage(), cause);
        }

        if (context == null) {
            throw new OrchestrationException("Context classifier returned no context");
        }
        if (evaluation == null) {
            throw new OrchestrationException("Criteria scorer returned no evaluation");
        }

        boolean recorded = recordFuture.join();
        long duration = System.currentTimeMillis() - start;
        log.info("[Phase1] Done in {}ms: complexity={}, flags={}, evaluation={}",
                duration, context.complexity(), context.flags(), evaluation.getClass().getSimpleName());

        return new AnalysisResult(context, evaluation, recorded, duration);
    }
}
