package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.DeferredEvaluation;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.model.OrchestrationResult;
import com.promptsmith.domain.prompt.model.OrchestrationStatus;
import com.promptsmith.domain.prompt.model.PhaseMetadata;
import com.promptsmith.domain.prompt.model.PhaseMetadata.AnalysisPhase;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.model.RecordEntry;
import com.promptsmith.domain.prompt.service.CandidateGenerator;
import com.promptsmith.domain.prompt.service.ContextClassifier;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.domain.prompt.service.PatternExtractor;
import com.promptsmith.domain.prompt.service.Recorder;
import com.promptsmith.infrastructure.orchestrator.phase.Phase1Analyzer;
import com.promptsmith.infrastructure.orchestrator.phase.Phase2Improver;
import com.promptsmith.infrastructure.orchestrator.phase.Phase3Finalizer;
import com.promptsmith.infrastructure.orchestrator.phase.Phase4PatternLearner;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Four-phase prompt pipeline:
 * <p>
 * Analyze (classify ∥ score ∥ record) → Improve (fan-out generators, pick best)
 * → Finalize (re-score, record, append history) → Learn (detached pattern extraction)
 * </p>
 * {@link #orchestrate(String)} never throws, except for a {@link VirtualMachineError}.
 * Each instance owns its history and learning guard, so independent instances can be built
 * side by side via {@link #builder()}.
 */
@Slf4j
public class PromptOrchestrator {

    public static final String MDC_KEY = "orchestrationId";

    private final HistoryStore historyStore;
    private final BestEffortRecorder recorder;
    private final Phase1Analyzer phase1;
    private final Phase2Improver phase2;
    private final Phase3Finalizer phase3;
    private final Phase4PatternLearner phase4;
    private final AtomicReference<OrchestratorConfig> config;
    private final Clock clock;
    private final List<ExecutorService> ownedExecutors = new ArrayList<>();

    /**
     * Executors left null are created here and shut down by {@link #shutdown()}.
     */
    @Builder
    private PromptOrchestrator(ContextClassifier contextClassifier,
                               CriteriaScorer criteriaScorer,
                               CandidateGenerator candidateGenerator,
                               Recorder recorder,
                               PatternExtractor patternExtractor,
                               OrchestratorConfig config,
                               HistoryStore historyStore,
                               ExecutorService phaseExecutor,
                               ExecutorService agentCallExecutor,
                               Clock clock) {
        Objects.requireNonNull(contextClassifier, "contextClassifier");
        Objects.requireNonNull(criteriaScorer, "criteriaScorer");
        Objects.requireNonNull(candidateGenerator, "candidateGenerator");
        Objects.requireNonNull(recorder, "recorder");
        Objects.requireNonNull(patternExtractor, "patternExtractor");

        ExecutorService phases = phaseExecutor != null ? phaseExecutor : own("orchestrator");
        ExecutorService agentCalls = agentCallExecutor != null ? agentCallExecutor : own("agent-call");

        this.config = new AtomicReference<>(config != null ? config : OrchestratorConfig.defaults());
        this.historyStore = historyStore != null ? historyStore : new HistoryStore();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.recorder = new BestEffortRecorder(recorder);

        this.phase1 = new Phase1Analyzer(contextClassifier, criteriaScorer, this.recorder, phases, this.clock);
        this.phase2 = new Phase2Improver(candidateGenerator, new TimeoutRetryExecutor(agentCalls), phases);
        this.phase3 = new Phase3Finalizer(criteriaScorer, this.recorder, this.historyStore, this.clock);
        this.phase4 = new Phase4PatternLearner(patternExtractor, this.historyStore, phases);
    }

    public OrchestrationResult orchestrate(String text) {
        long start = System.currentTimeMillis();
        OrchestratorConfig snapshot = config.get();
        MDC.put(MDC_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            log.info("[Orchestrator] Processing prompt ({} chars)", text == null ? 0 : text.length());
            OrchestrationResult result = run(text, snapshot, start);
            log.info("[Orchestrator] {} in {}ms: score {} -> {}, improved={}",
                    result.status(), result.durationMs(), result.originalScore(), result.finalScore(), result.improved());
            return result;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            // Collaborator bugs such as AssertionError or LinkageError end as FAILED as well
            log.error("[Orchestrator] Unexpected failure", e);
            return OrchestrationResult.failure(OrchestrationStatus.FAILED, text, describe(e),
                    System.currentTimeMillis() - start, null);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private OrchestrationResult run(String text, OrchestratorConfig cfg, long start) {
        // 1. Analyze
        Phase1Analyzer.AnalysisResult analysis;
        try {
            analysis = phase1.execute(text, cfg);
        } catch (RuntimeException e) {
            return fallback(text, e, start);
        }
        PromptContext context = analysis.context();
        AnalysisPhase analysisMetadata = new AnalysisPhase(analysis.initialRecorded(), analysis.durationMs());

        if (analysis.evaluation() instanceof DeferredEvaluation deferred) {
            log.info("[Orchestrator] Scoring deferred to {}", deferred.delegate());
            return OrchestrationResult.deferred(text, context, deferred,
                    System.currentTimeMillis() - start, PhaseMetadata.analysisOnly(analysisMetadata));
        }
        EvaluationResult evaluation = (EvaluationResult) analysis.evaluation();
        double originalScore = evaluation.overallScore();

        // 2. Improve
        Phase2Improver.ImprovementDecision decision = phase2.execute(text, originalScore, context, cfg);

        // 3. Finalize
        Phase3Finalizer.FinalizationResult finalization = phase3.execute(text, originalScore, context, decision);

        // 4. Learn (detached)
        boolean learningTriggered = launchLearning(cfg);

        PhaseMetadata metadata = new PhaseMetadata(
                analysisMetadata, decision.metadata(), finalization.metadata(), learningTriggered);
        return new OrchestrationResult(
                true,
                OrchestrationStatus.COMPLETED,
                text,
                finalization.finalText(),
                originalScore,
                finalization.finalScore(),
                decision.improved(),
                context,
                evaluation,
                null,
                null,
                System.currentTimeMillis() - start,
                metadata);
    }

    private OrchestrationResult fallback(String text, RuntimeException cause, long start) {
        log.warn("[Orchestrator] Analysis failed, falling back to basic tracking", cause);
        boolean recorded = recorder.record(new RecordEntry(
                RecordEntry.Kind.FALLBACK, text, null, null, 0.0, null, clock.instant()));
        long duration = System.currentTimeMillis() - start;
        return OrchestrationResult.failure(OrchestrationStatus.FALLBACK, text, describe(cause), duration,
                PhaseMetadata.analysisOnly(new AnalysisPhase(recorded, duration)));
    }

    private boolean launchLearning(OrchestratorConfig cfg) {
        try {
            return phase4.trigger(cfg).isPresent();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Could not start pattern learning", e);
            return false;
        }
    }

    public OrchestratorStatus status() {
        OrchestratorConfig cfg = config.get();
        return new OrchestratorStatus(
                historyStore.size(),
                historyStore.count(e -> e.score() >= cfg.highQuality()),
                phase4.isExtractionInProgress(),
                phase4.completedRuns(),
                phase4.latestReport(),
                cfg);
    }

    public OrchestratorConfig config() {
        return config.get();
    }

    /**
     * Replaces the configuration for orchestrations started after this call.
     */
    public OrchestratorConfig updateConfig(UnaryOperator<OrchestratorConfig> update) {
        OrchestratorConfig updated = config.updateAndGet(update);
        log.info("[Orchestrator] Configuration updated: {}", updated);
        return updated;
    }

    public HistoryStore historyStore() {
        return historyStore;
    }

    public void clearHistory() {
        historyStore.clear();
    }

    public void shutdown() {
        ownedExecutors.forEach(ExecutorService::shutdownNow);
    }

    private ExecutorService own(String prefix) {
        ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory(prefix));
        ownedExecutors.add(executor);
        return executor;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
