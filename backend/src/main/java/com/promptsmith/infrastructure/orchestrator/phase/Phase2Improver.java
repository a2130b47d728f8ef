package com.promptsmith.infrastructure.orchestrator.phase;

import com.promptsmith.domain.prompt.model.ContextFlag;
import com.promptsmith.domain.prompt.model.ImprovementCandidate;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PhaseMetadata.AttemptStatus;
import com.promptsmith.domain.prompt.model.PhaseMetadata.ImprovementPhase;
import com.promptsmith.domain.prompt.model.PhaseMetadata.MethodAttempt;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.service.CandidateGenerator;
import com.promptsmith.infrastructure.orchestrator.CallOutcome;
import com.promptsmith.infrastructure.orchestrator.MdcPropagation;
import com.promptsmith.infrastructure.orchestrator.OrchestratorConfig;
import com.promptsmith.infrastructure.orchestrator.TimeoutRetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Phase 2: conditional fan-out of candidate generation and selection of the best candidate.
 */
@Slf4j
@RequiredArgsConstructor
public class Phase2Improver {

    private final CandidateGenerator candidateGenerator;
    private final TimeoutRetryExecutor retryExecutor;
    private final Executor executor;

    /**
     * @param winner nullable when nothing improved
     */
    public record ImprovementDecision(ImprovementCandidate winner, ImprovementPhase metadata) {

        public boolean improved() {
            return winner != null;
        }
    }

    public ImprovementDecision execute(String text, double currentScore, PromptContext context,
                                       OrchestratorConfig config) {
        if (currentScore >= config.improvementTrigger()) {
            log.info("[Phase2] Score {} meets trigger {}, skipping improvement",
                    currentScore, config.improvementTrigger());
            return new ImprovementDecision(null, ImprovementPhase.skippedPhase());
        }

        List<ImprovementMethod> methods = selectMethods(context, config);
        log.info("[Phase2] Score {} below trigger {}, dispatching {}",
                currentScore, config.improvementTrigger(), methods);

        List<CompletableFuture<CallOutcome<ImprovementCandidate>>> futures = methods.stream()
                .map(method -> CompletableFuture.supplyAsync(MdcPropagation.supplier(() -> retryExecutor.call(
                        method.id(),
                        () -> candidateGenerator.generate(text, context, method, currentScore),
                        config.timeoutMs(),
                        config.retryOnFailure())), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<MethodAttempt> attempts = new ArrayList<>(methods.size());
        ImprovementCandidate best = null;
        int succeeded = 0;

        // methods is in selection order, so a strict comparison keeps the earliest on ties
        for (int i = 0; i < methods.size(); i++) {
            ImprovementMethod method = methods.get(i);
            CallOutcome<ImprovementCandidate> outcome = futures.get(i).join();

            if (!outcome.succeeded()) {
                attempts.add(new MethodAttempt(method, AttemptStatus.FAILED, outcome.calls(), outcome.timedOut(), 0.0));
                continue;
            }

            ImprovementCandidate candidate = outcome.value();
            if (!isUsable(candidate)) {
                double delta = candidate == null ? 0.0 : candidate.scoreImprovement();
                attempts.add(new MethodAttempt(method, AttemptStatus.NO_IMPROVEMENT, outcome.calls(), outcome.timedOut(), delta));
                continue;
            }

            succeeded++;
            attempts.add(new MethodAttempt(method, AttemptStatus.SUCCEEDED, outcome.calls(), outcome.timedOut(),
                    candidate.scoreImprovement()));
            if (best == null || candidate.scoreImprovement() > best.scoreImprovement()) {
                best = candidate.method() == method
                        ? candidate
                        : new ImprovementCandidate(candidate.text(), method, candidate.scoreImprovement(), candidate.reasoning());
            }
        }

        if (best == null) {
            log.warn("[Phase2] No usable candidates from {} attempts", methods.size());
        } else {
            log.info("[Phase2] Best candidate: method={}, scoreImprovement={} ({} of {} succeeded)",
                    best.method(), best.scoreImprovement(), succeeded, methods.size());
        }

        ImprovementPhase metadata = new ImprovementPhase(false, methods, methods.size(), succeeded,
                best == null ? null : best.method(), attempts);
        return new ImprovementDecision(best, metadata);
    }

    /**
     * Merges the method lists of every flag present on the context, in {@link ContextFlag} order,
     * and drops duplicates. A high-complexity prompt that already drew two or more methods also gets
     * the coordinator. An empty selection falls back to the default list; the result is truncated to
     * the concurrency limit.
     */
    static List<ImprovementMethod> selectMethods(PromptContext context, OrchestratorConfig config) {
        Set<ContextFlag> flags = context.flags();
        Set<ImprovementMethod> selected = new LinkedHashSet<>();
        for (ContextFlag flag : ContextFlag.values()) {
            if (flags.contains(flag)) {
                selected.addAll(config.agentSelection().getOrDefault(flag, List.of()));
            }
        }
        if (flags.contains(ContextFlag.HIGH_COMPLEXITY)
                && config.coordinatorMethod() != null
                && selected.size() > 1) {
            selected.add(config.coordinatorMethod());
        }
        if (selected.isEmpty()) {
            selected.addAll(config.fallbackMethods());
        }
        return selected.stream()
                .limit(config.maxConcurrentAgents())
                .toList();
    }

    private static boolean isUsable(ImprovementCandidate candidate) {
        return candidate != null
                && candidate.text() != null
                && !candidate.text().isBlank()
                && candidate.scoreImprovement() > 0;
    }
}
