package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.ContextFlag;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import lombok.Builder;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable orchestrator settings. A running orchestration keeps the instance it started with;
 * updates produce a new instance via {@link #toBuilder()}.
 *
 * @param improvementTrigger   scores below this are improved
 * @param highQuality          scores at or above this count toward pattern learning
 * @param patternExtractionMin high-quality history entries needed before learning runs
 * @param maxConcurrentAgents  upper bound on generator calls per orchestration
 * @param timeoutMs            per-call timeout for the first generator attempt
 * @param retryOnFailure       retry a timed-out or failed call once, without timeout
 * @param recordInitial        record the incoming prompt during analysis
 * @param agentSelection       ordered method lists per context flag
 * @param fallbackMethods      methods used when no flag selects any
 * @param coordinatorMethod    added for high-complexity prompts once two or more methods are selected;
 *                             {@code null} disables coordination
 */
@Builder(toBuilder = true)
public record OrchestratorConfig(
        double improvementTrigger,
        double highQuality,
        int patternExtractionMin,
        int maxConcurrentAgents,
        long timeoutMs,
        boolean retryOnFailure,
        boolean recordInitial,
        Map<ContextFlag, List<ImprovementMethod>> agentSelection,
        List<ImprovementMethod> fallbackMethods,
        ImprovementMethod coordinatorMethod
) {

    public OrchestratorConfig {
        requireScore("improvementTrigger", improvementTrigger);
        requireScore("highQuality", highQuality);
        if (patternExtractionMin < 0) {
            throw new IllegalArgumentException("patternExtractionMin must not be negative: " + patternExtractionMin);
        }
        if (maxConcurrentAgents < 1) {
            throw new IllegalArgumentException("maxConcurrentAgents must be at least 1: " + maxConcurrentAgents);
        }
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (fallbackMethods == null || fallbackMethods.isEmpty()) {
            throw new IllegalArgumentException("fallbackMethods must not be empty");
        }

        EnumMap<ContextFlag, List<ImprovementMethod>> selection = new EnumMap<>(ContextFlag.class);
        if (agentSelection != null) {
            agentSelection.forEach((flag, methods) -> selection.put(flag, methods == null ? List.of() : List.copyOf(methods)));
        }
        agentSelection = Collections.unmodifiableMap(selection);
        fallbackMethods = List.copyOf(fallbackMethods);
    }

    public static OrchestratorConfig defaults() {
        EnumMap<ContextFlag, List<ImprovementMethod>> selection = new EnumMap<>(ContextFlag.class);
        selection.put(ContextFlag.HIGH_COMPLEXITY,
                List.of(ImprovementMethod.GENERAL_OPTIMIZER));
        selection.put(ContextFlag.FRONTEND, List.of(ImprovementMethod.FRONTEND_SPECIALIST));
        selection.put(ContextFlag.BACKEND, List.of(ImprovementMethod.API_EXPERT));

        return OrchestratorConfig.builder()
                .improvementTrigger(70)
                .highQuality(85)
                .patternExtractionMin(10)
                .maxConcurrentAgents(5)
                .timeoutMs(5000)
                .retryOnFailure(true)
                .recordInitial(true)
                .agentSelection(selection)
                .fallbackMethods(List.of(ImprovementMethod.GENERAL_OPTIMIZER))
                .coordinatorMethod(ImprovementMethod.LLM_COORDINATOR)
                .build();
    }

    /**
     * Parses a comma-separated method list such as {@code "GENERAL_OPTIMIZER, api-expert"}.
     */
    public static List<ImprovementMethod> parseMethods(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(ImprovementMethod::parse)
                .toList();
    }

    private static void requireScore(String name, double value) {
        if (value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be within [0, 100]: " + value);
        }
    }
}
