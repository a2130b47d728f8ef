package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.ImprovementCandidate;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.service.CandidateGenerator;
import com.promptsmith.infrastructure.orchestrator.OrchestrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches each {@link ImprovementMethod} to its {@link ImprovementStrategy}, then tunes the
 * result for the method's {@link com.promptsmith.domain.prompt.model.TargetModel}.
 * Every method must have exactly one strategy or the registry refuses to start.
 */
@Slf4j
@Component
public class CandidateGeneratorRegistry implements CandidateGenerator {

    static final double POINTS_PER_TECHNIQUE = 10.0;
    private static final double MAX_SCORE = 100.0;

    private final Map<ImprovementMethod, ImprovementStrategy> strategies = new EnumMap<>(ImprovementMethod.class);
    private final TechniqueApplier applier;

    public CandidateGeneratorRegistry(List<ImprovementStrategy> strategies, TechniqueApplier applier) {
        this.applier = applier;
        for (ImprovementStrategy strategy : strategies) {
            ImprovementStrategy previous = this.strategies.put(strategy.method(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy for " + strategy.method()
                        + ": " + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
            }
        }
        for (ImprovementMethod method : ImprovementMethod.values()) {
            if (!this.strategies.containsKey(method)) {
                throw new IllegalStateException("No improvement strategy registered for " + method);
            }
        }
        log.info("[Generator] Registered strategies: {}", this.strategies.keySet());
    }

    @Override
    public ImprovementCandidate generate(String text, PromptContext context, ImprovementMethod method, double currentScore) {
        ImprovementStrategy strategy = strategies.get(method);
        String improved = text;
        int changed = 0;
        List<PromptTechnique> techniques = new ArrayList<>(strategy.techniques(context));
        techniques.addAll(PromptTechnique.forModel(method.targetModel()));
        for (PromptTechnique technique : techniques) {
            if (Thread.currentThread().isInterrupted()) {
                throw new OrchestrationException("Generation interrupted for " + method.id());
            }
            String next = applier.apply(technique, improved);
            if (!next.equals(improved)) {
                changed++;
                improved = next;
            }
        }

        double headroom = Math.max(0.0, MAX_SCORE - currentScore);
        double improvement = Math.min(changed * POINTS_PER_TECHNIQUE, headroom);
        log.debug("[Generator] {} applied {} technique(s) for {}, estimated +{}",
                method.id(), changed, method.targetModel().id(), improvement);
        return new ImprovementCandidate(improved, method, improvement,
                strategy.reasoning() + " (tuned for " + method.targetModel().id() + ")");
    }
}
