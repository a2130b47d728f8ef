package com.promptsmith.application.orchestration;

import com.promptsmith.application.orchestration.exception.PromptValidationException;
import com.promptsmith.domain.prompt.model.ComparisonOutcome;
import com.promptsmith.domain.prompt.model.DeferredEvaluation;
import com.promptsmith.domain.prompt.model.EvaluationOutcome;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.model.OrchestrationResult;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.infrastructure.orchestrator.OrchestratorConfig;
import com.promptsmith.infrastructure.orchestrator.OrchestratorStatus;
import com.promptsmith.infrastructure.orchestrator.PromptOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PromptOrchestrationService {

    static final String COMPARISON_DELEGATE = "prompt-comparison-judge";

    private final PromptOrchestrator orchestrator;
    private final CriteriaScorer criteriaScorer;

    @Value("${orchestrator.max-text-length:20000}")
    private int maxTextLength;

    /**
     * Full four-phase run. Input problems are rejected here; everything after validation
     * is reported through the result status.
     */
    public OrchestrationResult orchestrate(String text) {
        validate(text);
        return orchestrator.orchestrate(text);
    }

    /**
     * Scores a prompt without improving or recording it.
     */
    public EvaluationOutcome evaluate(String text) {
        validate(text);
        return criteriaScorer.evaluate(text);
    }

    /**
     * Scores two prompt versions and reports which is better. When either prompt can only be
     * scored by an external judge, the whole comparison is deferred to the comparison judge.
     */
    public ComparisonOutcome compare(String first, String second) {
        validate(first);
        validate(second);
        EvaluationOutcome firstOutcome = criteriaScorer.evaluate(first);
        EvaluationOutcome secondOutcome = criteriaScorer.evaluate(second);
        if (firstOutcome instanceof EvaluationResult a && secondOutcome instanceof EvaluationResult b) {
            return PromptComparator.compare(a, b);
        }
        log.info("[Orchestration] Comparison deferred to {}", COMPARISON_DELEGATE);
        return new DeferredEvaluation(COMPARISON_DELEGATE,
                "Compare the two prompts and report which one is better and why.",
                Map.of("prompt1", first, "prompt2", second));
    }

    public OrchestratorStatus status() {
        return orchestrator.status();
    }

    public void clearHistory() {
        orchestrator.clearHistory();
        log.info("[Orchestration] History cleared");
    }

    public OrchestratorConfig updateThresholds(double improvementTrigger, double highQuality) {
        return orchestrator.updateConfig(current -> current.toBuilder()
                .improvementTrigger(improvementTrigger)
                .highQuality(highQuality)
                .build());
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new PromptValidationException("Prompt text must not be empty.");
        }
        if (text.length() > maxTextLength) {
            throw new PromptValidationException(
                    String.format("Prompt text is limited to %d characters (got %d).", maxTextLength, text.length()));
        }
    }
}
