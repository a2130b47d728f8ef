package com.promptsmith.infrastructure.analysis;

import com.promptsmith.domain.prompt.model.Criterion;
import com.promptsmith.domain.prompt.model.DeferredEvaluation;
import com.promptsmith.domain.prompt.model.EvaluationOutcome;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands every evaluation to an external LLM judge instead of scoring locally.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "orchestrator.scoring.mode", havingValue = "llm-judge")
public class JudgeDelegatingCriteriaScorer implements CriteriaScorer {

    static final String DELEGATE = "prompt-evaluation-judge";
    static final String INSTRUCTION =
            "Evaluate the prompt on each criterion from 0 to 1 and return the weighted overall score (0-100) "
                    + "with per-criterion feedback and recommendations.";

    @Override
    public EvaluationOutcome evaluate(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }

        Map<String, Double> criteria = new LinkedHashMap<>();
        for (Criterion criterion : Criterion.values()) {
            criteria.put(criterion.key(), criterion.weight());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", text);
        payload.put("criteria", criteria);
        payload.put("scale", "0-1 per criterion, 0-100 overall");

        log.info("[Scorer] Deferring evaluation to {}", DELEGATE);
        return new DeferredEvaluation(DELEGATE, INSTRUCTION, payload);
    }
}
