package com.promptsmith.domain.prompt.service;

import com.promptsmith.domain.prompt.model.ImprovementCandidate;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;

/**
 * Produces an improved variant of a prompt using a named method.
 * Implementations may be slow or fail; the orchestrator always calls them through
 * its timeout/retry combinator and interrupts calls that time out.
 */
public interface CandidateGenerator {

    /**
     * @param currentScore score of {@code text}, used to bound the estimated improvement
     */
    ImprovementCandidate generate(String text, PromptContext context, ImprovementMethod method, double currentScore);
}
