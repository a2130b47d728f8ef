package com.promptsmith.domain.prompt.service;

import com.promptsmith.domain.prompt.model.PromptContext;

/**
 * Inspects raw prompt text and describes it.
 */
public interface ContextClassifier {

    /**
     * @throws RuntimeException on failure; the orchestrator falls back to its minimal path
     */
    PromptContext classify(String text);
}
