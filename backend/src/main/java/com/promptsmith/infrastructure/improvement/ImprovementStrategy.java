package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;

import java.util.List;

/**
 * Chooses which techniques an {@link ImprovementMethod} applies for a given context.
 */
public interface ImprovementStrategy {

    ImprovementMethod method();

    /**
     * Techniques in application order.
     */
    List<PromptTechnique> techniques(PromptContext context);

    default String reasoning() {
        return method().id();
    }
}
