package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.ContextFlag;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines the general techniques with those of every specialist relevant to the context.
 */
@Component
@RequiredArgsConstructor
public class LlmCoordinatorStrategy implements ImprovementStrategy {

    private final GeneralOptimizerStrategy general;
    private final FrontendSpecialistStrategy frontend;
    private final ApiExpertStrategy api;

    @Override
    public ImprovementMethod method() {
        return ImprovementMethod.LLM_COORDINATOR;
    }

    @Override
    public List<PromptTechnique> techniques(PromptContext context) {
        Set<ContextFlag> flags = context.flags();
        Set<PromptTechnique> combined = new LinkedHashSet<>(general.techniques(context));
        if (flags.contains(ContextFlag.FRONTEND)) {
            combined.addAll(frontend.techniques(context));
        }
        if (flags.contains(ContextFlag.BACKEND)) {
            combined.addAll(api.techniques(context));
        }
        return List.copyOf(combined);
    }

    @Override
    public String reasoning() {
        return "Coordinated general and specialist techniques for the detected context";
    }
}
