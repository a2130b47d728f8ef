package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FrontendSpecialistStrategy implements ImprovementStrategy {

    static final List<PromptTechnique> TECHNIQUES = List.of(
            PromptTechnique.COMPONENT_STRUCTURE,
            PromptTechnique.ACCESSIBILITY_FOCUS,
            PromptTechnique.FEW_SHOT_EXAMPLES);

    @Override
    public ImprovementMethod method() {
        return ImprovementMethod.FRONTEND_SPECIALIST;
    }

    @Override
    public List<PromptTechnique> techniques(PromptContext context) {
        return TECHNIQUES;
    }

    @Override
    public String reasoning() {
        return "Added component structure, accessibility and usage examples";
    }
}
