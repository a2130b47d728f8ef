package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ApiExpertStrategy implements ImprovementStrategy {

    static final List<PromptTechnique> TECHNIQUES = List.of(
            PromptTechnique.ERROR_HANDLING,
            PromptTechnique.VALIDATION_EMPHASIS,
            PromptTechnique.SUCCESS_CRITERIA);

    @Override
    public ImprovementMethod method() {
        return ImprovementMethod.API_EXPERT;
    }

    @Override
    public List<PromptTechnique> techniques(PromptContext context) {
        return TECHNIQUES;
    }

    @Override
    public String reasoning() {
        return "Added error handling, input validation and success criteria";
    }
}
