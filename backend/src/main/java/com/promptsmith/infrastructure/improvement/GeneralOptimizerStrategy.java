package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.Complexity;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class GeneralOptimizerStrategy implements ImprovementStrategy {

    @Override
    public ImprovementMethod method() {
        return ImprovementMethod.GENERAL_OPTIMIZER;
    }

    @Override
    public List<PromptTechnique> techniques(PromptContext context) {
        List<PromptTechnique> techniques = new ArrayList<>(List.of(
                PromptTechnique.CLARITY,
                PromptTechnique.XML_STRUCTURE,
                PromptTechnique.SUCCESS_CRITERIA));
        if (context.complexity() == Complexity.HIGH) {
            techniques.add(PromptTechnique.CHAIN_OF_THOUGHT);
            techniques.add(PromptTechnique.FEW_SHOT_EXAMPLES);
        }
        return techniques;
    }

    @Override
    public String reasoning() {
        return "Clarified requirements, added task structure and success criteria";
    }
}
