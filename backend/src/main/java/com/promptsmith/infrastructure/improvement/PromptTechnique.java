package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.TargetModel;

import java.util.List;

/**
 * Individual rewrite techniques a strategy can apply to a prompt.
 * The trailing group is model specific and applied after a strategy's own techniques.
 */
public enum PromptTechnique {
    CLARITY,
    XML_STRUCTURE,
    CHAIN_OF_THOUGHT,
    FEW_SHOT_EXAMPLES,
    SUCCESS_CRITERIA,
    ERROR_HANDLING,
    VALIDATION_EMPHASIS,
    COMPONENT_STRUCTURE,
    ACCESSIBILITY_FOCUS,

    ROLE_SETTING,
    ALIGNMENT_PRINCIPLES,
    ANSWER_QUALITY,
    SYSTEM_MESSAGE,
    RESPONSE_FORMAT,
    PARAMETER_HINTS,
    SAFETY_SETTINGS,
    GROUNDING;

    private static final List<PromptTechnique> CLAUDE = List.of(ROLE_SETTING, ALIGNMENT_PRINCIPLES, ANSWER_QUALITY);
    private static final List<PromptTechnique> GPT = List.of(SYSTEM_MESSAGE, RESPONSE_FORMAT, PARAMETER_HINTS);
    private static final List<PromptTechnique> GEMINI = List.of(SAFETY_SETTINGS, GROUNDING);

    /**
     * Model-specific techniques in application order.
     */
    public static List<PromptTechnique> forModel(TargetModel model) {
        return switch (model) {
            case CLAUDE -> CLAUDE;
            case GPT -> GPT;
            case GEMINI -> GEMINI;
        };
    }
}
