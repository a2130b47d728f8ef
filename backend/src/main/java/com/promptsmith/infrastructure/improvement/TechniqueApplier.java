package com.promptsmith.infrastructure.improvement;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a single {@link PromptTechnique}. Every technique is idempotent: text that already
 * shows the technique is returned unchanged, so callers can count changed techniques.
 */
@Component
public class TechniqueApplier {

    private static final Pattern HAS_REQUIREMENTS = Pattern.compile("MUST|REQUIRED|<requirements>");
    private static final Pattern HAS_XML = Pattern.compile("<task>.*</task>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern TASK_BLOCK = Pattern.compile("(<task>.*?</task>)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_THINKING = Pattern.compile("<thinking>|Let me think|step by step", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_EXAMPLES = Pattern.compile("<example>|<examples>|Example:|For example", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_SUCCESS_CRITERIA = Pattern.compile("<success_criteria>|success criteria", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_ERROR_HANDLING = Pattern.compile("<error_handling>|edge case", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_VALIDATION = Pattern.compile("<validation>|sanitize", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_COMPONENT_STRUCTURE = Pattern.compile("<component_structure>|props interface", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_ACCESSIBILITY = Pattern.compile("<accessibility>|aria-|WCAG", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_ROLE = Pattern.compile("<role>|You are");
    private static final Pattern HAS_PRINCIPLES = Pattern.compile("<principles>|(?=.*\\bhelpful\\b)(?=.*\\bhonest\\b)",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_ANSWER_QUALITY = Pattern.compile("<answer_quality>");
    private static final Pattern HAS_SYSTEM_MESSAGE = Pattern.compile("\\ASystem:|\"role\":\\s*\"system\"");
    private static final Pattern HAS_RESPONSE_FORMAT = Pattern.compile("<response_format>|response_format");
    private static final Pattern HAS_PARAMETER_HINTS = Pattern.compile("<parameters>|temperature", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_SAFETY = Pattern.compile("## Safety Settings|safety[_ ]settings", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_GROUNDING = Pattern.compile("## Grounding|\\bgrounding\\b", Pattern.CASE_INSENSITIVE);

    private static final String REQUIREMENTS = """
            <requirements>
            - The solution MUST satisfy every requirement stated above.
            - Behaviour that is not specified SHOULD follow the conventions of the surrounding code.
            - Optional enhancements MAY be suggested separately.
            </requirements>""";

    private static final String THINKING = """
            <thinking>
            Let me break down this task step by step:
            1. First, analyze the core requirements
            2. Then, identify the key components needed
            3. Next, plan the implementation approach
            4. Finally, verify that all requirements are met
            </thinking>""";

    private static final String EXAMPLES = """
            <examples>
            <example>
            Input: a minimal, valid request
            Reasoning: the happy path needs no special handling
            Output: the expected result in the requested format
            </example>
            <example>
            Input: a request with missing or malformed fields
            Reasoning: invalid input must be reported, not silently accepted
            Output: a clear error describing what is wrong
            </example>
            </examples>""";

    private static final String SUCCESS_CRITERIA = """
            <success_criteria>
            - All stated requirements are implemented
            - The output follows the requested format
            - Boundary inputs are covered by the solution
            </success_criteria>""";

    private static final String ERROR_HANDLING = """
            <error_handling>
            - Describe how each failure mode and edge case is handled
            - Return meaningful error messages instead of failing silently
            - Recover gracefully where possible
            </error_handling>""";

    private static final String VALIDATION = """
            <validation>
            - Validate and sanitize all inputs at the boundary
            - Reject requests that violate the documented contract
            </validation>""";

    private static final String COMPONENT_STRUCTURE = """
            <component_structure>
            - Define a typed props interface for every component
            - Keep state local and lift it only when it is shared
            - Split presentational and stateful logic
            </component_structure>""";

    private static final String ACCESSIBILITY = """
            <accessibility>
            - Use semantic HTML elements and aria- attributes where needed
            - Support keyboard navigation and visible focus states
            - Meet WCAG 2.1 AA contrast requirements
            </accessibility>""";

    private static final String ROLE = """
            <role>
            You are an expert assistant with deep knowledge in the relevant domain.
            Apply established practices and industry standards in your response.
            </role>""";

    private static final String PRINCIPLES = """
            <principles>
            - Be helpful, harmless and honest in your response
            - Provide accurate and reliable information
            - Stay objective and avoid bias
            </principles>""";

    private static final String ANSWER_QUALITY = """
            <answer_quality>
            Ensure your response is:
            - Comprehensive and addresses all aspects of the task
            - Well organised and easy to follow
            - Technically accurate and practical
            </answer_quality>""";

    private static final String SYSTEM_PREFIX = """
            System: You are a precise assistant. Follow the user's instructions exactly and state any assumption you make.

            User:""";

    private static final String RESPONSE_FORMAT = """
            <response_format>
            Return a single JSON object:
            {"summary": string, "result": string, "notes": [string]}
            </response_format>""";

    private static final String PARAMETER_HINTS = """
            <parameters>
            temperature: 0.2
            top_p: 0.9
            </parameters>""";

    private static final String SAFETY = """
            ## Safety Settings
            - Harassment, hate speech and dangerous content: block only high-probability matches
            - Keep technical discussion of security topics allowed""";

    private static final String GROUNDING = """
            ## Grounding and Citations
            1. Base answers on reliable, up-to-date sources
            2. Cite references for specific facts or figures
            3. State your confidence for each claim""";

    public String apply(PromptTechnique technique, String text) {
        return switch (technique) {
            case CLARITY -> append(text, HAS_REQUIREMENTS, REQUIREMENTS);
            case XML_STRUCTURE -> wrapInTask(text);
            case CHAIN_OF_THOUGHT -> insertThinking(text);
            case FEW_SHOT_EXAMPLES -> append(text, HAS_EXAMPLES, EXAMPLES);
            case SUCCESS_CRITERIA -> append(text, HAS_SUCCESS_CRITERIA, SUCCESS_CRITERIA);
            case ERROR_HANDLING -> append(text, HAS_ERROR_HANDLING, ERROR_HANDLING);
            case VALIDATION_EMPHASIS -> append(text, HAS_VALIDATION, VALIDATION);
            case COMPONENT_STRUCTURE -> append(text, HAS_COMPONENT_STRUCTURE, COMPONENT_STRUCTURE);
            case ACCESSIBILITY_FOCUS -> append(text, HAS_ACCESSIBILITY, ACCESSIBILITY);
            case ROLE_SETTING -> prepend(text, HAS_ROLE, ROLE + "\n\n");
            case ALIGNMENT_PRINCIPLES -> append(text, HAS_PRINCIPLES, PRINCIPLES);
            case ANSWER_QUALITY -> append(text, HAS_ANSWER_QUALITY, ANSWER_QUALITY);
            case SYSTEM_MESSAGE -> prepend(text, HAS_SYSTEM_MESSAGE, SYSTEM_PREFIX + " ");
            case RESPONSE_FORMAT -> append(text, HAS_RESPONSE_FORMAT, RESPONSE_FORMAT);
            case PARAMETER_HINTS -> append(text, HAS_PARAMETER_HINTS, PARAMETER_HINTS);
            case SAFETY_SETTINGS -> append(text, HAS_SAFETY, SAFETY);
            case GROUNDING -> append(text, HAS_GROUNDING, GROUNDING);
        };
    }

    private String append(String text, Pattern present, String section) {
        if (present.matcher(text).find()) {
            return text;
        }
        return text.stripTrailing() + "\n\n" + section;
    }

    private String prepend(String text, Pattern present, String section) {
        if (present.matcher(text).find()) {
            return text;
        }
        return section + text.strip();
    }

    private String wrapInTask(String text) {
        if (HAS_XML.matcher(text).find()) {
            return text;
        }
        return "<task>\n" + text.strip() + "\n</task>";
    }

    // After the task block when there is one, otherwise at the top
    private String insertThinking(String text) {
        if (HAS_THINKING.matcher(text).find()) {
            return text;
        }
        Matcher task = TASK_BLOCK.matcher(text);
        if (task.find()) {
            return text.substring(0, task.end()) + "\n\n" + THINKING + text.substring(task.end());
        }
        return THINKING + "\n\n" + text;
    }
}
