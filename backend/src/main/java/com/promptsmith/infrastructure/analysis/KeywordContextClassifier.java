package com.promptsmith.infrastructure.analysis;

import com.promptsmith.domain.prompt.model.Complexity;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.domain.prompt.service.ContextClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based context detection: frontend/backend vocabulary, complexity and frameworks.
 */
@Slf4j
@Component
public class KeywordContextClassifier implements ContextClassifier {

    private static final List<String> REACT_KEYWORDS = List.of(
            "react", "component", "jsx", "tsx", "hook", "usestate",
            "useeffect", "props", "state", "redux", "next.js"
    );

    private static final List<String> API_KEYWORDS = List.of(
            "api", "endpoint", "rest", "graphql", "backend",
            "server", "route", "request", "response", "fastapi"
    );

    private static final Pattern FRONTEND_HINTS = Pattern.compile("ui|frontend|component|css|html", Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKEND_HINTS = Pattern.compile("backend|server|database|auth", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONNECTIVES = Pattern.compile("and|also|additionally|furthermore", Pattern.CASE_INSENSITIVE);
    private static final Pattern DESIGN_VERBS = Pattern.compile("implement|optimize|refactor|architect|design", Pattern.CASE_INSENSITIVE);

    private static final int HIGH_WORD_COUNT = 100;
    private static final int MEDIUM_WORD_COUNT = 50;
    private static final int MAX_CONNECTIVES = 2;
    private static final int MAX_DESIGN_VERBS = 1;

    // Insertion order is the reporting order
    private static final Map<String, Pattern> FRAMEWORK_PATTERNS = new LinkedHashMap<>();

    static {
        FRAMEWORK_PATTERNS.put("React", Pattern.compile("react|jsx|tsx", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Vue", Pattern.compile("vue", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Angular", Pattern.compile("angular", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Next.js", Pattern.compile("next\\.?js", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Express", Pattern.compile("express", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("FastAPI", Pattern.compile("fastapi", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Django", Pattern.compile("django", Pattern.CASE_INSENSITIVE));
        FRAMEWORK_PATTERNS.put("Rails", Pattern.compile("rails|ruby", Pattern.CASE_INSENSITIVE));
    }

    @Override
    public PromptContext classify(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        String lower = text.toLowerCase(Locale.ROOT);

        boolean isReact = REACT_KEYWORDS.stream().anyMatch(lower::contains);
        boolean isApi = API_KEYWORDS.stream().anyMatch(lower::contains);
        List<String> frameworks = detectFrameworks(text);

        PromptContext context = new PromptContext(
                isReact,
                isReact || FRONTEND_HINTS.matcher(text).find(),
                isApi,
                isApi || BACKEND_HINTS.matcher(text).find(),
                assessComplexity(text),
                frameworks,
                inferProjectType(text, frameworks)
        );
        log.debug("[Classifier] {}", context);
        return context;
    }

    Complexity assessComplexity(String text) {
        String trimmed = text.trim();
        int wordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        boolean multipleRequirements = countMatches(CONNECTIVES, text) > MAX_CONNECTIVES;
        boolean technicalTerms = countMatches(DESIGN_VERBS, text) > MAX_DESIGN_VERBS;

        if (wordCount > HIGH_WORD_COUNT || multipleRequirements || technicalTerms) {
            return Complexity.HIGH;
        }
        if (wordCount > MEDIUM_WORD_COUNT) {
            return Complexity.MEDIUM;
        }
        return Complexity.LOW;
    }

    private List<String> detectFrameworks(String text) {
        List<String> detected = new ArrayList<>();
        FRAMEWORK_PATTERNS.forEach((name, pattern) -> {
            if (pattern.matcher(text).find()) {
                detected.add(name);
            }
        });
        return detected;
    }

    private String inferProjectType(String text, List<String> frameworks) {
        if (frameworks.contains("React") || frameworks.contains("Vue")) {
            return "frontend";
        }
        if (frameworks.contains("FastAPI") || frameworks.contains("Express")) {
            return "backend";
        }
        if (text.contains("full-stack")) {
            return "fullstack";
        }
        return "general";
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
