package com.promptsmith.infrastructure.learning;

import com.promptsmith.domain.prompt.model.HistoryEntry;
import com.promptsmith.domain.prompt.model.PatternReport;
import com.promptsmith.domain.prompt.model.PromptPattern;
import com.promptsmith.domain.prompt.service.PatternExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds structural features shared by high-scoring prompts.
 */
@Slf4j
@Component
public class FeaturePatternExtractor implements PatternExtractor {

    static final double MIN_FREQUENCY = 0.3;

    enum Feature {
        XML_TAGS("xml-tags", "Sections delimited by XML tags",
                Pattern.compile("<\\w+>.*</\\w+>", Pattern.DOTALL),
                "Wrap the task and its constraints in XML tags"),
        MARKDOWN_HEADERS("markdown-headers", "Markdown section headers",
                Pattern.compile("^#{1,3}\\s+.+", Pattern.MULTILINE),
                "Organize long prompts under markdown headers"),
        NUMBERED_LISTS("numbered-lists", "Numbered step lists",
                Pattern.compile("^\\d+\\.\\s+.+", Pattern.MULTILINE),
                "List requirements or steps as a numbered list"),
        EXAMPLES("examples", "Inline examples",
                Pattern.compile("<example>|Example:|For example|e\\.g\\.", Pattern.CASE_INSENSITIVE),
                "Include concrete examples of input and expected output"),
        REASONING("reasoning", "Step-by-step reasoning cues",
                Pattern.compile("<thinking>|step by step|Let me think", Pattern.CASE_INSENSITIVE),
                "Ask for step-by-step reasoning before the answer"),
        EXPLICIT_REQUIREMENTS("explicit-requirements", "MUST/SHOULD requirement keywords",
                Pattern.compile("\\bMUST\\b|\\bSHOULD\\b|\\bREQUIRED\\b"),
                "State hard requirements with MUST and SHOULD"),
        OUTPUT_FORMAT("output-format", "Explicit output format",
                Pattern.compile("<output>|output format|return (?:a|the) JSON|in JSON", Pattern.CASE_INSENSITIVE),
                "Specify the exact output format"),
        CODE_FENCES("code-fences", "Fenced code blocks",
                Pattern.compile("```"),
                "Show code or data shapes in fenced blocks");

        private final String id;
        private final String description;
        private final Pattern pattern;
        private final String recommendation;

        Feature(String id, String description, Pattern pattern, String recommendation) {
            this.id = id;
            this.description = description;
            this.pattern = pattern;
            this.recommendation = recommendation;
        }

        boolean presentIn(String text) {
            return text != null && pattern.matcher(text).find();
        }
    }

    @Override
    public PatternReport extract(List<HistoryEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return PatternReport.empty();
        }
        int total = entries.size();

        List<PromptPattern> patterns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        for (Feature feature : Feature.values()) {
            long hits = entries.stream().filter(e -> feature.presentIn(e.text())).count();
            double frequency = (double) hits / total;
            if (frequency >= MIN_FREQUENCY) {
                patterns.add(new PromptPattern(feature.id, feature.description, frequency));
            }
        }
        patterns.sort(Comparator.comparingDouble(PromptPattern::frequency).reversed());
        for (PromptPattern pattern : patterns) {
            recommendations.add(recommendationFor(pattern.name()));
        }

        double averageScore = entries.stream().mapToDouble(HistoryEntry::score).average().orElse(0.0);
        log.info("[Learning] {} pattern(s) found across {} prompts, average score {}",
                patterns.size(), total, String.format("%.1f", averageScore));
        return new PatternReport(patterns, total, averageScore, recommendations);
    }

    private static String recommendationFor(String id) {
        for (Feature feature : Feature.values()) {
            if (feature.id.equals(id)) {
                return feature.recommendation;
            }
        }
        throw new IllegalArgumentException("Unknown feature: " + id);
    }
}
