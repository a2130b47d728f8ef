package com.promptsmith.infrastructure.analysis;

import com.promptsmith.domain.prompt.model.Criterion;
import com.promptsmith.domain.prompt.model.CriterionScore;
import com.promptsmith.domain.prompt.model.EvaluationOutcome;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex heuristics scoring each {@link Criterion} in [0, 1] and combining them into a weighted 0-100 score.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "orchestrator.scoring.mode", havingValue = "rule-based", matchIfMissing = true)
public class RuleBasedCriteriaScorer implements CriteriaScorer {

    static final double SMALL = 0.1;
    static final double MEDIUM = 0.2;
    static final double LARGE = 0.3;
    static final double EXTRA_LARGE = 0.4;
    static final double MAX_RAW = 1.0;

    /** Criteria below this raw score get a recommendation. */
    static final double RECOMMENDATION_THRESHOLD = 0.7;

    // Clarity
    private static final Pattern REQUIREMENT_WORDS = Pattern.compile("MUST|REQUIRED");
    private static final Pattern SPECIFICITY_WORDS = Pattern.compile("specifically|exactly");
    private static final Pattern MULTIPLE_QUESTIONS = Pattern.compile("\\?{2,}");
    private static final int OPTIMAL_MIN_LENGTH = 100;
    private static final int OPTIMAL_MAX_LENGTH = 2000;

    // Structure
    private static final Pattern XML_TAGS = Pattern.compile("<\\w+>.*</\\w+>", Pattern.DOTALL);
    private static final Pattern MARKDOWN_HEADERS = Pattern.compile("#{1,3}\\s+.+", Pattern.MULTILINE);
    private static final Pattern NUMBERED_LISTS = Pattern.compile("^\\d+\\.\\s+.+", Pattern.MULTILINE);
    private static final Pattern BULLET_POINTS = Pattern.compile("^[-*]\\s+.+", Pattern.MULTILINE);

    // Examples
    private static final Pattern EXAMPLE_INDICATORS = Pattern.compile("<example>|Example:|For example|e\\.g\\.", Pattern.CASE_INSENSITIVE);

    // Chain of thought
    private static final Pattern THINKING_TAGS = Pattern.compile("<thinking>|Let me think|step by step", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEQUENTIAL_WORDS = Pattern.compile("First,.*Then,.*Finally,", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern REASONING_WORDS = Pattern.compile("reasoning|approach|consider", Pattern.CASE_INSENSITIVE);

    // Technical specificity
    private static final Pattern TECH_TERMS = Pattern.compile("React|FastAPI|TypeScript|Python|API|component|endpoint|database", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION_INDICATORS = Pattern.compile("version|v\\d+|\\d+\\.\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern FRAMEWORK_WORDS = Pattern.compile("framework|library|package", Pattern.CASE_INSENSITIVE);
    private static final int MIN_TECH_TERMS = 3;

    // Error handling
    private static final Pattern ERROR_WORDS = Pattern.compile("error|exception|failure|edge case", Pattern.CASE_INSENSITIVE);
    private static final Pattern HANDLING_WORDS = Pattern.compile("try|catch|handle|recover", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALIDATION_WORDS = Pattern.compile("validation|sanitize|verify", Pattern.CASE_INSENSITIVE);

    // Performance
    private static final Pattern PERFORMANCE_WORDS = Pattern.compile("performance|optimize|efficient|fast", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPTIMIZATION_TECHNIQUES = Pattern.compile("cache|lazy|async|concurrent", Pattern.CASE_INSENSITIVE);

    // Testing
    private static final Pattern TEST_WORDS = Pattern.compile("test|testing|unit test|integration", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEST_CONCEPTS = Pattern.compile("coverage|assertion|mock", Pattern.CASE_INSENSITIVE);

    // Output format
    private static final Pattern FORMAT_WORDS = Pattern.compile("format|structure|output|return", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAT_TYPES = Pattern.compile("JSON|XML|markdown|code", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAT_EXAMPLES = Pattern.compile("<output>|```");

    // Deployment
    private static final Pattern DEPLOYMENT_WORDS = Pattern.compile("deploy|production|environment|docker", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECURITY_WORDS = Pattern.compile("security|authentication|authorization", Pattern.CASE_INSENSITIVE);

    @Override
    public EvaluationOutcome evaluate(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }

        Map<Criterion, CriterionScore> scores = new EnumMap<>(Criterion.class);
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Criterion criterion : Criterion.values()) {
            double raw = Math.min(rawScore(criterion, text), MAX_RAW);
            scores.put(criterion, new CriterionScore(raw, criterion.weight(), criterion.description()));
            weightedSum += raw * criterion.weight();
            totalWeight += criterion.weight();
        }

        double overall = Math.round(weightedSum / totalWeight * 100.0);
        List<String> recommendations = recommendations(scores);
        log.debug("[Scorer] overall={}, recommendations={}", overall, recommendations.size());
        return new EvaluationResult(overall, scores, recommendations);
    }

    double rawScore(Criterion criterion, String text) {
        return switch (criterion) {
            case CLARITY -> clarity(text);
            case STRUCTURE -> structure(text);
            case EXAMPLES -> examples(text);
            case CHAIN_OF_THOUGHT -> chainOfThought(text);
            case TECH_SPECIFICITY -> techSpecificity(text);
            case ERROR_HANDLING -> errorHandling(text);
            case PERFORMANCE -> performance(text);
            case TESTING -> testing(text);
            case OUTPUT_FORMAT -> outputFormat(text);
            case DEPLOYMENT -> deployment(text);
        };
    }

    private double clarity(String text) {
        double score = 0.5;
        if (REQUIREMENT_WORDS.matcher(text).find()) score += MEDIUM;
        if (SPECIFICITY_WORDS.matcher(text).find()) score += SMALL;
        if (text.length() > OPTIMAL_MIN_LENGTH && text.length() < OPTIMAL_MAX_LENGTH) score += SMALL;
        if (!MULTIPLE_QUESTIONS.matcher(text).find()) score += SMALL;
        return score;
    }

    private double structure(String text) {
        double score = 0.3;
        if (XML_TAGS.matcher(text).find()) score += LARGE;
        if (MARKDOWN_HEADERS.matcher(text).find()) score += MEDIUM;
        if (NUMBERED_LISTS.matcher(text).find()) score += SMALL;
        if (BULLET_POINTS.matcher(text).find()) score += SMALL;
        return score;
    }

    private double examples(String text) {
        int count = countMatches(EXAMPLE_INDICATORS, text);
        if (count == 0) return 0.2;
        if (count == 1) return 0.6;
        if (count <= 3) return 1.0;
        return 0.8;
    }

    private double chainOfThought(String text) {
        double score = 0.2;
        if (THINKING_TAGS.matcher(text).find()) score += EXTRA_LARGE;
        if (SEQUENTIAL_WORDS.matcher(text).find()) score += MEDIUM;
        if (REASONING_WORDS.matcher(text).find()) score += MEDIUM;
        return score;
    }

    private double techSpecificity(String text) {
        double score = 0.3;
        if (countMatches(TECH_TERMS, text) > MIN_TECH_TERMS) score += EXTRA_LARGE;
        if (VERSION_INDICATORS.matcher(text).find()) score += SMALL;
        if (FRAMEWORK_WORDS.matcher(text).find()) score += MEDIUM;
        return score;
    }

    private double errorHandling(String text) {
        double score = 0.2;
        if (ERROR_WORDS.matcher(text).find()) score += EXTRA_LARGE;
        if (HANDLING_WORDS.matcher(text).find()) score += MEDIUM;
        if (VALIDATION_WORDS.matcher(text).find()) score += MEDIUM;
        return score;
    }

    private double performance(String text) {
        double score = 0.5;
        if (PERFORMANCE_WORDS.matcher(text).find()) score += LARGE;
        if (OPTIMIZATION_TECHNIQUES.matcher(text).find()) score += MEDIUM;
        return score;
    }

    private double testing(String text) {
        double score = 0.3;
        if (TEST_WORDS.matcher(text).find()) score += EXTRA_LARGE;
        if (TEST_CONCEPTS.matcher(text).find()) score += LARGE;
        return score;
    }

    private double outputFormat(String text) {
        double score = 0.4;
        if (FORMAT_WORDS.matcher(text).find()) score += LARGE;
        if (FORMAT_TYPES.matcher(text).find()) score += MEDIUM;
        if (FORMAT_EXAMPLES.matcher(text).find()) score += SMALL;
        return score;
    }

    private double deployment(String text) {
        double score = 0.5;
        if (DEPLOYMENT_WORDS.matcher(text).find()) score += LARGE;
        if (SECURITY_WORDS.matcher(text).find()) score += MEDIUM;
        return score;
    }

    /**
     * Criteria under the threshold, most impactful first. Impact is {@code (1 - raw) * weight}.
     */
    private List<String> recommendations(Map<Criterion, CriterionScore> scores) {
        return scores.entrySet().stream()
                .filter(e -> e.getValue().rawScore() < RECOMMENDATION_THRESHOLD)
                .sorted(Comparator.comparingDouble(
                        (Map.Entry<Criterion, CriterionScore> e) -> (1 - e.getValue().rawScore()) * e.getValue().weight())
                        .reversed())
                .map(e -> e.getKey().recommendation())
                .toList();
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
