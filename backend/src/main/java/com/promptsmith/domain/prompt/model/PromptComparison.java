package com.promptsmith.domain.prompt.model;

import java.util.List;

/**
 * Side-by-side evaluation of two prompt versions.
 *
 * @param firstScore      overall score of the first prompt
 * @param secondScore     overall score of the second prompt
 * @param winner          which prompt scored better, {@link Winner#TIE} inside the tie margin
 * @param scoreDifference absolute difference of the overall scores
 * @param keyDifferences  most significant per-criterion differences, largest first
 * @param recommendation  which version to use and why
 */
public record PromptComparison(
        double firstScore,
        double secondScore,
        Winner winner,
        double scoreDifference,
        List<String> keyDifferences,
        String recommendation
) implements ComparisonOutcome {

    public enum Winner {
        FIRST, SECOND, TIE
    }

    public PromptComparison {
        if (winner == null) {
            throw new IllegalArgumentException("winner must not be null");
        }
        keyDifferences = keyDifferences == null ? List.of() : List.copyOf(keyDifferences);
    }
}
