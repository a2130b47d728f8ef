package com.promptsmith.application.orchestration;

import com.promptsmith.domain.prompt.model.Criterion;
import com.promptsmith.domain.prompt.model.CriterionScore;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.model.PromptComparison;
import com.promptsmith.domain.prompt.model.PromptComparison.Winner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Turns two finished evaluations into a {@link PromptComparison}.
 * Criterion scores are compared on a 0-100 scale.
 */
final class PromptComparator {

    static final double TIE_MARGIN = 3.0;
    static final double KEY_DIFFERENCE = 5.0;
    static final double NOTABLE_CRITERION = 3.0;
    private static final int MAX_KEY_DIFFERENCES = 3;

    private PromptComparator() {
    }

    static PromptComparison compare(EvaluationResult first, EvaluationResult second) {
        double delta = second.overallScore() - first.overallScore();
        Winner winner = Math.abs(delta) < TIE_MARGIN ? Winner.TIE : delta > 0 ? Winner.SECOND : Winner.FIRST;
        List<String> keyDifferences = keyDifferences(first, second);
        return new PromptComparison(first.overallScore(), second.overallScore(), winner, Math.abs(delta),
                keyDifferences, recommendation(winner, Math.abs(delta), keyDifferences));
    }

    private static List<String> keyDifferences(EvaluationResult first, EvaluationResult second) {
        List<CriterionDelta> deltas = new ArrayList<>();
        for (Criterion criterion : Criterion.values()) {
            deltas.add(new CriterionDelta(criterion,
                    points(second.scores().get(criterion)) - points(first.scores().get(criterion))));
        }
        deltas.sort(Comparator.comparingDouble((CriterionDelta d) -> Math.abs(d.delta())).reversed());

        List<String> result = new ArrayList<>();
        deltas.stream()
                .filter(d -> Math.abs(d.delta()) > KEY_DIFFERENCE)
                .limit(MAX_KEY_DIFFERENCES)
                .forEach(d -> result.add(String.format(Locale.ROOT, "Prompt 2 is %.1f points %s in %s",
                        Math.abs(d.delta()), d.delta() > 0 ? "better" : "worse", d.criterion().key())));

        for (CriterionDelta d : deltas) {
            if (Math.abs(d.delta()) <= NOTABLE_CRITERION) {
                continue;
            }
            String better = d.delta() > 0 ? "Prompt 2" : "Prompt 1";
            if (d.criterion() == Criterion.STRUCTURE) {
                result.add(better + " has better structural organization");
            } else if (d.criterion() == Criterion.TECH_SPECIFICITY) {
                result.add(better + " provides more technical detail");
            }
        }
        return result;
    }

    private static String recommendation(Winner winner, double difference, List<String> keyDifferences) {
        if (winner == Winner.TIE) {
            return "Both prompts are roughly equivalent. Choose by use case or combine the strongest parts of each.";
        }
        String winnerName = winner == Winner.FIRST ? "Prompt 1" : "Prompt 2";
        String loserName = winner == Winner.FIRST ? "Prompt 2" : "Prompt 1";
        if (difference > 15) {
            return winnerName + " is significantly better and should be used. Apply its patterns to " + loserName + ".";
        }
        String mainAdvantage = keyDifferences.isEmpty() ? "small gains across several criteria." : keyDifferences.get(0);
        if (difference > 8) {
            return winnerName + " is notably better overall. " + mainAdvantage;
        }
        return winnerName + " is slightly better. Main advantage: " + mainAdvantage;
    }

    // Missing criterion detail counts as zero
    private static double points(CriterionScore score) {
        return score == null ? 0.0 : score.rawScore() * 100.0;
    }

    private record CriterionDelta(Criterion criterion, double delta) {
    }
}
