package com.promptsmith.domain.prompt.model;

/**
 * A proposed improved version of a prompt.
 *
 * @param text             the rewritten prompt
 * @param method           strategy that produced it
 * @param scoreImprovement estimated score delta; only positive values compete in selection
 * @param reasoning        optional explanation (nullable)
 */
public record ImprovementCandidate(
        String text,
        ImprovementMethod method,
        double scoreImprovement,
        String reasoning
) {}
