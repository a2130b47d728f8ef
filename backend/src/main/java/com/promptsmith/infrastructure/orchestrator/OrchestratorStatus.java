package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.PatternReport;

/**
 * Point-in-time view of an orchestrator for operators and tests.
 */
public record OrchestratorStatus(
        int historySize,
        long highScoringCount,
        boolean extractionInProgress,
        int extractionRuns,
        PatternReport latestPatterns,
        OrchestratorConfig config
) {}
