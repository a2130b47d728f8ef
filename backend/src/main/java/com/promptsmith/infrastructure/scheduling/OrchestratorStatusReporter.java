package com.promptsmith.infrastructure.scheduling;

import com.promptsmith.infrastructure.orchestrator.OrchestratorStatus;
import com.promptsmith.infrastructure.orchestrator.PromptOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class OrchestratorStatusReporter {

    private final PromptOrchestrator orchestrator;

    @Scheduled(fixedRateString = "${orchestrator.status.report-interval-ms:300000}",
            initialDelayString = "${orchestrator.status.report-interval-ms:300000}")
    public void reportStatus() {
        OrchestratorStatus status = orchestrator.status();
        log.info("[Status] history={}, highScoring={}, extractionInProgress={}, extractionRuns={}, patterns={}",
                status.historySize(),
                status.highScoringCount(),
                status.extractionInProgress(),
                status.extractionRuns(),
                status.latestPatterns().patterns().size());
    }
}
