package com.promptsmith.infrastructure.orchestrator.phase;

import com.promptsmith.domain.prompt.model.HistoryEntry;
import com.promptsmith.domain.prompt.model.PatternReport;
import com.promptsmith.domain.prompt.model.PromptPattern;
import com.promptsmith.domain.prompt.service.PatternExtractor;
import com.promptsmith.infrastructure.orchestrator.HistoryStore;
import com.promptsmith.infrastructure.orchestrator.MdcPropagation;
import com.promptsmith.infrastructure.orchestrator.OrchestratorConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Phase 4: background pattern extraction over high-scoring history, one run at a time.
 */
@Slf4j
@RequiredArgsConstructor
public class Phase4PatternLearner {

    private final PatternExtractor patternExtractor;
    private final HistoryStore historyStore;
    private final Executor executor;

    private final AtomicBoolean extractionInProgress = new AtomicBoolean(false);
    private final AtomicInteger completedRuns = new AtomicInteger();
    private final AtomicReference<PatternReport> latestReport = new AtomicReference<>(PatternReport.empty());

    /**
     * Checks the trigger condition and, if met, starts extraction on the executor without waiting.
     *
     * @return the running extraction (completing with {@code true} on success), or empty if not started
     */
    public Optional<CompletableFuture<Boolean>> trigger(OrchestratorConfig config) {
        if (extractionInProgress.get()) {
            log.debug("[Phase4] Extraction already in progress");
            return Optional.empty();
        }

        List<HistoryEntry> highScoring = historyStore.query(e -> e.score() >= config.highQuality());
        if (highScoring.size() < config.patternExtractionMin()) {
            log.info("[Phase4] Not enough high-scoring prompts for pattern extraction (current={}, required={})",
                    highScoring.size(), config.patternExtractionMin());
            return Optional.empty();
        }

        if (!extractionInProgress.compareAndSet(false, true)) {
            log.debug("[Phase4] Extraction started concurrently");
            return Optional.empty();
        }

        log.info("[Phase4] Extracting patterns from {} high-scoring prompts", highScoring.size());
        try {
            return Optional.of(CompletableFuture.supplyAsync(
                    MdcPropagation.supplier(() -> runExtraction(highScoring)), executor));
        } catch (RejectedExecutionException e) {
            extractionInProgress.set(false);
            log.warn("[Phase4] Could not schedule pattern extraction", e);
            return Optional.empty();
        }
    }

    public boolean isExtractionInProgress() {
        return extractionInProgress.get();
    }

    public int completedRuns() {
        return completedRuns.get();
    }

    public PatternReport latestReport() {
        return latestReport.get();
    }

    private boolean runExtraction(List<HistoryEntry> entries) {
        try {
            PatternReport report = patternExtractor.extract(entries);
            if (report != null) {
                apply(report);
            }
            completedRuns.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            log.error("[Phase4] Pattern extraction failed", e);
            return false;
        } finally {
            extractionInProgress.set(false);
        }
    }

    private void apply(PatternReport report) {
        latestReport.set(report);
        log.info("[Phase4] Extracted {} patterns from {} prompts (avg score {})",
                report.patterns().size(), report.totalAnalyzed(), String.format("%.1f", report.averageScore()));
        for (PromptPattern pattern : report.patterns()) {
            log.debug("[Phase4]   - {} ({}%)", pattern.name(), Math.round(pattern.frequency() * 100));
        }
    }
}
