package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.RecordEntry;
import com.promptsmith.domain.prompt.service.Recorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the {@link Recorder} and contains its failures.
 */
@Slf4j
@RequiredArgsConstructor
public class BestEffortRecorder {

    private final Recorder recorder;

    /**
     * @return true if the recorder accepted the entry
     */
    public boolean record(RecordEntry entry) {
        try {
            recorder.record(entry);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Recorder] Failed to record {} entry, continuing", entry.kind(), e);
            return false;
        }
    }
}
