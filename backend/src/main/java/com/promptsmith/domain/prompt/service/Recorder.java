package com.promptsmith.domain.prompt.service;

import com.promptsmith.domain.prompt.model.RecordEntry;

/**
 * Best-effort persistence of orchestration outcomes. Failures are logged by the caller and ignored.
 */
public interface Recorder {

    void record(RecordEntry entry);
}
