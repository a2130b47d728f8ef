package com.promptsmith.domain.prompt.service;

import com.promptsmith.domain.prompt.model.HistoryEntry;
import com.promptsmith.domain.prompt.model.PatternReport;

import java.util.List;

/**
 * Batch analysis over high-scoring history entries. Invoked only from the background learning phase.
 */
public interface PatternExtractor {

    PatternReport extract(List<HistoryEntry> entries);
}
