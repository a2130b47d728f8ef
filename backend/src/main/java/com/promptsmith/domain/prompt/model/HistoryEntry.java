package com.promptsmith.domain.prompt.model;

import java.time.Instant;

/**
 * One completed orchestration, kept for pattern learning.
 */
public record HistoryEntry(String text, double score, Instant timestamp, PromptContext context) {}
