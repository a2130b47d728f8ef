package com.promptsmith.domain.prompt.model;

/**
 * Flags derived from a {@link PromptContext} that key the agent selection table.
 * Declaration order is the merge order when several flags are present.
 */
public enum ContextFlag {
    HIGH_COMPLEXITY,
    FRONTEND,
    BACKEND
}
