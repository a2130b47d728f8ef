package com.promptsmith.domain.prompt.model;

/**
 * Result of comparing two prompts: a finished comparison, or a deferral when either
 * prompt could only be scored by an external judge.
 */
public sealed interface ComparisonOutcome permits PromptComparison, DeferredEvaluation {
}
