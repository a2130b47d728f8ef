package com.promptsmith.domain.prompt.model;

/**
 * @param frequency share of analyzed prompts exhibiting the pattern, in [0, 1]
 */
public record PromptPattern(String name, String description, double frequency) {}
