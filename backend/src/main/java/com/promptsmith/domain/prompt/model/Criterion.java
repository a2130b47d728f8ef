package com.promptsmith.domain.prompt.model;

/**
 * Fixed evaluation criteria with their weights in the overall score.
 */
public enum Criterion {
    CLARITY("clarity", 1.2, "How clear and unambiguous the prompt is",
            "Add explicit requirements using \"MUST\", \"SHOULD\", and \"MAY\". Be specific about expected behavior."),
    STRUCTURE("structure", 1.1, "Organization and logical flow of the prompt",
            "Use XML tags or markdown sections to organize your prompt. Add clear hierarchical structure."),
    EXAMPLES("examples", 1.0, "Quality and relevance of provided examples",
            "Include 2-3 examples with input, reasoning, and expected output."),
    CHAIN_OF_THOUGHT("chainOfThought", 1.1, "Step-by-step reasoning and thinking process",
            "Add a <thinking> section or \"Let me approach this step by step\" to encourage reasoning."),
    TECH_SPECIFICITY("techSpecificity", 1.2, "Technical details and specific requirements",
            "Specify exact frameworks, versions, and technical requirements."),
    ERROR_HANDLING("errorHandling", 1.0, "Consideration of edge cases and error scenarios",
            "Explicitly mention error scenarios and how they should be handled."),
    PERFORMANCE("performance", 0.9, "Performance requirements and optimization",
            "Include performance requirements and optimization considerations."),
    TESTING("testing", 0.9, "Testing requirements and validation",
            "Specify testing requirements and coverage expectations."),
    OUTPUT_FORMAT("outputFormat", 1.0, "Clear specification of desired output format",
            "Define the exact output format and structure expected."),
    DEPLOYMENT("deployment", 0.8, "Deployment and production readiness",
            "Add production deployment considerations and requirements.");

    private final String key;
    private final double weight;
    private final String description;
    private final String recommendation;

    Criterion(String key, double weight, String description, String recommendation) {
        this.key = key;
        this.weight = weight;
        this.description = description;
        this.recommendation = recommendation;
    }

    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }

    public String description() {
        return description;
    }

    public String recommendation() {
        return recommendation;
    }
}
