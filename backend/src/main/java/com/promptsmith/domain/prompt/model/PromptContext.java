package com.promptsmith.domain.prompt.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Structured summary of a prompt, used to pick improvement strategies.
 *
 * @param isReact      React-specific vocabulary detected
 * @param hasFrontend  any frontend hint (includes {@code isReact})
 * @param isApi        API-specific vocabulary detected
 * @param hasBackend   any backend hint (includes {@code isApi})
 * @param complexity   coarse size/intent complexity
 * @param frameworks   detected framework tags, in detection order
 * @param projectType  frontend, backend, fullstack or general
 */
public record PromptContext(
        boolean isReact,
        boolean hasFrontend,
        boolean isApi,
        boolean hasBackend,
        Complexity complexity,
        List<String> frameworks,
        String projectType
) {
    public PromptContext {
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        complexity = complexity == null ? Complexity.LOW : complexity;
    }

    public Set<ContextFlag> flags() {
        Set<ContextFlag> flags = EnumSet.noneOf(ContextFlag.class);
        if (complexity == Complexity.HIGH) {
            flags.add(ContextFlag.HIGH_COMPLEXITY);
        }
        if (isReact || hasFrontend) {
            flags.add(ContextFlag.FRONTEND);
        }
        if (isApi || hasBackend) {
            flags.add(ContextFlag.BACKEND);
        }
        return flags;
    }
}
