package com.promptsmith.infrastructure.orchestrator;

/**
 * Result of one logical call made through {@link TimeoutRetryExecutor}.
 *
 * @param value    result of the successful attempt (may be null if the task returned null)
 * @param failure  last failure, null on success
 * @param calls    number of times the task was started, 1 or 2
 * @param timedOut whether the first attempt hit the timeout
 */
public record CallOutcome<T>(T value, Throwable failure, int calls, boolean timedOut) {

    public static <T> CallOutcome<T> success(T value, int calls, boolean timedOut) {
        return new CallOutcome<>(value, null, calls, timedOut);
    }

    public static <T> CallOutcome<T> failure(Throwable failure, int calls, boolean timedOut) {
        return new CallOutcome<>(null, failure, calls, timedOut);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
