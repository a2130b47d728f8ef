package com.promptsmith.infrastructure.orchestrator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a task with a timeout and at most one retry.
 * <p>
 * The first attempt races the timeout. If it times out it is cancelled with an interrupt;
 * a task that ignores interrupts may still complete in the background. If the first attempt
 * times out or fails and retry is enabled, the task is started exactly once more and awaited
 * without a timeout. The task never runs more than twice per call.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class TimeoutRetryExecutor {

    private final ExecutorService executor;

    public <T> CallOutcome<T> call(String label, Callable<T> task, long timeoutMs, boolean retryOnFailure) {
        Callable<T> wrapped = MdcPropagation.callable(task);

        Throwable failure;
        boolean timedOut = false;
        Future<T> first = executor.submit(wrapped);
        try {
            return CallOutcome.success(first.get(timeoutMs, TimeUnit.MILLISECONDS), 1, false);
        } catch (TimeoutException e) {
            first.cancel(true);
            timedOut = true;
            failure = e;
            log.warn("[Retry] {} timed out after {}ms, cancelled", label, timeoutMs);
        } catch (ExecutionException e) {
            failure = unwrap(e);
            log.warn("[Retry] {} failed: {}", label, failure.toString());
        } catch (InterruptedException e) {
            first.cancel(true);
            Thread.currentThread().interrupt();
            return CallOutcome.failure(e, 1, false);
        }

        if (!retryOnFailure) {
            return CallOutcome.failure(failure, 1, timedOut);
        }

        log.info("[Retry] {} retrying once without timeout", label);
        Future<T> second = executor.submit(wrapped);
        try {
            return CallOutcome.success(second.get(), 2, timedOut);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            log.warn("[Retry] {} failed on retry: {}", label, cause.toString());
            return CallOutcome.failure(cause, 2, timedOut);
        } catch (InterruptedException e) {
            second.cancel(true);
            Thread.currentThread().interrupt();
            return CallOutcome.failure(e, 2, timedOut);
        }
    }

    private static Throwable unwrap(ExecutionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
