package com.promptsmith.infrastructure.orchestrator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutRetryExecutorTest {

    private ExecutorService pool;
    private TimeoutRetryExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool(new NamedThreadFactory("test-call"));
        executor = new TimeoutRetryExecutor(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        MDC.clear();
    }

    @Test
    @DisplayName("첫 시도에 성공하면 한 번만 호출한다")
    void success_firstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        CallOutcome<String> outcome = executor.call("ok", () -> {
            calls.incrementAndGet();
            return "done";
        }, 1000, true);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.value()).isEqualTo("done");
        assertThat(outcome.calls()).isEqualTo(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("실패 후 재시도에 성공한다")
    void failure_thenRetrySucceeds() {
        AtomicInteger calls = new AtomicInteger();

        CallOutcome<String> outcome = executor.call("flaky", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first");
            }
            return "second";
        }, 1000, true);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.value()).isEqualTo("second");
        assertThat(outcome.calls()).isEqualTo(2);
        assertThat(outcome.timedOut()).isFalse();
    }

    @Test
    @DisplayName("두 번 실패하면 마지막 원인을 돌려준다")
    void failure_twice() {
        AtomicInteger calls = new AtomicInteger();

        CallOutcome<String> outcome = executor.call("broken", () -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        }, 1000, true);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failure()).hasMessage("attempt 2");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("재시도가 꺼져 있으면 한 번만 시도한다")
    void noRetry() {
        AtomicInteger calls = new AtomicInteger();

        CallOutcome<String> outcome = executor.call("once", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("nope");
        }, 1000, false);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.calls()).isEqualTo(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("타임아웃된 시도는 인터럽트로 취소된다")
    void timeout_interruptsFirstAttempt() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        CallOutcome<String> outcome = executor.call("slow", () -> {
            try {
                Thread.sleep(5000);
                return "late";
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        }, 50, false);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.failure()).isInstanceOf(TimeoutException.class);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("재시도는 타임아웃 없이 완료를 기다린다")
    void retry_hasNoTimeout() {
        AtomicInteger calls = new AtomicInteger();

        CallOutcome<String> outcome = executor.call("slowRetry", () -> {
            int call = calls.incrementAndGet();
            Thread.sleep(call == 1 ? 5000 : 200);
            return "retry-" + call;
        }, 50, true);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.value()).isEqualTo("retry-2");
        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.calls()).isEqualTo(2);
    }

    @Test
    @DisplayName("호출 스레드의 MDC가 작업 스레드로 전달된다")
    void mdc_isPropagated() {
        MDC.put(PromptOrchestrator.MDC_KEY, "abc123");

        CallOutcome<String> outcome = executor.call("mdc", () -> MDC.get(PromptOrchestrator.MDC_KEY), 1000, false);

        assertThat(outcome.value()).isEqualTo("abc123");
    }
}
