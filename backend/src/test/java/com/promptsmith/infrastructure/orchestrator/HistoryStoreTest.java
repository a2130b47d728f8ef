package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.HistoryEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoryStoreTest {

    private static HistoryEntry entry(String text, double score) {
        return new HistoryEntry(text, score, Instant.EPOCH, null);
    }

    @Test
    @DisplayName("용량을 넘으면 가장 오래된 항목이 제거된다")
    void append_evictsOldest() {
        HistoryStore store = new HistoryStore(3);

        store.append(entry("a", 10));
        store.append(entry("b", 20));
        store.append(entry("c", 30));
        int size = store.append(entry("d", 40));

        assertThat(size).isEqualTo(3);
        assertThat(store.snapshot()).extracting(HistoryEntry::text).containsExactly("b", "c", "d");
    }

    @Test
    @DisplayName("기본 용량은 100이다")
    void defaultCapacity() {
        HistoryStore store = new HistoryStore();
        for (int i = 0; i < 101; i++) {
            store.append(entry("p" + i, i % 100));
        }

        assertThat(store.capacity()).isEqualTo(HistoryStore.DEFAULT_CAPACITY);
        assertThat(store.size()).isEqualTo(100);
        assertThat(store.snapshot().get(0).text()).isEqualTo("p1");
    }

    @Test
    @DisplayName("조건 조회와 개수 세기")
    void query_and_count() {
        HistoryStore store = new HistoryStore();
        store.append(entry("low", 40));
        store.append(entry("high", 90));
        store.append(entry("edge", 85));

        assertThat(store.query(e -> e.score() >= 85)).extracting(HistoryEntry::text).containsExactly("high", "edge");
        assertThat(store.count(e -> e.score() < 85)).isEqualTo(1);
    }

    @Test
    @DisplayName("스냅샷은 이후 변경의 영향을 받지 않는다")
    void snapshot_isImmutable() {
        HistoryStore store = new HistoryStore();
        store.append(entry("a", 10));

        List<HistoryEntry> snapshot = store.snapshot();
        store.append(entry("b", 20));
        store.clear();

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(entry("c", 30))).isInstanceOf(UnsupportedOperationException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("잘못된 용량은 거부한다")
    void invalidCapacity() {
        assertThatThrownBy(() -> new HistoryStore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("동시 추가에도 용량을 넘지 않는다")
    void concurrentAppends_respectCapacity() throws Exception {
        HistoryStore store = new HistoryStore(50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger largestSize = new AtomicInteger();
        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            workers.add(pool.submit(() -> {
                for (int i = 0; i < 100; i++) {
                    largestSize.accumulateAndGet(store.append(entry("x", 50)), Math::max);
                }
            }));
        }

        try {
            for (Future<?> worker : workers) {
                worker.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(largestSize.get()).isEqualTo(50);
        assertThat(store.size()).isEqualTo(50);
    }
}
