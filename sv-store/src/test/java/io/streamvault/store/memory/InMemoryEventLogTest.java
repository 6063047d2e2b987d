package io.streamvault.store.memory;

import io.streamvault.core.EventRecord;
import io.streamvault.core.NewEvent;
import io.streamvault.core.error.ConcurrencyConflictException;
import io.streamvault.store.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventLogTest {

    private MutableClock clock;
    private InMemoryEventLog log;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        log = new InMemoryEventLog(clock);
    }

    private static NewEvent event(String stream, int n) {
        return NewEvent.of(stream, "stock", "analysis.state.changed", Map.of("n", n));
    }

    @Test
    void currentVersion_unknownStreamIsZero() {
        assertThat(log.currentVersion("nope")).isZero();
        assertThat(log.readStream("nope")).isEmpty();
    }

    @Test
    void append_assignsContiguousVersions() {
        for (int i = 0; i < 5; i++) log.append(event("S1", i), null);

        assertThat(log.readStream("S1")).extracting(EventRecord::version).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(log.currentVersion("S1")).isEqualTo(5);
        assertThat(log.readStream("S1", 4)).extracting(EventRecord::version).containsExactly(4L, 5L);
    }

    @Test
    void append_staleExpectedVersionWritesNothing() {
        log.append(event("S1", 1), 0L);

        assertThatThrownBy(() -> log.append(event("S1", 2), 0L))
                .isInstanceOfSatisfying(ConcurrencyConflictException.class, conflict -> {
                    assertThat(conflict.expectedVersion()).isZero();
                    assertThat(conflict.actualVersion()).isEqualTo(1);
                });
        assertThat(log.readStream("S1")).hasSize(1);
        assertThat(log.lastGlobalSequence()).isEqualTo(1);
    }

    @Test
    void append_batchIsContiguousAndAtomic() {
        var batch = List.of(event("S1", 1), event("S1", 2), event("S1", 3));
        var committed = log.append("S1", batch, 0L);

        assertThat(committed).extracting(EventRecord::version).containsExactly(1L, 2L, 3L);
        assertThat(committed).extracting(EventRecord::globalSequence).containsExactly(1L, 2L, 3L);

        assertThatThrownBy(() -> log.append("S1", batch, 0L)).isInstanceOf(ConcurrencyConflictException.class);
        assertThat(log.currentVersion("S1")).isEqualTo(3);
    }

    @Test
    void append_rejectsBatchMixingStreams() {
        assertThatThrownBy(() -> log.append("S1", List.of(event("S1", 1), event("S2", 1)), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(log.currentVersion("S1")).isZero();
    }

    @Test
    void concurrentAppendsWithSameExpectedVersion_exactlyOneWins() throws Exception {
        for (int round = 0; round < 50; round++) {
            var stream = "race-" + round;
            var start = new CountDownLatch(1);
            var pool = Executors.newFixedThreadPool(2);
            try {
                var futures = new ArrayList<Future<Boolean>>();
                for (int t = 0; t < 2; t++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            log.append(event(stream, 0), 0L);
                            return true;
                        } catch (ConcurrencyConflictException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();
                int wins = 0;
                for (var f : futures) if (f.get(5, TimeUnit.SECONDS)) wins++;
                assertThat(wins).isEqualTo(1);
                assertThat(log.readStream(stream)).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void concurrentAppendsAcrossStreams_keepVersionsContiguousAndSequencesUnique() throws Exception {
        int streams = 8, perStream = 200;
        var pool = Executors.newFixedThreadPool(streams);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int s = 0; s < streams; s++) {
                var stream = "S" + s;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perStream; i++) log.append(event(stream, i), null);
                }));
            }
            for (var f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        for (int s = 0; s < streams; s++) {
            assertThat(log.readStream("S" + s)).extracting(EventRecord::version)
                    .containsExactlyElementsOf(LongStream.rangeClosed(1, perStream).boxed().toList());
        }
        var all = log.readAll(0, Integer.MAX_VALUE);
        assertThat(all).hasSize(streams * perStream);
        assertThat(all).extracting(EventRecord::globalSequence).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void readAll_resumesAfterOffset() {
        for (int i = 0; i < 4; i++) log.append(event(i % 2 == 0 ? "A" : "B", i), null);

        assertThat(log.readAll(2, 10)).extracting(EventRecord::globalSequence).containsExactly(3L, 4L);
        assertThat(log.readAll(0, 2)).extracting(EventRecord::globalSequence).containsExactly(1L, 2L);
        assertThat(log.readAll(0, 0)).isEmpty();
    }

    @Test
    void archiveBefore_leavesVersionGapInHotLog() {
        log.append(event("S1", 1), null);
        log.append(event("S1", 2), null);
        clock.advance(Duration.ofDays(40));
        log.append(event("S1", 3), null);

        var result = log.archiveBefore(clock.instant().minus(Duration.ofDays(30)));

        assertThat(result.moved()).isEqualTo(2);
        assertThat(result.isComplete()).isTrue();
        assertThat(log.readStream("S1", 1)).extracting(EventRecord::version).containsExactly(3L);
        assertThat(log.readArchivedStream("S1", 1)).extracting(EventRecord::version).containsExactly(1L, 2L);
        assertThat(log.currentVersion("S1")).isEqualTo(3);
        assertThat(log.readAll(0, 10)).extracting(EventRecord::version).containsExactly(3L);

        // versions keep counting from the true end of the stream
        assertThat(log.append(event("S1", 4), 3L).version()).isEqualTo(4);
    }

    @Test
    void archivedEventsKeepContentVerbatim() {
        var original = log.append(NewEvent.of("S1", "stock", "x", Map.of("k", "v")), null);
        clock.advance(Duration.ofDays(2));

        log.archiveBefore(clock.instant().minus(Duration.ofDays(1)));

        assertThat(log.readArchivedStream("S1", 1)).containsExactly(original);
    }

    @Test
    void streamStats_groupsByStreamType() {
        log.append(NewEvent.of("stock-AAPL", "stock", "analysis.state.changed", Map.of()), null);
        log.append(NewEvent.of("stock-AAPL", "stock", "analysis.state.changed", Map.of()), null);
        log.append(NewEvent.of("stock-MSFT", "stock", "analysis.state.changed", Map.of()), null);
        log.append(NewEvent.of("portfolio-1", "portfolio", "portfolio.state.changed", Map.of()), null);

        var stats = log.streamStats();

        assertThat(stats).hasSize(2);
        assertThat(stats.get(0).streamType()).isEqualTo("stock");
        assertThat(stats.get(0).uniqueStreams()).isEqualTo(2);
        assertThat(stats.get(0).totalEvents()).isEqualTo(3);
        assertThat(stats.get(0).maxVersion()).isEqualTo(2);
    }
}
