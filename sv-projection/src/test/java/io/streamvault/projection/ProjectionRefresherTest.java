package io.streamvault.projection;

import io.streamvault.core.EventRecord;
import io.streamvault.core.ProjectionState;
import io.streamvault.core.ProjectionStatus;
import io.streamvault.store.ProjectionStatusStore;
import io.streamvault.store.memory.InMemoryProjectionStatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.streamvault.projection.ProjectionRouter.*;
import static io.streamvault.projection.ProjectionRouterTest.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProjectionRefresherTest {

    /** Counts refreshes; a queued failure makes the next refresh throw. */
    static final class CountingProjection implements Projection {
        final String name;
        final AtomicInteger refreshes = new AtomicInteger();
        volatile RuntimeException nextFailure;
        volatile int view;

        CountingProjection(String name) {
            this.name = name;
        }

        @Override public String name() { return name; }

        @Override public void refresh() {
            var failure = nextFailure;
            if (failure != null) {
                nextFailure = null;
                throw failure;
            }
            view = refreshes.incrementAndGet();
        }
    }

    private final Clock clock = Clock.systemUTC();
    private InMemoryProjectionStatusStore statusStore;
    private List<Runnable> queued;
    private ProjectionRefresher refresher;
    private CountingProjection analysis, portfolio, trading, health;

    @BeforeEach
    void setUp() {
        statusStore = new InMemoryProjectionStatusStore();
        queued = new ArrayList<>();
        refresher = new ProjectionRefresher(
                new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.REFRESH_ALL),
                statusStore, queued::add, clock);
        analysis = register(UNIFIED_ANALYSIS);
        portfolio = register(UNIFIED_PORTFOLIO);
        trading = register(UNIFIED_TRADING);
        health = register(UNIFIED_SYSTEM_HEALTH);
    }

    private CountingProjection register(String name) {
        var p = new CountingProjection(name);
        refresher.register(p);
        return p;
    }

    private ProjectionState state(String name) {
        return refresher.projectionStatus(name).orElseThrow().state();
    }

    private void runQueued() {
        while (!queued.isEmpty()) queued.remove(0).run();
    }

    @Test
    void register_declaresFreshProjections() {
        assertThat(refresher.statuses()).extracting(ProjectionStatus::state).containsOnly(ProjectionState.FRESH);
        assertThat(statusStore.findAll()).hasSize(4);
        assertThat(refresher.projectionStatus("missing")).isEmpty();
    }

    @Test
    void crossDomainEventsMarkDependentsStale() {
        refresher.onCommitted(event("portfolio.state.changed", 1));
        refresher.onCommitted(event("trading.state.changed", 2));

        assertThat(state(UNIFIED_PORTFOLIO)).isEqualTo(ProjectionState.STALE);
        assertThat(state(UNIFIED_TRADING)).isEqualTo(ProjectionState.STALE);
        assertThat(state(UNIFIED_ANALYSIS)).isEqualTo(ProjectionState.STALE);
        assertThat(state(UNIFIED_SYSTEM_HEALTH)).isEqualTo(ProjectionState.FRESH);

        runQueued();

        assertThat(refresher.statuses()).extracting(ProjectionStatus::state).containsOnly(ProjectionState.FRESH);
        assertThat(analysis.refreshes).hasValue(1);
        assertThat(health.refreshes).hasValue(0);
    }

    @Test
    void pendingRequestsForOneProjectionCoalesce() {
        var events = new ArrayList<EventRecord>();
        for (int i = 1; i <= 5; i++) {
            var e = event("analysis.state.changed", i);
            events.add(e);
            refresher.onCommitted(e);
        }

        assertThat(queued).hasSize(1);
        runQueued();

        assertThat(analysis.refreshes).hasValue(1);
        assertThat(refresher.projectionStatus(UNIFIED_ANALYSIS).orElseThrow().lastProcessedEventId())
                .isEqualTo(events.get(4).id());
    }

    @Test
    void failedRefreshIsAbsorbedIntoErrorStateAndRetriedByNextEvent() {
        trading.nextFailure = new IllegalStateException("view locked");
        var first = event("trading.state.changed", 1);
        refresher.onCommitted(first);
        runQueued();

        var failed = refresher.projectionStatus(UNIFIED_TRADING).orElseThrow();
        assertThat(failed.state()).isEqualTo(ProjectionState.ERROR);
        assertThat(failed.status()).isEqualTo("error");
        assertThat(failed.errorMessage()).contains("view locked");
        assertThat(failed.lastProcessedEventId()).isNull();
        assertThat(statusStore.find(UNIFIED_TRADING)).contains(failed);
        // analysis shared the event and is unaffected
        assertThat(state(UNIFIED_ANALYSIS)).isEqualTo(ProjectionState.FRESH);

        var second = event("trading.state.changed", 2);
        refresher.onCommitted(second);
        assertThat(state(UNIFIED_TRADING)).isEqualTo(ProjectionState.STALE);
        runQueued();

        var recovered = refresher.projectionStatus(UNIFIED_TRADING).orElseThrow();
        assertThat(recovered.state()).isEqualTo(ProjectionState.FRESH);
        assertThat(recovered.errorMessage()).isNull();
        assertThat(recovered.lastProcessedEventId()).isEqualTo(second.id());
    }

    @Test
    void rerun_repairsErroredProjectionOutOfBand() {
        health.nextFailure = new IllegalStateException("boom");
        refresher.onCommitted(event("system.alert.raised", 1));
        runQueued();
        assertThat(state(UNIFIED_SYSTEM_HEALTH)).isEqualTo(ProjectionState.ERROR);

        assertThat(refresher.rerunFailed()).isEqualTo(1);
        runQueued();

        assertThat(state(UNIFIED_SYSTEM_HEALTH)).isEqualTo(ProjectionState.FRESH);
        assertThat(health.refreshes).hasValue(1);
    }

    @Test
    void rerunAll_refreshesEveryProjectionOnce() {
        refresher.rerunAll();
        refresher.rerunAll();

        assertThat(refresher.statuses()).extracting(ProjectionStatus::state).containsOnly(ProjectionState.STALE);
        runQueued();

        assertThat(List.of(analysis, portfolio, trading, health)).allSatisfy(p -> assertThat(p.refreshes).hasValue(1));
        assertThat(refresher.statuses()).extracting(ProjectionStatus::state).containsOnly(ProjectionState.FRESH);
    }

    @Test
    void rerun_unknownProjectionIsRejected() {
        assertThatThrownBy(() -> refresher.rerun("unified-weather")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refreshingTwiceForSameEventLeavesSameState() {
        var e = event("portfolio.state.changed", 1);
        refresher.onCommitted(e);
        runQueued();
        var once = refresher.projectionStatus(UNIFIED_PORTFOLIO).orElseThrow();
        int viewOnce = portfolio.view;

        refresher.rerun(UNIFIED_PORTFOLIO);
        runQueued();
        var twice = refresher.projectionStatus(UNIFIED_PORTFOLIO).orElseThrow();

        assertThat(twice.state()).isEqualTo(once.state());
        assertThat(twice.lastProcessedEventId()).isEqualTo(once.lastProcessedEventId());
        assertThat(twice.errorMessage()).isEqualTo(once.errorMessage());
        assertThat(viewOnce).isPositive();
    }

    @Test
    void unmappedEventRefreshesEverything() {
        refresher.onCommitted(event("user.logged.in", 1));
        runQueued();

        assertThat(List.of(analysis, portfolio, trading, health)).allSatisfy(p -> assertThat(p.refreshes).hasValue(1));
    }

    @Test
    void register_keepsPersistedErrorAcrossRestart() {
        var store = new InMemoryProjectionStatusStore();
        store.save(new ProjectionStatus("p", ProjectionState.ERROR, UUID.randomUUID(), Instant.EPOCH, 1, "old failure", Instant.EPOCH));
        var restarted = new ProjectionRefresher(new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.IGNORE),
                store, Runnable::run, clock);

        restarted.register(new CountingProjection("p"));

        assertThat(restarted.projectionStatus("p").orElseThrow().errorMessage()).isEqualTo("old failure");
        assertThat(restarted.projectionStatus("p").orElseThrow().state()).isEqualTo(ProjectionState.ERROR);
    }

    @Test
    void statusStoreFailureDoesNotStopRefresh() {
        var broken = mock(ProjectionStatusStore.class);
        doThrow(new IllegalStateException("db down")).when(broken).save(any());
        var direct = new ProjectionRefresher(new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.IGNORE),
                broken, Runnable::run, clock);
        var p = new CountingProjection(UNIFIED_ANALYSIS);
        direct.register(p);

        direct.onCommitted(event("analysis.state.changed", 1));

        assertThat(p.refreshes).hasValue(1);
        assertThat(direct.projectionStatus(UNIFIED_ANALYSIS).orElseThrow().state()).isEqualTo(ProjectionState.FRESH);
    }

    @Test
    void neverRefreshesSameProjectionConcurrentlyWithItself() throws Exception {
        var pool = Executors.newFixedThreadPool(4);
        try {
            var inFlight = new AtomicInteger();
            var maxInFlight = new AtomicInteger();
            var refreshes = new AtomicInteger();
            var slow = new Projection() {
                @Override public String name() { return "slow"; }
                @Override public void refresh() throws Exception {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    Thread.sleep(2);
                    refreshes.incrementAndGet();
                    inFlight.decrementAndGet();
                }
            };
            var concurrent = new ProjectionRefresher(
                    new ProjectionRouter(Map.of("tick", List.of("slow")), UnmappedEventPolicy.IGNORE),
                    new InMemoryProjectionStatusStore(), pool, clock);
            concurrent.register(slow);

            int producers = 4, perProducer = 50;
            var seq = new AtomicInteger();
            var done = new CountDownLatch(producers);
            var last = new java.util.concurrent.atomic.AtomicReference<EventRecord>();
            var producerPool = Executors.newFixedThreadPool(producers);
            try {
                for (int p = 0; p < producers; p++) {
                    producerPool.execute(() -> {
                        for (int i = 0; i < perProducer; i++) {
                            EventRecord e;
                            synchronized (seq) {
                                e = event("tick", seq.incrementAndGet());
                                last.set(e);
                            }
                            concurrent.onCommitted(e);
                        }
                        done.countDown();
                    });
                }
                assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                producerPool.shutdownNow();
            }

            assertThat(concurrent.awaitIdle(Duration.ofSeconds(10))).isTrue();
            assertThat(maxInFlight).hasValue(1);
            assertThat(refreshes.get()).isBetween(1, producers * perProducer);
            var status = concurrent.projectionStatus("slow").orElseThrow();
            assertThat(status.state()).isEqualTo(ProjectionState.FRESH);
            assertThat(status.lastProcessedEventId()).isEqualTo(last.get().id());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void requestDuringRefreshIsServedAndEndsFresh() {
        var rounds = new AtomicInteger();
        var followUp = event("self.changed", 2);
        var selfFeeding = new Projection() {
            @Override public String name() { return "self"; }
            @Override public void refresh() {
                if (rounds.incrementAndGet() == 1) {
                    refresher.onCommitted(followUp);
                }
            }
        };
        refresher = new ProjectionRefresher(
                new ProjectionRouter(Map.of("self.changed", List.of("self")), UnmappedEventPolicy.IGNORE),
                statusStore, queued::add, clock);
        refresher.register(selfFeeding);

        refresher.onCommitted(event("self.changed", 1));
        runQueued();

        assertThat(rounds).hasValue(2);
        assertThat(state("self")).isEqualTo(ProjectionState.FRESH);
        assertThat(refresher.projectionStatus("self").orElseThrow().lastProcessedEventId()).isEqualTo(followUp.id());
    }

    @Test
    void requestRacingAFinishingRefreshNeverLeavesProjectionStaleWhileIdle() throws Exception {
        var pool = Executors.newFixedThreadPool(2);
        var producer = Executors.newSingleThreadExecutor();
        try {
            var quick = new CountingProjection("quick");
            var racing = new ProjectionRefresher(
                    new ProjectionRouter(Map.of("tick", List.of("quick")), UnmappedEventPolicy.IGNORE),
                    new InMemoryProjectionStatusStore(), pool, clock);
            racing.register(quick);

            for (int round = 1; round <= 300; round++) {
                var first = event("tick", 2L * round - 1);
                var second = event("tick", 2L * round);
                racing.onCommitted(first);
                producer.submit(() -> racing.onCommitted(second)).get(5, TimeUnit.SECONDS);

                assertThat(racing.awaitIdle(Duration.ofSeconds(5))).isTrue();
                assertThat(racing.projectionStatus("quick").orElseThrow().state())
                        .as("round %d", round)
                        .isEqualTo(ProjectionState.FRESH);
            }
        } finally {
            producer.shutdownNow();
            pool.shutdownNow();
        }
    }
}
