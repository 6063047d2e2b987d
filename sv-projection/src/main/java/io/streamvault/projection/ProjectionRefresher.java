package io.streamvault.projection;

import io.streamvault.core.EventRecord;
import io.streamvault.core.ProjectionState;
import io.streamvault.core.ProjectionStatus;
import io.streamvault.core.error.ProjectionRefreshException;
import io.streamvault.store.CommitListener;
import io.streamvault.store.ProjectionStatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps registered projections current as events commit.
 *
 * Refreshes run on the given executor, never inline with the append. Each projection has at
 * most one refresh in flight; requests that arrive meanwhile collapse into a single follow-up
 * refresh. A failed refresh leaves the projection in {@link ProjectionState#ERROR} with its
 * last good view, and is retried by the next dependent event or by {@link #rerun}.
 */
public final class ProjectionRefresher implements CommitListener {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRefresher.class);

    private final ProjectionRouter router;
    private final ProjectionStatusStore statusStore;
    private final Executor executor;
    private final Clock clock;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public ProjectionRefresher(ProjectionRouter router, ProjectionStatusStore statusStore, Executor executor, Clock clock) {
        this.router = Objects.requireNonNull(router);
        this.statusStore = Objects.requireNonNull(statusStore);
        this.executor = Objects.requireNonNull(executor);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Declares {@code projection}; a status persisted by an earlier run is picked up, including an error. */
    public void register(Projection projection) {
        var name = projection.name();
        var status = statusStore.find(name)
                .map(s -> new ProjectionStatus(name, s.state() == ProjectionState.ERROR ? ProjectionState.ERROR : ProjectionState.FRESH,
                        s.lastProcessedEventId(), s.lastProcessedTimestamp(), projection.schemaVersion(), s.errorMessage(), clock.instant()))
                .orElseGet(() -> ProjectionStatus.declared(name, projection.schemaVersion(), clock.instant()));
        var slot = new Slot(projection, status);
        if (slots.putIfAbsent(name, slot) != null) {
            throw new IllegalArgumentException("projection already registered: " + name);
        }
        persist(status);
        log.info("Registered projection {} (schema v{}, {})", name, projection.schemaVersion(), status.state());
    }

    @Override
    public void onCommitted(EventRecord event) {
        for (var name : router.route(event, Collections.unmodifiableSet(slots.keySet()))) {
            var slot = slots.get(name);
            if (slot == null) {
                log.debug("Route {} -> {} has no registered projection", event.eventType(), name);
                continue;
            }
            request(slot, event);
        }
    }

    /** Administrative re-run of one projection, whatever its state. */
    public void rerun(String name) {
        var slot = slots.get(name);
        if (slot == null) throw new IllegalArgumentException("unknown projection: " + name);
        request(slot, null);
    }

    public void rerunAll() {
        slots.values().forEach(slot -> request(slot, null));
    }

    /** Re-runs every projection currently in {@link ProjectionState#ERROR}; returns how many. */
    public int rerunFailed() {
        int n = 0;
        for (var slot : slots.values()) {
            if (slot.status.state() == ProjectionState.ERROR) {
                request(slot, null);
                n++;
            }
        }
        return n;
    }

    public Optional<ProjectionStatus> projectionStatus(String name) {
        return Optional.ofNullable(slots.get(name)).map(s -> s.status);
    }

    public List<ProjectionStatus> statuses() {
        return slots.values().stream().map(s -> s.status).sorted(Comparator.comparing(ProjectionStatus::name)).toList();
    }

    public Set<String> projectionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(slots.keySet()));
    }

    /** Waits until no refresh is running or pending. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (slots.values().stream().noneMatch(Slot::busy)) return true;
            Thread.sleep(5);
        }
        return slots.values().stream().noneMatch(Slot::busy);
    }

    private void request(Slot slot, EventRecord trigger) {
        if (trigger != null) {
            slot.trigger.accumulateAndGet(trigger, (current, next) ->
                    current == null || next.globalSequence() > current.globalSequence() ? next : current);
        }
        // STALE goes in before the pending flag, so a drain that consumes the flag also sees STALE
        synchronized (slot) {
            var state = slot.status.state();
            if (state == ProjectionState.FRESH || state == ProjectionState.ERROR) {
                transition(slot, slot.status.withState(ProjectionState.STALE, clock.instant()));
            }
        }
        slot.dirty.set(true);
        schedule(slot);
    }

    private void schedule(Slot slot) {
        if (!slot.running.compareAndSet(false, true)) return;
        try {
            executor.execute(() -> drain(slot));
        } catch (RejectedExecutionException ex) {
            slot.running.set(false);
            log.warn("Refresh of {} rejected by executor, left stale: {}", slot.projection.name(), ex.getMessage());
        }
    }

    private void drain(Slot slot) {
        try {
            while (slot.dirty.getAndSet(false)) {
                refreshOnce(slot, slot.trigger.getAndSet(null));
            }
        } finally {
            slot.running.set(false);
        }
        // a request may have slipped in between the last dirty check and clearing running
        if (slot.dirty.get()) schedule(slot);
    }

    private void refreshOnce(Slot slot, EventRecord trigger) {
        var name = slot.projection.name();
        synchronized (slot) {
            transition(slot, slot.status.withState(ProjectionState.REFRESHING, clock.instant()));
        }
        try {
            slot.projection.refresh();
        } catch (Exception ex) {
            var failure = new ProjectionRefreshException(name, String.valueOf(ex.getMessage()), ex);
            log.error("Refresh of projection {} failed; keeping last good view", name, failure);
            synchronized (slot) {
                transition(slot, slot.status.failed(failure.getMessage(), clock.instant()));
            }
            return;
        }
        synchronized (slot) {
            // notifications may arrive out of commit order; never move the marker backwards
            var processed = trigger != null && trigger.globalSequence() > slot.lastSequence ? trigger : null;
            if (processed != null) slot.lastSequence = processed.globalSequence();
            var refreshed = slot.status.refreshed(processed, clock.instant());
            transition(slot, slot.dirty.get() ? refreshed.withState(ProjectionState.STALE, clock.instant()) : refreshed);
        }
        log.debug("Refreshed projection {} after event {}", name, trigger == null ? "-" : trigger.id());
    }

    private void transition(Slot slot, ProjectionStatus next) {
        slot.status = next;
        persist(next);
    }

    private void persist(ProjectionStatus status) {
        try {
            statusStore.save(status);
        } catch (RuntimeException ex) {
            log.warn("Could not persist status of projection {} ({}): {}", status.name(), status.state(), ex.getMessage());
        }
    }

    private static final class Slot {
        final Projection projection;
        final AtomicBoolean dirty = new AtomicBoolean();
        final AtomicBoolean running = new AtomicBoolean();
        final AtomicReference<EventRecord> trigger = new AtomicReference<>();
        volatile ProjectionStatus status;
        long lastSequence; // guarded by the slot monitor

        Slot(Projection projection, ProjectionStatus status) {
            this.projection = projection;
            this.status = status;
        }

        boolean busy() {
            return running.get() || dirty.get();
        }
    }
}
