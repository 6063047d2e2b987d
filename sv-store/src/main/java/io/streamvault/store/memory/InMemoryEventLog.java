package io.streamvault.store.memory;

import io.streamvault.core.ArchiveResult;
import io.streamvault.core.EventRecord;
import io.streamvault.core.NewEvent;
import io.streamvault.core.StreamStats;
import io.streamvault.core.error.ConcurrencyConflictException;
import io.streamvault.store.EventLog;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Heap backed {@link EventLog}.
 *
 * Each stream has its own monitor guarding version check and write. The global sequence is
 * allocated and published to the global index inside one short critical section, so readers of
 * {@link #readAll} never observe a sequence before all lower ones are visible.
 */
public final class InMemoryEventLog implements EventLog {

    private final ConcurrentHashMap<String, StreamSlot> streams = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, EventRecord> global = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, EventRecord>> archive = new ConcurrentHashMap<>();
    private final Object allocation = new Object();
    private final Clock clock;
    private long lastSequence; // guarded by allocation

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public List<EventRecord> append(String streamId, List<NewEvent> events, Long expectedVersion) {
        if (events == null || events.isEmpty()) return List.of();
        for (var e : events) {
            if (!streamId.equals(e.streamId())) {
                throw new IllegalArgumentException("event for stream " + e.streamId() + " in batch for " + streamId);
            }
        }
        var slot = streams.computeIfAbsent(streamId, k -> new StreamSlot());
        synchronized (slot) {
            if (expectedVersion != null && expectedVersion != slot.version) {
                throw new ConcurrencyConflictException(streamId, expectedVersion, slot.version);
            }
            var at = clock.instant();
            var committed = new ArrayList<EventRecord>(events.size());
            synchronized (allocation) {
                long version = slot.version;
                for (var e : events) {
                    var record = EventRecord.committed(e, UUID.randomUUID(), ++version, ++lastSequence, at);
                    global.put(record.globalSequence(), record);
                    committed.add(record);
                }
            }
            slot.events.addAll(committed);
            slot.version += committed.size();
            return List.copyOf(committed);
        }
    }

    @Override
    public long currentVersion(String streamId) {
        var slot = streams.get(streamId);
        if (slot == null) return 0;
        synchronized (slot) {
            return slot.version;
        }
    }

    @Override
    public List<EventRecord> readStream(String streamId, long fromVersion) {
        var slot = streams.get(streamId);
        if (slot == null) return List.of();
        synchronized (slot) {
            return slot.events.stream().filter(e -> e.version() >= fromVersion).toList();
        }
    }

    @Override
    public List<EventRecord> readArchivedStream(String streamId, long fromVersion) {
        var cold = archive.get(streamId);
        if (cold == null) return List.of();
        return List.copyOf(cold.tailMap(fromVersion, true).values());
    }

    @Override
    public List<EventRecord> readAll(long afterGlobalSequence, int limit) {
        if (limit <= 0) return List.of();
        return global.tailMap(afterGlobalSequence, false).values().stream().limit(limit).toList();
    }

    @Override
    public long lastGlobalSequence() {
        synchronized (allocation) {
            return lastSequence;
        }
    }

    @Override
    public ArchiveResult archiveBefore(Instant cutoff) {
        int moved = 0;
        for (var entry : streams.entrySet()) {
            var slot = entry.getValue();
            synchronized (slot) {
                var it = slot.events.iterator();
                while (it.hasNext()) {
                    var e = it.next();
                    if (!e.timestamp().isBefore(cutoff)) continue;
                    archive.computeIfAbsent(entry.getKey(), k -> new ConcurrentSkipListMap<>()).put(e.version(), e);
                    global.remove(e.globalSequence());
                    it.remove();
                    moved++;
                }
            }
        }
        return ArchiveResult.complete(cutoff, moved);
    }

    @Override
    public List<StreamStats> streamStats() {
        var byType = global.values().stream().collect(Collectors.groupingBy(EventRecord::streamType, TreeMap::new, Collectors.toList()));
        var stats = new ArrayList<StreamStats>();
        byType.forEach((type, events) -> stats.add(new StreamStats(
                type,
                events.stream().map(EventRecord::streamId).distinct().count(),
                events.size(),
                events.stream().mapToLong(EventRecord::version).max().orElse(0),
                events.stream().map(EventRecord::timestamp).min(Comparator.naturalOrder()).orElse(null),
                events.stream().map(EventRecord::timestamp).max(Comparator.naturalOrder()).orElse(null))));
        stats.sort(Comparator.comparingLong(StreamStats::totalEvents).reversed());
        return stats;
    }

    private static final class StreamSlot {
        final List<EventRecord> events = new ArrayList<>();
        long version;
    }
}
