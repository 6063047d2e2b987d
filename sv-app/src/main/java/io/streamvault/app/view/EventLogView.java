package io.streamvault.app.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.StatePayload;
import io.streamvault.core.payload.StatePayloads;
import io.streamvault.projection.Projection;
import io.streamvault.store.EventLog;

import java.util.*;

/**
 * Heap read model rebuilt from the hot event log on every refresh.
 *
 * The new rows are computed off to the side and swapped in with one volatile write; a refresh
 * that throws leaves the previous rows in place.
 */
public abstract class EventLogView<K, R> implements Projection {
    static final int PAGE = 500;

    private final String name;
    private final Set<String> eventTypes;
    private final EventLog eventLog;
    protected final ObjectMapper json;
    private volatile Map<K, R> rows = Map.of();

    protected EventLogView(String name, Set<String> eventTypes, EventLog eventLog, ObjectMapper json) {
        this.name = Objects.requireNonNull(name);
        this.eventTypes = Set.copyOf(eventTypes);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.json = Objects.requireNonNull(json);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void refresh() {
        var relevant = new ArrayList<EventRecord>();
        long after = 0;
        while (true) {
            var page = eventLog.readAll(after, PAGE);
            for (var e : page) {
                if (eventTypes.contains(e.eventType())) relevant.add(e);
            }
            if (page.size() < PAGE) break;
            after = page.get(page.size() - 1).globalSequence();
        }
        rows = Collections.unmodifiableMap(build(relevant));
    }

    /** Rows of the view for {@code events}, which arrive in global order. */
    protected abstract Map<K, R> build(List<EventRecord> events);

    protected <T extends StatePayload> Optional<T> decode(EventRecord event, Class<T> type) {
        return StatePayloads.decode(json, event, type);
    }

    public Map<K, R> rows() {
        return rows;
    }

    public Optional<R> row(K key) {
        return Optional.ofNullable(rows.get(key));
    }
}
