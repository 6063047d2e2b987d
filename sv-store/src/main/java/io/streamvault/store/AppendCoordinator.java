package io.streamvault.store;

import io.streamvault.core.EventRecord;
import io.streamvault.core.NewEvent;
import io.streamvault.core.error.EventStoreException;
import io.streamvault.core.error.StorageFailureException;
import io.streamvault.store.schema.PayloadSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single mutation entry point: validates payloads, commits through the {@link EventLog}
 * and tells {@link CommitListener}s about every committed event.
 */
public final class AppendCoordinator {
    private static final Logger log = LoggerFactory.getLogger(AppendCoordinator.class);

    private final EventLog eventLog;
    private final PayloadSchemaValidator validator;
    private final List<CommitListener> listeners = new CopyOnWriteArrayList<>();

    public AppendCoordinator(EventLog eventLog, PayloadSchemaValidator validator) {
        this.eventLog = Objects.requireNonNull(eventLog);
        this.validator = Objects.requireNonNull(validator);
    }

    public void addListener(CommitListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(CommitListener listener) {
        listeners.remove(listener);
    }

    public EventRecord append(String streamId, String streamType, String eventType,
                              Map<String, Object> payload, Map<String, Object> metadata, Long expectedVersion) {
        return append(new NewEvent(streamId, streamType, eventType, payload, metadata), expectedVersion);
    }

    /**
     * @param expectedVersion the version the caller last saw, or {@code null} to append unconditionally
     * @return the committed event; its {@code id()} identifies it from now on
     */
    public EventRecord append(NewEvent event, Long expectedVersion) {
        return appendAll(event.streamId(), List.of(event), expectedVersion).get(0);
    }

    /** Commits {@code events} to one stream atomically: all of them with contiguous versions, or none. */
    public List<EventRecord> appendAll(String streamId, List<NewEvent> events, Long expectedVersion) {
        if (events == null || events.isEmpty()) return List.of();
        for (var e : events) {
            validator.validate(e.eventType(), e.payload());
        }

        List<EventRecord> committed;
        try {
            committed = eventLog.append(streamId, events, expectedVersion);
        } catch (EventStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageFailureException("append to stream " + streamId + " failed", e);
        }

        log.debug("Committed {} event(s) to {} up to version {}", committed.size(), streamId,
                committed.get(committed.size() - 1).version());
        committed.forEach(this::notifyListeners);
        return committed;
    }

    public long currentVersion(String streamId) {
        return eventLog.currentVersion(streamId);
    }

    public List<EventRecord> readStream(String streamId, long fromVersion) {
        return eventLog.readStream(streamId, fromVersion);
    }

    private void notifyListeners(EventRecord event) {
        for (var listener : listeners) {
            try {
                listener.onCommitted(event);
            } catch (RuntimeException ex) {
                log.warn("Commit listener failed for event={} type={}: {}",
                        event.id(), event.eventType(), ex.getMessage());
            }
        }
    }
}
