package io.streamvault.store.replay;

import io.streamvault.core.EventRecord;

import java.util.Map;

/**
 * Folds a stream's events into derived state {@code S}, and converts that state to and from
 * the opaque map a snapshot stores.
 */
public interface Aggregator<S> {

    S initial();

    S apply(S state, EventRecord event);

    Map<String, Object> toSnapshot(S state);

    S fromSnapshot(Map<String, Object> snapshot);
}
