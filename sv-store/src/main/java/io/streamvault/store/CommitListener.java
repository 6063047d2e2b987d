package io.streamvault.store;

import io.streamvault.core.EventRecord;

/** Told about every event after it has been durably committed. */
@FunctionalInterface
public interface CommitListener {

    void onCommitted(EventRecord event);
}
