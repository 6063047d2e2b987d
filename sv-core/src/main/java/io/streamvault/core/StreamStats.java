package io.streamvault.core;

import java.time.Instant;

/** Per stream type counters over the hot log. */
public record StreamStats(
        String streamType,
        long uniqueStreams,
        long totalEvents,
        long maxVersion,
        Instant firstEvent,
        Instant lastEvent
) {}
