package io.streamvault.projection;

import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.EventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps a committed event's type to the projections that depend on it.
 *
 * A projection that aggregates several event types appears under each of them, so any one of
 * them changing makes it stale.
 */
public final class ProjectionRouter {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRouter.class);

    public static final String UNIFIED_ANALYSIS = "unified-analysis";
    public static final String UNIFIED_PORTFOLIO = "unified-portfolio";
    public static final String UNIFIED_TRADING = "unified-trading";
    public static final String UNIFIED_SYSTEM_HEALTH = "unified-system-health";

    private final Map<String, Set<String>> routes;
    private final UnmappedEventPolicy unmappedPolicy;
    private final AtomicLong unmapped = new AtomicLong();

    public ProjectionRouter(Map<String, ? extends Collection<String>> routes, UnmappedEventPolicy unmappedPolicy) {
        var copy = new LinkedHashMap<String, Set<String>>();
        routes.forEach((type, names) -> copy.put(type, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
        this.routes = Collections.unmodifiableMap(copy);
        this.unmappedPolicy = Objects.requireNonNull(unmappedPolicy);
    }

    /** Routing of the stock analysis read models. */
    public static Map<String, List<String>> defaultRoutes() {
        var table = new LinkedHashMap<String, List<String>>();
        table.put(EventTypes.ANALYSIS_STATE_CHANGED, List.of(UNIFIED_ANALYSIS));
        table.put(EventTypes.PORTFOLIO_STATE_CHANGED, List.of(UNIFIED_PORTFOLIO, UNIFIED_ANALYSIS));
        table.put(EventTypes.TRADING_STATE_CHANGED, List.of(UNIFIED_TRADING, UNIFIED_ANALYSIS));
        table.put(EventTypes.SYSTEM_ALERT_RAISED, List.of(UNIFIED_SYSTEM_HEALTH));
        return table;
    }

    /**
     * Projections to refresh for {@code event}.
     *
     * @param registered every projection name known to the caller, used by {@link UnmappedEventPolicy#REFRESH_ALL}
     */
    public Set<String> route(EventRecord event, Set<String> registered) {
        var mapped = routes.get(event.eventType());
        if (mapped != null) return mapped;

        long count = unmapped.incrementAndGet();
        if (unmappedPolicy == UnmappedEventPolicy.IGNORE) {
            log.warn("Unmapped event type {} (event={}), ignored by policy; {} unmapped so far",
                    event.eventType(), event.id(), count);
            return Set.of();
        }
        log.warn("Unmapped event type {} (event={}), refreshing all {} projections; {} unmapped so far",
                event.eventType(), event.id(), registered.size(), count);
        return registered;
    }

    public boolean isMapped(String eventType) {
        return routes.containsKey(eventType);
    }

    public Map<String, Set<String>> routes() {
        return routes;
    }

    public UnmappedEventPolicy unmappedPolicy() {
        return unmappedPolicy;
    }

    /** Number of events routed through the unmapped fallback since start. */
    public long unmappedEventCount() {
        return unmapped.get();
    }
}
