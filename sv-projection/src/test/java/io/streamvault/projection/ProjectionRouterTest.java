package io.streamvault.projection;

import io.streamvault.core.EventRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static io.streamvault.projection.ProjectionRouter.*;
import static org.assertj.core.api.Assertions.assertThat;

class ProjectionRouterTest {

    private static final Set<String> ALL = Set.of(UNIFIED_ANALYSIS, UNIFIED_PORTFOLIO, UNIFIED_TRADING, UNIFIED_SYSTEM_HEALTH);

    static EventRecord event(String type, long seq) {
        return new EventRecord(UUID.randomUUID(), "s", "stock", type, 1, seq, Map.of(), Map.of(), Instant.EPOCH);
    }

    @Test
    void defaultTable_routesCrossDomainDependencies() {
        var router = new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.REFRESH_ALL);

        assertThat(router.route(event("analysis.state.changed", 1), ALL)).containsExactly(UNIFIED_ANALYSIS);
        assertThat(router.route(event("portfolio.state.changed", 2), ALL)).containsExactly(UNIFIED_PORTFOLIO, UNIFIED_ANALYSIS);
        assertThat(router.route(event("trading.state.changed", 3), ALL)).containsExactly(UNIFIED_TRADING, UNIFIED_ANALYSIS);
        assertThat(router.route(event("system.alert.raised", 4), ALL)).containsExactly(UNIFIED_SYSTEM_HEALTH);
        assertThat(router.unmappedEventCount()).isZero();
    }

    @Test
    void unmappedType_refreshesAllUnderDefaultPolicyAndIsCounted() {
        var router = new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.REFRESH_ALL);

        assertThat(router.route(event("user.logged.in", 1), ALL)).isEqualTo(ALL);
        assertThat(router.unmappedEventCount()).isEqualTo(1);
        assertThat(router.isMapped("user.logged.in")).isFalse();
    }

    @Test
    void unmappedType_ignoredUnderIgnorePolicy() {
        var router = new ProjectionRouter(ProjectionRouter.defaultRoutes(), UnmappedEventPolicy.IGNORE);

        assertThat(router.route(event("user.logged.in", 1), ALL)).isEmpty();
        assertThat(router.unmappedEventCount()).isEqualTo(1);
    }

    @Test
    void customTableReplacesDefaults() {
        var router = new ProjectionRouter(Map.of("a", Set.of("p1")), UnmappedEventPolicy.IGNORE);

        assertThat(router.route(event("a", 1), Set.of("p1", "p2"))).containsExactly("p1");
        assertThat(router.route(event("analysis.state.changed", 2), Set.of("p1"))).isEmpty();
    }
}
