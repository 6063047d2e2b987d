package io.streamvault.store.pg;

import io.streamvault.projection.Projection;
import io.streamvault.projection.ProjectionRouter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * A projection backed by a Postgres materialized view.
 *
 * {@code REFRESH ... CONCURRENTLY} swaps the new contents in atomically, so readers keep the old
 * rows while a refresh runs or after it fails. It needs a unique index on every view.
 */
public final class MaterializedViewProjection implements Projection {

    /** Projection name to view name for the four unified read models. */
    public static final Map<String, String> UNIFIED_VIEWS = Map.of(
            ProjectionRouter.UNIFIED_ANALYSIS, "stock_analysis_unified",
            ProjectionRouter.UNIFIED_PORTFOLIO, "portfolio_unified",
            ProjectionRouter.UNIFIED_TRADING, "trading_activity_unified",
            ProjectionRouter.UNIFIED_SYSTEM_HEALTH, "system_health_unified");

    private final String name;
    private final String view;
    private final JdbcTemplate jdbc;

    public MaterializedViewProjection(String name, String view, JdbcTemplate jdbc) {
        this.name = Objects.requireNonNull(name);
        if (!view.matches("[a-z_][a-z0-9_]*")) {
            throw new IllegalArgumentException("not a plain view name: " + view);
        }
        this.view = view;
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    /** The unified read model called {@code name}, backed by its view from {@link #UNIFIED_VIEWS}. */
    public static MaterializedViewProjection unified(String name, JdbcTemplate jdbc) {
        var view = UNIFIED_VIEWS.get(name);
        if (view == null) throw new IllegalArgumentException("no unified view for projection " + name);
        return new MaterializedViewProjection(name, view, jdbc);
    }

    @Override
    public String name() {
        return name;
    }

    public String view() {
        return view;
    }

    @Override
    public void refresh() {
        jdbc.execute("REFRESH MATERIALIZED VIEW CONCURRENTLY " + view);
    }
}
