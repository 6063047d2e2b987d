package io.streamvault.app.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.PortfolioStateChanged;
import io.streamvault.projection.ProjectionRouter;
import io.streamvault.store.EventLog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

import static io.streamvault.core.payload.EventTypes.PORTFOLIO_STATE_CHANGED;

/** Latest {@code updated} state per portfolio. */
public final class UnifiedPortfolioView extends EventLogView<String, UnifiedPortfolioView.Row> {

    public record Row(
            String portfolioId,
            PortfolioStateChanged.PerformanceMetrics performanceMetrics,
            List<PortfolioStateChanged.TopPerformer> topPerformers,
            Map<String, Object> riskAssessment,
            List<Object> rebalancingSuggestions,
            Instant lastUpdated,
            BigDecimal totalReturn,
            BigDecimal sharpeRatio,
            BigDecimal maxDrawdown
    ) {}

    public UnifiedPortfolioView(EventLog eventLog, ObjectMapper json) {
        super(ProjectionRouter.UNIFIED_PORTFOLIO, Set.of(PORTFOLIO_STATE_CHANGED), eventLog, json);
    }

    @Override
    protected Map<String, Row> build(List<EventRecord> events) {
        var rows = new TreeMap<String, Row>();
        for (var e : events) {
            decode(e, PortfolioStateChanged.class)
                    .filter(p -> p.isUpdated() && p.portfolioId() != null)
                    .ifPresent(p -> {
                        var m = p.performanceMetrics();
                        rows.put(p.portfolioId(), new Row(p.portfolioId(), m, p.topPerformers(), p.riskAssessment(),
                                p.rebalancingSuggestions(), e.timestamp(),
                                m == null ? null : m.totalReturn(),
                                m == null ? null : m.sharpeRatio(),
                                m == null ? null : m.maxDrawdown()));
                    });
        }
        return rows;
    }
}
