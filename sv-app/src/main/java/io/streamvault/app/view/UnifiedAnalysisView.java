package io.streamvault.app.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.AnalysisStateChanged;
import io.streamvault.core.payload.PortfolioStateChanged;
import io.streamvault.core.payload.TradingStateChanged;
import io.streamvault.projection.ProjectionRouter;
import io.streamvault.store.EventLog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

import static io.streamvault.core.payload.EventTypes.*;

/**
 * Per symbol join of the latest completed analysis with the latest portfolio update that lists
 * the symbol among its top performers and the latest filled order for it. Missing sides read
 * as zero.
 */
public final class UnifiedAnalysisView extends EventLogView<String, UnifiedAnalysisView.Row> {

    public record Row(
            String symbol,
            String streamId,
            BigDecimal latestScore,
            String recommendation,
            BigDecimal confidence,
            BigDecimal targetPrice,
            String riskLevel,
            Map<String, Object> technicalIndicators,
            BigDecimal totalReturn,
            BigDecimal sharpeRatio,
            BigDecimal maxDrawdown,
            BigDecimal volatility,
            BigDecimal positionValue,
            BigDecimal quantity,
            BigDecimal avgPrice,
            BigDecimal totalFees,
            Instant analysisUpdated,
            Instant performanceUpdated,
            Instant tradingUpdated,
            Instant lastUpdated
    ) {}

    private record Seen<T>(EventRecord event, T payload) {}

    public UnifiedAnalysisView(EventLog eventLog, ObjectMapper json) {
        super(ProjectionRouter.UNIFIED_ANALYSIS,
                Set.of(ANALYSIS_STATE_CHANGED, PORTFOLIO_STATE_CHANGED, TRADING_STATE_CHANGED), eventLog, json);
    }

    @Override
    protected Map<String, Row> build(List<EventRecord> events) {
        var analyses = new TreeMap<String, Seen<AnalysisStateChanged>>();
        var performance = new HashMap<String, Seen<PortfolioStateChanged>>();
        var fills = new HashMap<String, Seen<TradingStateChanged>>();

        for (var e : events) {
            switch (e.eventType()) {
                case ANALYSIS_STATE_CHANGED -> decode(e, AnalysisStateChanged.class)
                        .filter(a -> a.isCompleted() && a.symbol() != null)
                        .ifPresent(a -> analyses.put(a.symbol(), new Seen<>(e, a)));
                case PORTFOLIO_STATE_CHANGED -> decode(e, PortfolioStateChanged.class)
                        .filter(PortfolioStateChanged::isUpdated)
                        .ifPresent(p -> p.topPerformers().stream()
                                .map(PortfolioStateChanged.TopPerformer::symbol)
                                .filter(Objects::nonNull)
                                .forEach(symbol -> performance.put(symbol, new Seen<>(e, p))));
                case TRADING_STATE_CHANGED -> decode(e, TradingStateChanged.class)
                        .filter(t -> t.isFilled() && t.symbol() != null)
                        .ifPresent(t -> fills.put(t.symbol(), new Seen<>(e, t)));
                default -> { }
            }
        }

        var rows = new LinkedHashMap<String, Row>();
        analyses.forEach((symbol, analysis) -> rows.put(symbol, row(analysis, performance.get(symbol), fills.get(symbol))));
        return rows;
    }

    private static Row row(Seen<AnalysisStateChanged> analysis, Seen<PortfolioStateChanged> perf, Seen<TradingStateChanged> fill) {
        var a = analysis.payload();
        var metrics = perf == null ? null : perf.payload().performanceMetrics();
        var trade = fill == null ? null : fill.payload();

        var last = analysis.event().timestamp();
        if (perf != null && perf.event().timestamp().isAfter(last)) last = perf.event().timestamp();
        if (fill != null && fill.event().timestamp().isAfter(last)) last = fill.event().timestamp();

        return new Row(
                a.symbol(),
                analysis.event().streamId(),
                a.score(),
                a.recommendation(),
                a.confidence(),
                a.targetPrice(),
                a.riskLevel(),
                a.technicalIndicators(),
                orZero(metrics == null ? null : metrics.totalReturn()),
                orZero(metrics == null ? null : metrics.sharpeRatio()),
                orZero(metrics == null ? null : metrics.maxDrawdown()),
                orZero(metrics == null ? null : metrics.volatility()),
                orZero(trade == null ? null : trade.totalValue()),
                orZero(trade == null ? null : trade.filledQuantity()),
                orZero(trade == null ? null : trade.averageFillPrice()),
                orZero(trade == null ? null : trade.fees()),
                analysis.event().timestamp(),
                perf == null ? null : perf.event().timestamp(),
                fill == null ? null : fill.event().timestamp(),
                last);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
