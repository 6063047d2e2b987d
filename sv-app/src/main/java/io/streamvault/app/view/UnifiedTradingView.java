package io.streamvault.app.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.TradingStateChanged;
import io.streamvault.projection.ProjectionRouter;
import io.streamvault.store.EventLog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

import static io.streamvault.core.payload.EventTypes.TRADING_STATE_CHANGED;

/** One row per filled or partially filled execution, keyed by event id. */
public final class UnifiedTradingView extends EventLogView<UUID, UnifiedTradingView.Row> {

    public record Row(
            UUID eventId,
            String orderId,
            String symbol,
            String side,
            String state,
            BigDecimal quantity,
            BigDecimal price,
            BigDecimal filledQuantity,
            BigDecimal averageFillPrice,
            BigDecimal totalValue,
            BigDecimal fees,
            String broker,
            Instant executionTime,
            BigDecimal netAmount
    ) {}

    public UnifiedTradingView(EventLog eventLog, ObjectMapper json) {
        super(ProjectionRouter.UNIFIED_TRADING, Set.of(TRADING_STATE_CHANGED), eventLog, json);
    }

    @Override
    protected Map<UUID, Row> build(List<EventRecord> events) {
        var rows = new LinkedHashMap<UUID, Row>();
        for (var e : events) {
            decode(e, TradingStateChanged.class)
                    .filter(t -> t.isExecuted() && t.orderId() != null)
                    .ifPresent(t -> rows.put(e.id(), new Row(e.id(), t.orderId(), t.symbol(), t.side(), t.state(),
                            t.quantity(), t.price(), t.filledQuantity(), t.averageFillPrice(), t.totalValue(),
                            t.fees(), t.broker(), e.timestamp(), t.netAmount())));
        }
        return rows;
    }

    public List<Row> bySymbol(String symbol) {
        return rows().values().stream()
                .filter(r -> symbol.equals(r.symbol()))
                .sorted(Comparator.comparing(Row::executionTime).reversed())
                .toList();
    }
}
