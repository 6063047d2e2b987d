package io.streamvault.core.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TradingStateChanged(
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
        String broker
) implements StatePayload {

    public boolean isFilled() {
        return "filled".equals(state);
    }

    public boolean isExecuted() {
        return "filled".equals(state) || "partially_filled".equals(state);
    }

    /** Cash flow of the order: positive for buys, negative for sells. */
    public BigDecimal netAmount() {
        var value = totalValue == null ? BigDecimal.ZERO : totalValue;
        return "BUY".equalsIgnoreCase(side) ? value : value.negate();
    }
}
