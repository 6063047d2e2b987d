package io.streamvault.core.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PortfolioStateChanged(
        String portfolioId,
        String state,
        PerformanceMetrics performanceMetrics,
        List<TopPerformer> topPerformers,
        Map<String, Object> riskAssessment,
        List<Object> rebalancingSuggestions
) implements StatePayload {

    public PortfolioStateChanged {
        topPerformers = topPerformers == null ? List.of() : topPerformers;
    }

    public boolean isUpdated() {
        return "updated".equals(state);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PerformanceMetrics(
            BigDecimal totalReturn,
            BigDecimal sharpeRatio,
            BigDecimal maxDrawdown,
            BigDecimal volatility
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TopPerformer(String symbol) {}
}
