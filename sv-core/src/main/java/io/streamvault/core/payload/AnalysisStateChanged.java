package io.streamvault.core.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisStateChanged(
        String symbol,
        String state,
        BigDecimal score,
        String recommendation,
        BigDecimal confidence,
        BigDecimal targetPrice,
        String riskLevel,
        Map<String, Object> technicalIndicators
) implements StatePayload {

    public boolean isCompleted() {
        return "completed".equals(state);
    }
}
