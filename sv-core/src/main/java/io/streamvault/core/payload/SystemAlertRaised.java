package io.streamvault.core.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SystemAlertRaised(
        String alertType,
        String severity,
        String message,
        List<String> affectedServices,
        Map<String, Object> metrics,
        String resolutionStatus
) implements StatePayload {

    /** Alert has no lifecycle state of its own; the resolution status stands in. */
    @Override
    public String state() {
        return resolutionStatus;
    }

    /** 0-100, higher is healthier. */
    public int healthScore() {
        if (severity == null) return 0;
        return switch (severity.toUpperCase()) {
            case "INFO" -> 100;
            case "WARNING" -> 75;
            case "ERROR" -> 50;
            case "CRITICAL" -> 25;
            default -> 0;
        };
    }
}
