package io.streamvault.app.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;
import io.streamvault.core.payload.SystemAlertRaised;
import io.streamvault.projection.ProjectionRouter;
import io.streamvault.store.EventLog;

import java.time.Instant;
import java.util.*;

import static io.streamvault.core.payload.EventTypes.SYSTEM_ALERT_RAISED;

/** Latest alert per alert type with its health score. */
public final class UnifiedSystemHealthView extends EventLogView<String, UnifiedSystemHealthView.Row> {

    public record Row(
            String alertType,
            String severity,
            String message,
            List<String> affectedServices,
            Map<String, Object> metrics,
            String resolutionStatus,
            Instant alertTime,
            int healthScore
    ) {}

    public UnifiedSystemHealthView(EventLog eventLog, ObjectMapper json) {
        super(ProjectionRouter.UNIFIED_SYSTEM_HEALTH, Set.of(SYSTEM_ALERT_RAISED), eventLog, json);
    }

    @Override
    protected Map<String, Row> build(List<EventRecord> events) {
        var rows = new TreeMap<String, Row>();
        for (var e : events) {
            decode(e, SystemAlertRaised.class)
                    .filter(a -> a.alertType() != null)
                    .ifPresent(a -> rows.put(a.alertType(), new Row(a.alertType(), a.severity(), a.message(),
                            a.affectedServices(), a.metrics(), a.resolutionStatus(), e.timestamp(), a.healthScore())));
        }
        return rows;
    }

    /** Lowest score across alert types, 100 when there are none. */
    public int overallHealth() {
        return rows().values().stream().mapToInt(Row::healthScore).min().orElse(100);
    }
}
