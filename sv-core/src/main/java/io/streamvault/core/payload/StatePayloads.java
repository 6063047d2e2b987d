package io.streamvault.core.payload;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventRecord;

import java.util.Optional;

/** Decodes the opaque payload of known event types into their {@link StatePayload} variant. */
public final class StatePayloads {

    private StatePayloads() {}

    public static Optional<Class<? extends StatePayload>> typeOf(String eventType) {
        if (eventType == null) return Optional.empty();
        return Optional.ofNullable(switch (eventType) {
            case EventTypes.ANALYSIS_STATE_CHANGED -> AnalysisStateChanged.class;
            case EventTypes.PORTFOLIO_STATE_CHANGED -> PortfolioStateChanged.class;
            case EventTypes.TRADING_STATE_CHANGED -> TradingStateChanged.class;
            case EventTypes.SYSTEM_ALERT_RAISED -> SystemAlertRaised.class;
            default -> null;
        });
    }

    /**
     * Typed payload of {@code event}, or empty when its type has no variant.
     *
     * @throws IllegalArgumentException when the payload does not fit the variant
     */
    public static Optional<StatePayload> decode(ObjectMapper json, EventRecord event) {
        return typeOf(event.eventType()).map(type -> json.convertValue(event.payload(), type));
    }

    public static <T extends StatePayload> Optional<T> decode(ObjectMapper json, EventRecord event, Class<T> type) {
        return decode(json, event).filter(type::isInstance).map(type::cast);
    }
}
