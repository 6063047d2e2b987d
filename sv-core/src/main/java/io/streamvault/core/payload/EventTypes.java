package io.streamvault.core.payload;

/** Event types with a typed payload and a place in the default routing table. */
public final class EventTypes {
    public static final String ANALYSIS_STATE_CHANGED = "analysis.state.changed";
    public static final String PORTFOLIO_STATE_CHANGED = "portfolio.state.changed";
    public static final String TRADING_STATE_CHANGED = "trading.state.changed";
    public static final String SYSTEM_ALERT_RAISED = "system.alert.raised";

    private EventTypes() {}
}
