package io.streamvault.core.payload;

/**
 * Typed view of the payloads the engine knows about. Payloads of any other event type
 * stay opaque maps checked by their registered JSON schema.
 */
public sealed interface StatePayload
        permits AnalysisStateChanged, PortfolioStateChanged, TradingStateChanged, SystemAlertRaised {

    /** Lifecycle state carried by the event, e.g. {@code completed} or {@code filled}. */
    String state();
}
