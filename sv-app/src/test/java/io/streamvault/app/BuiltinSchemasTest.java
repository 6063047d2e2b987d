package io.streamvault.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventTypeRegistration;
import io.streamvault.core.payload.EventTypes;
import io.streamvault.store.memory.InMemorySchemaRegistry;
import io.streamvault.store.schema.PayloadSchemaValidator;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinSchemasTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void shipsASchemaForEveryTypedEvent() {
        assertThat(BuiltinSchemas.load(json)).extracting(EventTypeRegistration::eventType)
                .containsExactlyInAnyOrder(EventTypes.ANALYSIS_STATE_CHANGED, EventTypes.PORTFOLIO_STATE_CHANGED,
                        EventTypes.TRADING_STATE_CHANGED, EventTypes.SYSTEM_ALERT_RAISED);
    }

    @Test
    void registerMissing_keepsOperatorRegistrations() {
        var registry = new InMemorySchemaRegistry();
        var custom = new EventTypeRegistration(EventTypes.SYSTEM_ALERT_RAISED, 3, Map.of("type", "object"), "custom");
        registry.register(custom);

        assertThat(BuiltinSchemas.registerMissing(registry, json)).isEqualTo(3);
        assertThat(registry.lookup(EventTypes.SYSTEM_ALERT_RAISED)).contains(custom);
        assertThat(BuiltinSchemas.registerMissing(registry, json)).isZero();
    }

    @Test
    void tradingSchemaRejectsUnknownSide() {
        var registry = new InMemorySchemaRegistry();
        BuiltinSchemas.registerMissing(registry, json);
        var validator = new PayloadSchemaValidator(registry, json);
        var trading = registry.lookup(EventTypes.TRADING_STATE_CHANGED).orElseThrow();

        var violations = validator.violations(trading,
                Map.of("order_id", "o1", "symbol", "AAPL", "side", "HOLD", "state", "filled"));

        assertThat(violations).containsExactly("payload.side must be one of [\"BUY\",\"SELL\"]");
        assertThat(validator.violations(trading,
                Map.of("order_id", "o1", "symbol", "AAPL", "side", "SELL", "state", "filled", "fees", 0.5))).isEmpty();
    }

    @Test
    void shippedSchemasOnlyUseEnforcedKeywords() {
        assertThat(BuiltinSchemas.load(json))
                .allSatisfy(r -> assertThat(PayloadSchemaValidator.unsupportedKeywords(r.jsonSchema()))
                        .as(r.eventType()).isEmpty());
    }
}
