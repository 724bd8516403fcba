package com.quantcore.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SignalTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void errorSignalIsZeroConfidenceHold() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");

        Signal signal = Signal.error("BTCUSD", "RSI", at, new IllegalStateException("boom"));

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getConfidence()).isZero();
        assertThat(signal.getReason()).isEqualTo("Error: boom");
        assertThat(signal.getTimestamp()).isEqualTo(at);
        assertThat(signal.isActionable()).isFalse();
    }

    @Test
    void serializesWithoutNullLevelsOrHelpers() throws Exception {
        Signal hold = Signal.builder()
                .symbol("BTCUSD")
                .strategy("RSI")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .action(SignalAction.HOLD)
                .confidence(0.4)
                .reason("RSI: 50.0 (NEUTRAL)")
                .entryPrice(100)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(hold));

        assertThat(json.has("stopLoss")).isFalse();
        assertThat(json.has("takeProfit")).isFalse();
        assertThat(json.has("actionable")).isFalse();
        assertThat(json.get("action").asText()).isEqualTo("HOLD");
        assertThat(json.get("confidence").asDouble()).isEqualTo(0.4);
    }
}
