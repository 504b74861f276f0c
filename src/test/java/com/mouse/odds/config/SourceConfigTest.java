package com.mouse.odds.config;

import com.mouse.odds.support.TestSources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceConfigTest {

    private final SourceConfig config = TestSources.oddsApi().build();

    @Test
    @DisplayName("endpointUrl_substitutesPathParameters")
    void endpointUrl_substitutesPathParameters() {
        String url = config.endpointUrl("eventOdds", Map.of("sport", "mma_mixed_martial_arts", "eventId", "e1"));

        assertThat(url).isEqualTo("https://api.the-odds-api.com/v4/sports/mma_mixed_martial_arts/events/e1/odds");
    }

    @Test
    @DisplayName("endpointUrl_encodesParameterValues")
    void endpointUrl_encodesParameterValues() {
        String url = config.endpointUrl("odds", Map.of("sport", "a/b"));

        assertThat(url).isEqualTo("https://api.the-odds-api.com/v4/sports/a%2Fb/odds");
    }

    @Test
    @DisplayName("endpointUrl_unknownEndpoint_throws")
    void endpointUrl_unknownEndpoint_throws() {
        assertThatThrownBy(() -> config.endpointUrl("scores", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Endpoint 'scores' not found for source 'the-odds-api'");
    }

    @Test
    @DisplayName("endpointUrl_missingParameter_throws")
    void endpointUrl_missingParameter_throws() {
        Map<String, String> params = new HashMap<>();
        params.put("sport", "mma_mixed_martial_arts");

        assertThatThrownBy(() -> config.endpointUrl("eventOdds", params))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unresolved path parameter");
    }

    @Test
    @DisplayName("hasApiKey_blankKeyCountsAsAbsent")
    void hasApiKey_blankKeyCountsAsAbsent() {
        assertThat(config.hasApiKey()).isFalse();
        assertThat(config.toBuilder().apiKey("  ").build().hasApiKey()).isFalse();
        assertThat(config.toBuilder().apiKey("k").build().hasApiKey()).isTrue();
    }
}
