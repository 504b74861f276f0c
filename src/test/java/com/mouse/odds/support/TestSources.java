package com.mouse.odds.support;

import com.mouse.odds.config.SourceConfig;

/**
 * Source settings shared by the resilience tests.
 */
public final class TestSources {

    private TestSources() {
    }

    public static SourceConfig.SourceConfigBuilder oddsApi() {
        return SourceConfig.builder()
                .sourceId("the-odds-api")
                .name("The Odds API")
                .baseUrl("https://api.the-odds-api.com/v4")
                .endpoint("odds", "/sports/{sport}/odds")
                .endpoint("eventOdds", "/sports/{sport}/events/{eventId}/odds")
                .endpoint("usage", "/sports/{sport}/odds/usage")
                .requestsPerMinute(50)
                .requestsPerHour(500)
                .maxRetries(3)
                .backoffMultiplier(2.0)
                .maxBackoffMs(15_000)
                .baseDelayMs(1000)
                .failureThreshold(5)
                .resetTimeoutMs(60_000)
                .requestTimeoutMs(30_000);
    }
}
