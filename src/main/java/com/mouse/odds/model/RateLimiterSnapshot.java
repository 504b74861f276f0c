package com.mouse.odds.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RateLimiterSnapshot {
    int requestsThisMinute;
    int requestsThisHour;
    int requestsPerMinute;
    int requestsPerHour;
    Instant minuteWindowStart;   // oldest call still counted in the minute window, null when empty
    Instant hourWindowStart;
}
