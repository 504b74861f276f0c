package com.mouse.odds.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RateLimitWindow {
    MINUTE("minute", 60_000L),
    HOUR("hour", 3_600_000L);

    private final String label;
    private final long lengthMs;
}
