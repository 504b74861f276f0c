package com.mouse.odds.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A fully read upstream response. Header names are lower-cased.
 */
@Value
@Builder
public class ApiResponse {
    int statusCode;
    String body;
    @Singular
    Map<String, String> headers;
    long durationMs;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase());
    }
}
