package com.mouse.odds.exception;

import lombok.Getter;

/**
 * Upstream answered with a non-2xx status.
 */
@Getter
public class UpstreamHttpException extends RuntimeException {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final String sourceId;
    private final int statusCode;
    private final String responseBody;

    public UpstreamHttpException(String sourceId, int statusCode, String responseBody) {
        super(String.format("%s responded with HTTP %d%s", sourceId, statusCode, abbreviate(responseBody)));
        this.sourceId = sourceId;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    public boolean isTooManyRequests() {
        return statusCode == 429;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_BODY_IN_MESSAGE ? trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "..." : trimmed);
    }
}
