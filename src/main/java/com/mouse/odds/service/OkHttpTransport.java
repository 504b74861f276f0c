package com.mouse.odds.service;

import com.mouse.odds.interfaces.HttpTransport;
import com.mouse.odds.model.ApiResponse;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Sends a request on the given client and reads the whole body before returning.
 * Timeouts come from the client (each source gets its own call timeout).
 */
@RequiredArgsConstructor
public class OkHttpTransport implements HttpTransport {

    private final OkHttpClient client;

    @Override
    public ApiResponse send(Request request) throws IOException {
        long startNs = System.nanoTime();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            ApiResponse.ApiResponseBuilder builder = ApiResponse.builder()
                    .statusCode(response.code())
                    .body(body != null ? body.string() : "");

            // Repeated headers keep the last value
            for (String name : response.headers().names()) {
                builder.header(name.toLowerCase(Locale.ROOT), response.header(name));
            }

            return builder
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs))
                    .build();
        }
    }
}
