package com.mouse.odds.interceptor;

import okhttp3.*;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs one line per request and one per response with timing. Query strings are left out
 * because they carry API keys.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String target = request.url().host() + request.url().encodedPath();

        log.debug("→ {} {}", request.method(), target);

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FAILED {} {} after {}ms: {}", request.method(), target, totalMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        ResponseBody body = response.body();
        long contentLength = body != null ? body.contentLength() : -1;

        if (response.isSuccessful()) {
            log.debug("← {} {} | {}ms | Size: {} bytes", response.code(), target, totalMs, contentLength);
        } else {
            log.warn("← {} {} | {}ms", response.code(), target, totalMs);
        }
        return response;
    }
}
