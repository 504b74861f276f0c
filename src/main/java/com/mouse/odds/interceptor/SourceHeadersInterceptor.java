package com.mouse.odds.interceptor;

import com.mouse.odds.config.SourceConfig;
import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;

import java.io.IOException;

/**
 * Stamps the default client headers and the source's static headers onto every request.
 */
@RequiredArgsConstructor
public class SourceHeadersInterceptor implements Interceptor {

    static final String DEFAULT_USER_AGENT = "Fight-Odds-Signals/1.0.0";

    private final SourceConfig sourceConfig;

    @Override
    public okhttp3.Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request.Builder builder = original.newBuilder()
                .header("User-Agent", DEFAULT_USER_AGENT)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json");

        // Source headers win over the defaults (some providers reject unknown agents)
        sourceConfig.getHeaders().forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                builder.header(key, value);
            }
        });

        return chain.proceed(builder.build());
    }
}
