package com.mouse.odds.config;

import com.mouse.odds.interceptor.SimpleHttpLoggingInterceptor;
import com.mouse.odds.resilience.Sleeper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HttpClientConfig {

    @Value("${http.connect-timeout:PT10S}")
    private Duration connectTimeout;

    @Value("${http.connection-pool.size:20}")
    private int connectionPoolSize;

    @Value("${http.log-requests:true}")
    private boolean logRequests;

    /**
     * Shared client. Each source derives its own via {@code newBuilder()} to get its call timeout
     * and headers while reusing this connection pool.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .connectionPool(new ConnectionPool(connectionPoolSize, 5, TimeUnit.MINUTES))
                .retryOnConnectionFailure(false);

        if (logRequests) {
            builder.addInterceptor(new SimpleHttpLoggingInterceptor());
        }
        return builder.build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
